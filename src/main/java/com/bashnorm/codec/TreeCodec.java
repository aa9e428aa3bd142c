package com.bashnorm.codec;

import com.bashnorm.ast.ArgType;
import com.bashnorm.ast.ArgumentNode;
import com.bashnorm.ast.CommandNode;
import com.bashnorm.ast.FlagNode;
import com.bashnorm.ast.HeadCommandNode;
import com.bashnorm.ast.NodeKind;
import com.bashnorm.ast.RootNode;
import com.bashnorm.normalize.ArgumentTypeResolver;
import com.bashnorm.normalize.NormalizerOptions;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts command trees to and from flat symbol sequences.
 * <p>
 * Every node is written as {@code KIND_value} followed by its children and then
 * {@link #NO_EXPAND}, which closes the node. Argument types are not part of the sequence and are
 * derived again when decoding. Trees deeper than the configured depth are rejected in both
 * directions.
 */
public class TreeCodec {
    private static final Logger logger = LoggerFactory.getLogger(TreeCodec.class);

    public static final String NO_EXPAND = "<NO_EXPAND>";

    private final ArgumentTypeResolver types;
    private final int maxDepth;

    public TreeCodec(ArgumentTypeResolver types) {
        this(types, NormalizerOptions.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth deepest node accepted, counted in edges from the root
     */
    public TreeCodec(ArgumentTypeResolver types, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.types = types;
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public ImmutableList<String> linearize(CommandNode node) {
        MutableList<String> symbols = Lists.mutable.empty();
        linearize(node, symbols, 0);
        return symbols.toImmutable();
    }

    private void linearize(CommandNode node, MutableList<String> symbols, int depth) {
        checkDepth(depth, node.symbol());
        symbols.add(node.symbol());
        for (CommandNode child : node.children()) {
            linearize(child, symbols, depth + 1);
        }
        symbols.add(NO_EXPAND);
    }

    /**
     * Rebuilds a tree from a sequence produced by {@link #linearize(CommandNode)}. Symbols after
     * the root node is closed are ignored.
     *
     * @throws IllegalArgumentException if the sequence does not start with the root symbol,
     *                                  contains a malformed symbol or nests too deeply
     */
    public RootNode delinearize(ListIterable<String> symbols) {
        String rootSymbol = NodeKind.ROOT.symbolName() + CommandNode.SYMBOL_SEPARATOR;
        if (symbols.isEmpty() || !symbols.get(0).equals(rootSymbol)) {
            throw new IllegalArgumentException("Symbol sequence must start with " + rootSymbol);
        }
        RootNode root = new RootNode();
        CommandNode current = root;
        int depth = 0;
        for (int i = 1; i < symbols.size() && current != null; i++) {
            String symbol = symbols.get(i);
            if (symbol.equals(NO_EXPAND)) {
                current = current.parent();
                depth--;
                continue;
            }
            checkDepth(depth + 1, symbol);
            CommandNode node = decode(symbol, current);
            current.appendChild(node);
            current = node;
            depth++;
        }
        if (current != null) {
            logger.warn("Symbol sequence ends inside {}", current.symbol());
        }
        return root;
    }

    private void checkDepth(int depth, String symbol) {
        if (depth > maxDepth) {
            throw new IllegalArgumentException("Tree deeper than " + maxDepth + " levels at " + symbol);
        }
    }

    private CommandNode decode(String symbol, CommandNode parent) {
        int separator = symbol.indexOf(CommandNode.SYMBOL_SEPARATOR);
        if (separator <= 0) {
            throw new IllegalArgumentException("Malformed symbol: " + symbol);
        }
        NodeKind kind = NodeKind.fromSymbolName(symbol.substring(0, separator));
        String value = symbol.substring(separator + 1);
        if (kind == NodeKind.ROOT) {
            throw new IllegalArgumentException("Root symbol inside the tree: " + symbol);
        }
        if (kind == NodeKind.ARGUMENT) {
            return new ArgumentNode(value, argumentType(value, parent));
        }
        return CommandNode.create(kind, value);
    }

    private ArgType argumentType(String value, CommandNode parent) {
        if (parent instanceof FlagNode flag) {
            HeadCommandNode head = flag.headCommand();
            if (head == null) {
                logger.warn("Flag {} outside a head command", flag.value());
                return ArgType.UNKNOWN;
            }
            return types.resolveForFlag(head.value(), flag.value()).orElse(ArgType.UNKNOWN);
        }
        if (parent instanceof HeadCommandNode head) {
            Optional<ArgType> type = types.tryResolveForCommand(head.value(), value);
            if (type.isEmpty()) {
                logger.warn("Unable to decide type for [{}] as argument of {}", value, head.value());
            }
            return type.orElse(ArgType.UNKNOWN);
        }
        logger.warn("Argument [{}] under {} gets type {}", value, parent.symbol(), ArgType.UNKNOWN);
        return ArgType.UNKNOWN;
    }
}
