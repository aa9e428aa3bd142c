package com.bashnorm.output;

import com.bashnorm.ast.ArgType;
import com.bashnorm.ast.ArgumentNode;
import com.bashnorm.ast.CommandNode;
import com.bashnorm.ast.FlagNode;
import com.bashnorm.ast.NodeKind;
import com.bashnorm.normalize.NormalizerOptions;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Turns command trees back into shell tokens. Trees deeper than the configured depth are
 * rejected with {@link MalformedTreeException} in every mode.
 */
public class CommandRenderer {
    public static final String OPEN_GROUP = "\\(";
    public static final String CLOSE_GROUP = "\\)";
    public static final String PIPE = "|";

    private static final String SEMICOLON = ";";
    private static final String ESCAPED_SEMICOLON = "\\;";

    private final RenderOptions options;
    private final int maxDepth;

    public CommandRenderer() {
        this(RenderOptions.STRICT);
    }

    public CommandRenderer(RenderOptions options) {
        this(options, NormalizerOptions.DEFAULT_MAX_DEPTH);
    }

    public CommandRenderer(RenderOptions options, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.options = options;
        this.maxDepth = maxDepth;
    }

    public RenderOptions options() {
        return options;
    }

    public ImmutableList<String> toTokens(CommandNode node) {
        MutableList<String> tokens = Lists.mutable.empty();
        if (node != null) {
            render(node, tokens, 0);
        }
        return tokens.toImmutable();
    }

    public String toCommand(CommandNode node) {
        return toTokens(node).makeString(" ");
    }

    /**
     * Loose rendering with flags in lexical order and arguments replaced by their types, so that
     * commands differing only in flag order or literal values render the same.
     */
    public static String toTemplate(CommandNode node) {
        return new CommandRenderer(RenderOptions.TEMPLATE).toCommand(node);
    }

    /**
     * One {@code KIND(value)} line per node, indented by depth.
     */
    public static String prettyPrint(CommandNode node) {
        StringBuilder sb = new StringBuilder();
        prettyPrint(node, 0, sb);
        return sb.toString();
    }

    private static void prettyPrint(CommandNode node, int indent, StringBuilder sb) {
        checkDepth(node, indent, NormalizerOptions.DEFAULT_MAX_DEPTH);
        sb.append("    ".repeat(indent)).append(node.kind().name()).append('(').append(node.value());
        if (node instanceof ArgumentNode argument) {
            sb.append(" <").append(argument.argType().tag()).append('>');
        }
        sb.append(")\n");
        for (CommandNode child : node.children()) {
            prettyPrint(child, indent + 1, sb);
        }
    }

    private void render(CommandNode node, MutableList<String> tokens, int depth) {
        checkDepth(node, depth, maxDepth);
        switch (node.kind()) {
            case ROOT -> {
                if (options.strict()) {
                    requireChildren(node, node.childCount() == 1, "exactly one child");
                }
                renderAll(node.children(), tokens, depth + 1);
            }
            case PIPELINE -> {
                if (options.strict()) {
                    requireChildren(node, node.childCount() > 1, "at least two children");
                }
                if (node.childCount() == 0) {
                    tokens.add(PIPE);
                } else {
                    for (int i = 0; i < node.childCount(); i++) {
                        if (i > 0) {
                            tokens.add(PIPE);
                        }
                        render(node.child(i), tokens, depth + 1);
                    }
                }
            }
            case COMMANDSUBSTITUTION -> {
                requireSingleChild(node);
                tokens.add("$(");
                renderAll(node.children(), tokens, depth + 1);
                tokens.add(")");
            }
            case PROCESSSUBSTITUTION -> {
                requireSingleChild(node);
                tokens.add(node.value() + "(");
                renderAll(node.children(), tokens, depth + 1);
                tokens.add(")");
            }
            case HEADCOMMAND -> {
                tokens.add(node.value());
                renderAll(orderedChildren(node), tokens, depth + 1);
            }
            case FLAG -> {
                FlagNode flag = (FlagNode) node;
                tokens.add(flag.bareValue());
                renderAll(flag.children(), tokens, depth + 1);
                if (flag.hasTerminator()) {
                    tokens.add(escapeSemicolon(flag.terminator()));
                }
            }
            case BINARYLOGICOP -> {
                if (options.strict()) {
                    requireChildren(node, node.childCount() > 1, "at least two children");
                }
                if (node.childCount() < 2) {
                    renderAll(node.children(), tokens, depth + 1);
                } else {
                    tokens.add(OPEN_GROUP);
                    for (int i = 0; i < node.childCount(); i++) {
                        if (i > 0) {
                            tokens.add(node.value());
                        }
                        render(node.child(i), tokens, depth + 1);
                    }
                    tokens.add(CLOSE_GROUP);
                }
            }
            case UNARYLOGICOP -> {
                requireSingleChild(node);
                tokens.add(node.value());
                renderAll(node.children(), tokens, depth + 1);
            }
            case ARGUMENT -> {
                if (options.strict()) {
                    requireChildren(node, node.childCount() == 0, "no children");
                }
                ArgumentNode argument = (ArgumentNode) node;
                if (options.valueMode() == RenderOptions.ValueMode.TYPE && argument.argType() != ArgType.RESERVED_WORD) {
                    tokens.add(argument.argType().tag());
                } else {
                    tokens.add(escapeSemicolon(argument.value()));
                }
                renderAll(argument.children(), tokens, depth + 1);
            }
        }
    }

    private void renderAll(ListIterable<CommandNode> children, MutableList<String> tokens, int depth) {
        for (CommandNode child : children) {
            render(child, tokens, depth);
        }
    }

    // lexical order permutes flags among the positions flags occupy
    private ListIterable<CommandNode> orderedChildren(CommandNode head) {
        if (options.flagOrder() == RenderOptions.FlagOrder.ORIGINAL) {
            return head.children();
        }
        MutableList<CommandNode> sortedFlags = head.children()
            .select(child -> child.is(NodeKind.FLAG))
            .toSortedListBy(CommandNode::value);
        MutableList<CommandNode> ordered = Lists.mutable.withAll(head.children());
        int next = 0;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).is(NodeKind.FLAG)) {
                ordered.set(i, sortedFlags.get(next++));
            }
        }
        return ordered;
    }

    private static void checkDepth(CommandNode node, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new MalformedTreeException(node, "Tree deeper than " + maxDepth + " levels at " + node.symbol());
        }
    }

    private void requireSingleChild(CommandNode node) {
        if (options.strict()) {
            requireChildren(node, node.childCount() == 1, "exactly one child");
        }
    }

    private static void requireChildren(CommandNode node, boolean valid, String expected) {
        if (!valid) {
            throw new MalformedTreeException(node,
                node.symbol() + " must have " + expected + ", has " + node.childCount());
        }
    }

    private static String escapeSemicolon(String value) {
        return SEMICOLON.equals(value) ? ESCAPED_SEMICOLON : value;
    }
}
