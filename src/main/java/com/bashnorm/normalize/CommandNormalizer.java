package com.bashnorm.normalize;

import com.bashnorm.ast.ArgType;
import com.bashnorm.ast.ArgumentNode;
import com.bashnorm.ast.BinaryLogicOpNode;
import com.bashnorm.ast.CommandNode;
import com.bashnorm.ast.CommandSubstitutionNode;
import com.bashnorm.ast.FlagNode;
import com.bashnorm.ast.HeadCommandNode;
import com.bashnorm.ast.NodeKind;
import com.bashnorm.ast.PipelineNode;
import com.bashnorm.ast.ProcessSubstitutionNode;
import com.bashnorm.ast.RootNode;
import com.bashnorm.ast.UnaryLogicOpNode;
import com.bashnorm.grammar.CommandRegistry;
import com.bashnorm.grammar.GrammarLookup;
import com.bashnorm.grammar.UtilityGrammar;
import com.bashnorm.syntax.CommandPreprocessor;
import com.bashnorm.syntax.ShellParseException;
import com.bashnorm.syntax.ShellParser;
import com.bashnorm.syntax.SimpleShellParser;
import com.bashnorm.syntax.SyntaxKind;
import com.bashnorm.syntax.SyntaxNode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites generic shell syntax trees into the typed command tree.
 * <p>
 * Each command is scanned once from left to right while an attach point tracks the node the
 * next word belongs to. Logic operators are attached flat during the scan and restructured
 * afterwards; escaped parentheses become implicit {@code -and} groups. Instances hold only
 * immutable configuration and can be shared.
 */
public class CommandNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(CommandNormalizer.class);

    public static final ImmutableSet<String> EMBEDDED_COMMAND_FLAGS =
        Sets.immutable.of("-exec", "-execdir", "-ok", "-okdir");
    public static final String END_OF_OPTIONS = "--";

    private static final String OPEN_PARENTHESIS = "(";
    private static final String CLOSE_PARENTHESIS = ")";

    private final CommandRegistry registry;
    private final NormalizerOptions options;
    private final WordNormalizer words;
    private final ArgumentTypeResolver types;
    private final ShellParser parser;
    private final CommandPreprocessor preprocessor;

    public CommandNormalizer(UtilityGrammar grammar) {
        this(grammar, grammar, NormalizerOptions.defaults());
    }

    public CommandNormalizer(UtilityGrammar grammar, NormalizerOptions options) {
        this(grammar, grammar, options);
    }

    public CommandNormalizer(GrammarLookup grammar, CommandRegistry registry, NormalizerOptions options) {
        this(registry, options, new ArgumentTypeResolver(grammar), new SimpleShellParser(), new CommandPreprocessor());
    }

    public CommandNormalizer(CommandRegistry registry, NormalizerOptions options, ArgumentTypeResolver types,
                             ShellParser parser, CommandPreprocessor preprocessor) {
        this.registry = registry;
        this.options = options;
        this.words = new WordNormalizer(options);
        this.types = types;
        this.parser = parser;
        this.preprocessor = preprocessor;
    }

    public NormalizerOptions options() {
        return options;
    }

    /**
     * Preprocesses, parses and normalizes command text.
     */
    public NormalizationResult normalize(String command) {
        String cmd = preprocessor.preprocess(command);
        if (cmd.isEmpty()) {
            return new NormalizationResult.Failure(ErrorKind.PARSE_EMPTY_INPUT, "Empty command");
        }
        List<SyntaxNode> trees;
        try {
            trees = parser.parse(cmd);
        } catch (ShellParseException e) {
            logger.warn("Cannot parse [{}] - {}: {}", cmd, e.kind(), e.getMessage());
            return new NormalizationResult.Failure(ErrorKind.of(e.kind()), e.getMessage());
        }
        return normalize(trees, cmd);
    }

    /**
     * Normalizes parsed syntax trees.
     *
     * @param trees  top-level statements as returned by a {@link ShellParser}
     * @param source the text they were parsed from
     */
    public NormalizationResult normalize(List<SyntaxNode> trees, String source) {
        if (trees.isEmpty()) {
            return new NormalizationResult.Failure(ErrorKind.PARSE_EMPTY_INPUT, "No syntax tree");
        }
        if (trees.size() > 1) {
            logger.warn("Commands with multiple root nodes are not supported: [{}]", source);
            return new NormalizationResult.Failure(ErrorKind.MULTI_STATEMENT_LIST,
                "Command has " + trees.size() + " top-level statements");
        }
        RootNode root = new RootNode();
        try {
            new Pass(source).normalizeNode(trees.get(0), root, 0);
            if (root.childCount() != 1) {
                throw new NormalizationException(ErrorKind.MISSING_HEAD_COMMAND, "Nothing to normalize");
            }
            CommandNode top = root.firstChild();
            if (!top.is(NodeKind.HEADCOMMAND) && !top.is(NodeKind.PIPELINE)) {
                throw new NormalizationException(ErrorKind.MISSING_HEAD_COMMAND,
                    "Top-level " + top.symbol() + " is not a command");
            }
            return new NormalizationResult.Success(root);
        } catch (NormalizationException e) {
            logger.warn("{}: {} - [{}]", e.kind(), e.getMessage(), source);
            return new NormalizationResult.Failure(e.kind(), e.getMessage());
        }
    }

    /**
     * Whether every head command in the tree is a known utility.
     */
    public boolean usesOnlyKnownCommands(CommandNode node) {
        if (node instanceof HeadCommandNode && !registry.isHeadCommand(node.value())) {
            return false;
        }
        return node.children().allSatisfy(this::usesOnlyKnownCommands);
    }

    /**
     * State of one {@link #normalize(List, String)} call.
     */
    private final class Pass {
        private final String source;

        Pass(String source) {
            this.source = source;
        }

        void normalizeNode(SyntaxNode node, CommandNode current, int depth) {
            checkDepth(depth);
            switch (node.kind()) {
                case WORD -> attachWord(node, current, ArgType.UNKNOWN, depth);
                case COMMAND -> normalizeCommand(node.parts().castToList(), current, depth + 1);
                case PIPELINE -> normalizePipeline(node, current, depth);
                case LIST -> {
                    if (node.parts().size() > 2) {
                        throw new NormalizationException(ErrorKind.MULTI_STATEMENT_LIST,
                            "Unsupported: list of " + node.parts().size() + " parts");
                    }
                    normalizeNode(node.parts().getFirst(), current, depth + 1);
                }
                case COMMANDSUBSTITUTION, PROCESSSUBSTITUTION -> {
                    // reached from attachWord, which creates the enclosing substitution node
                    if (!current.is(NodeKind.COMMANDSUBSTITUTION) && !current.is(NodeKind.PROCESSSUBSTITUTION)) {
                        throw new NormalizationException(ErrorKind.UNSUPPORTED_CONSTRUCT,
                            "Unsupported: " + node.kind().name().toLowerCase() + " outside a word");
                    }
                    normalizeNode(node.command(), current, depth + 1);
                }
                case PIPE, OPERATOR, PARAMETER, TILDE, ASSIGNMENT, REDIRECT, HEREDOC,
                     FOR, IF, WHILE, UNTIL, FUNCTION -> throw new NormalizationException(
                    ErrorKind.UNSUPPORTED_CONSTRUCT, "Unsupported: " + node.kind().name().toLowerCase());
            }
        }

        private void normalizePipeline(SyntaxNode node, CommandNode current, int depth) {
            ListIterable<SyntaxNode> parts = node.parts();
            if (parts.size() % 2 == 0) {
                throw new NormalizationException(ErrorKind.PIPELINE_ARITY,
                    "Pipeline node must have an odd number of parts, got " + parts.size());
            }
            PipelineNode pipeline = new PipelineNode();
            current.appendChild(pipeline);
            for (int i = 0; i < parts.size(); i++) {
                SyntaxNode part = parts.get(i);
                SyntaxKind expected = i % 2 == 0 ? SyntaxKind.COMMAND : SyntaxKind.PIPE;
                if (part.kind() != expected) {
                    throw new NormalizationException(ErrorKind.PIPELINE_ARITY,
                        "Pipeline part " + i + " is " + part.kind() + ", expected " + expected);
                }
                if (part.is(SyntaxKind.COMMAND)) {
                    normalizeNode(part, pipeline, depth + 1);
                }
            }
        }

        private void normalizeCommand(List<SyntaxNode> parts, CommandNode current, int depth) {
            checkDepth(depth);
            CommandScope scope = new CommandScope(current);

            int i = 0;
            while (i < parts.size()) {
                SyntaxNode part = parts.get(i);
                if (part.is(SyntaxKind.WORD)) {
                    String word = part.word();
                    if (word.equals(END_OF_OPTIONS) && !scope.endOfOptions) {
                        scope.endOfOptions = true;
                        flagAttachPoint(scope.attachPoint, word).appendChild(new FlagNode(word));
                    } else if (LogicOperators.UNARY.contains(word)) {
                        scope.attachPoint = flagAttachPoint(scope.attachPoint, word);
                        if (LogicOperators.isUnary(word, scope.attachPoint)) {
                            UnaryLogicOpNode op = new UnaryLogicOpNode(word);
                            scope.attachPoint.appendChild(op);
                            scope.unaryOperators.add(op);
                        } else {
                            attachOption(part, scope);
                        }
                    } else if (LogicOperators.BINARY.contains(word)) {
                        scope.attachPoint = flagAttachPoint(scope.attachPoint, word);
                        Optional<String> operator = LogicOperators.binaryOperator(word, scope.attachPoint);
                        if (operator.isPresent()) {
                            BinaryLogicOpNode op = new BinaryLogicOpNode(operator.get());
                            scope.attachPoint.appendChild(op);
                            scope.binaryOperators.add(op);
                        } else {
                            attachOption(part, scope);
                        }
                    } else if (startsCommand(part, scope.attachPoint)) {
                        i = attachCommand(parts, i, scope, depth);
                    } else if (word.startsWith("-") && !scope.endOfOptions) {
                        attachDashWord(part, scope);
                    } else if (word.equals(OPEN_PARENTHESIS) && !words.isQuoted(part, source)) {
                        scope.parenthesisAttachPoints.push(scope.attachPoint);
                        attachParenthesis(word, scope.attachPoint);
                    } else if (word.equals(CLOSE_PARENTHESIS) && !words.isQuoted(part, source)) {
                        if (scope.parenthesisAttachPoints.isEmpty()) {
                            throw new NormalizationException(ErrorKind.UNBALANCED_PARENTHESES,
                                "Unmatched ')' in command");
                        }
                        scope.attachPoint = scope.parenthesisAttachPoints.pop();
                        attachParenthesis(word, scope.attachPoint);
                    } else {
                        attachArgument(part, scope.attachPoint, depth);
                    }
                } else {
                    normalizeNode(part, scope.attachPoint, depth);
                }
                i++;
            }

            if (!scope.parenthesisAttachPoints.isEmpty()) {
                throw new NormalizationException(ErrorKind.UNBALANCED_PARENTHESES, "Unmatched '(' in command");
            }
            if (scope.headCommands.isEmpty()) {
                throw new NormalizationException(ErrorKind.MISSING_HEAD_COMMAND,
                    "No known head command in [" + describe(parts) + "]");
            }
            if (scope.headCommands.size() > 1) {
                throw new NormalizationException(ErrorKind.MULTIPLE_HEAD_COMMANDS,
                    "Multiple head commands in one command: " + scope.headCommands.collect(CommandNode::value));
            }
            restructure(scope.headCommands.getFirst(), scope);
        }

        private boolean startsCommand(SyntaxNode word, CommandNode attachPoint) {
            return registry.isHeadCommand(word.word())
                && !words.isQuoted(word, source)
                && (!attachPoint.is(NodeKind.HEADCOMMAND) || registry.isShellWrapper(attachPoint.value()));
        }

        /**
         * Attaches a head command word found at {@code parts[index]}.
         *
         * @return index of the last part consumed
         */
        private int attachCommand(List<SyntaxNode> parts, int index, CommandScope scope, int depth) {
            SyntaxNode word = parts.get(index);
            if (index == 0) {
                HeadCommandNode head = new HeadCommandNode(words.normalize(word, NodeKind.HEADCOMMAND, source));
                scope.attachPoint.appendChild(head);
                scope.attachPoint = head;
                scope.headCommands.add(head);
                return index;
            }
            if (scope.attachPoint instanceof FlagNode flag) {
                if (EMBEDDED_COMMAND_FLAGS.contains(flag.bareValue())) {
                    int last = attachEmbeddedCommand(parts, index, flag, depth);
                    scope.attachPoint = flag.parent();
                    return last;
                }
                // the flag does not run a utility, so the word is an ordinary argument
                logger.warn("Head command [{}] after flag {} is attached as an argument", word.word(), flag.value());
                attachArgument(word, flag, depth);
                return index;
            }
            if (scope.attachPoint instanceof HeadCommandNode) {
                normalizeCommand(parts.subList(index, parts.size()), scope.attachPoint, depth + 1);
                return parts.size() - 1;
            }
            logger.warn("Cannot attach head command [{}] to {}; skipped", word.word(), scope.attachPoint.symbol());
            return index;
        }

        /**
         * Collects the words up to a {@code ;} or {@code +} terminator into a command run by
         * {@code flag} and records the terminator on the flag.
         *
         * @return index of the terminator, or of the last part if there is none
         */
        private int attachEmbeddedCommand(List<SyntaxNode> parts, int index, FlagNode flag, int depth) {
            MutableList<SyntaxNode> embedded = Lists.mutable.empty();
            String terminator = null;
            int j = index;
            for (; j < parts.size(); j++) {
                SyntaxNode part = parts.get(j);
                if (!part.is(SyntaxKind.WORD)) {
                    logger.warn("Skipping {} inside command embedded in {}", part.kind(), flag.value());
                    continue;
                }
                if (part.word().equals(";") || part.word().equals("+")) {
                    terminator = part.word();
                    break;
                }
                embedded.add(part);
            }
            normalizeCommand(embedded, flag, depth + 1);
            if (terminator == null) {
                logger.warn("{} missing ending ';'", flag.value());
                terminator = ";";
                j = parts.size() - 1;
            }
            flag.setTerminator(terminator);
            return j;
        }

        private void attachDashWord(SyntaxNode word, CommandScope scope) {
            // a negative number after a flag that expects one, as in -mtime -7
            if (scope.attachPoint instanceof FlagNode flag && containsDigit(word.word())) {
                Optional<ArgType> argType = types.resolveForFlag(headCommandOf(flag).value(), flag.value());
                if (argType.isPresent() && flag.childCount() == 0) {
                    flag.appendChild(new ArgumentNode(words.normalize(word, NodeKind.ARGUMENT, source), argType.get()));
                    return;
                }
            }
            attachOption(word, scope);
        }

        private void attachOption(SyntaxNode word, CommandScope scope) {
            CommandNode point = flagAttachPoint(scope.attachPoint, word.word());
            HeadCommandNode head = headCommandOf(point);
            String flag = word.word();
            if (options.flagSplitPolicy().shouldSplit(flag, head.value())) {
                for (char option : flag.substring(1).toCharArray()) {
                    point.appendChild(new FlagNode("-" + option));
                }
                logger.debug("{} split into {} flags", flag, flag.length() - 1);
            } else {
                point.appendChild(new FlagNode(words.normalize(word, NodeKind.FLAG, source)));
            }
            scope.attachPoint = point.lastChild();
        }

        private void attachArgument(SyntaxNode word, CommandNode attachPoint, int depth) {
            CommandNode point = attachPoint;
            if (point instanceof FlagNode && point.childCount() >= 1) {
                point = point.parent();
            }

            ArgType argType;
            if (point instanceof FlagNode flag) {
                HeadCommandNode head = headCommandOf(flag);
                Optional<ArgType> flagType = types.resolveForFlag(head.value(), flag.value());
                if (flagType.isPresent()) {
                    argType = flagType.get();
                } else {
                    // the flag takes no argument
                    point = head;
                    argType = positionalType(head, word);
                }
            } else if (point instanceof HeadCommandNode head) {
                argType = positionalType(head, word);
            } else {
                logger.warn("Ambiguous attachment point {} for argument [{}]", point.symbol(), word.word());
                argType = ArgType.UNKNOWN;
            }
            attachWord(word, point, argType, depth);
        }

        private ArgType positionalType(HeadCommandNode head, SyntaxNode word) {
            if (word.hasParts()) {
                return types.tryResolveForCommand(head.value(), word.word()).orElse(ArgType.UNKNOWN);
            }
            return types.resolveForCommand(head.value(), word.word());
        }

        private void attachParenthesis(String parenthesis, CommandNode attachPoint) {
            flagAttachPoint(attachPoint, parenthesis).appendChild(new ArgumentNode(parenthesis, ArgType.RESERVED_WORD));
        }

        /**
         * Attaches an argument word, expanding command and process substitutions.
         */
        private void attachWord(SyntaxNode word, CommandNode parent, ArgType argType, int depth) {
            if (!word.hasParts()) {
                parent.appendChild(new ArgumentNode(words.normalize(word, NodeKind.ARGUMENT, source), argType));
                return;
            }
            SyntaxNode first = word.parts().getFirst();
            if (word.parts().size() > 1) {
                logger.warn("Only the first expansion of [{}] is kept", word.word());
            }
            switch (first.kind()) {
                case PROCESSSUBSTITUTION -> {
                    ProcessSubstitutionNode substitution = new ProcessSubstitutionNode(direction(first, word));
                    parent.appendChild(substitution);
                    normalizeNode(first, substitution, depth + 1);
                }
                case COMMANDSUBSTITUTION -> {
                    CommandSubstitutionNode substitution = new CommandSubstitutionNode();
                    parent.appendChild(substitution);
                    normalizeNode(first, substitution, depth + 1);
                }
                case PARAMETER, TILDE ->
                    parent.appendChild(new ArgumentNode(words.normalize(word, NodeKind.ARGUMENT, source), argType));
                default -> throw new NormalizationException(ErrorKind.UNSUPPORTED_CONSTRUCT,
                    "Unsupported word part: " + first.kind().name().toLowerCase());
            }
        }

        private String direction(SyntaxNode substitution, SyntaxNode word) {
            if (source != null && substitution.start() >= 0 && substitution.start() < source.length()) {
                char c = source.charAt(substitution.start());
                if (c == '<' || c == '>') {
                    return String.valueOf(c);
                }
            }
            return word.word().contains(">") ? ">" : "<";
        }

        private void checkDepth(int depth) {
            if (depth > options.maxDepth()) {
                throw new NormalizationException(ErrorKind.NESTING_TOO_DEEP,
                    "Command nesting exceeds " + options.maxDepth() + " levels");
            }
        }
    }

    /**
     * Turns the flat operator and parenthesis nodes under {@code head} into operator subtrees.
     */
    private void restructure(HeadCommandNode head, CommandScope scope) {
        for (UnaryLogicOpNode op : scope.unaryOperators) {
            adjustUnaryOperator(op, scope);
        }
        for (BinaryLogicOpNode op : scope.binaryOperators) {
            adjustBinaryOperator(op, scope);
        }

        desugarParentheses(head);

        for (UnaryLogicOpNode op : scope.deferredUnaryOperators) {
            adjustUnaryOperator(op, null);
        }
        for (BinaryLogicOpNode op : scope.deferredBinaryOperators) {
            adjustBinaryOperator(op, null);
        }

        simplifySingleOperandOperators(head);
    }

    // the right sibling becomes the only child; deferred if it is '('
    private void adjustUnaryOperator(UnaryLogicOpNode op, CommandScope scope) {
        CommandNode operand = op.rightSibling();
        if (operand == null) {
            throw new NormalizationException(ErrorKind.MALFORMED_LOGIC_EXPRESSION,
                "Unary logic operator " + op.value() + " must have a right sibling");
        }
        if (isParenthesis(operand, CLOSE_PARENTHESIS)) {
            throw new NormalizationException(ErrorKind.MALFORMED_LOGIC_EXPRESSION,
                "Unary logic operator " + op.value() + " has no operand inside parentheses");
        }
        if (isParenthesis(operand, OPEN_PARENTHESIS)) {
            if (scope == null) {
                throw new NormalizationException(ErrorKind.UNBALANCED_PARENTHESES,
                    "Parenthesis left after desugaring next to " + op.value());
            }
            scope.deferredUnaryOperators.add(op);
            return;
        }
        operand.detach();
        op.appendChild(operand);
    }

    // left and right siblings become the children; deferred if either is a parenthesis
    private void adjustBinaryOperator(BinaryLogicOpNode op, CommandScope scope) {
        CommandNode left = op.leftSibling();
        CommandNode right = op.rightSibling();
        if (left == null || right == null) {
            throw new NormalizationException(ErrorKind.MALFORMED_LOGIC_EXPRESSION,
                "Binary logic operator " + op.value() + " must have both left and right siblings");
        }
        if (isParenthesis(right, OPEN_PARENTHESIS) || isParenthesis(left, CLOSE_PARENTHESIS)) {
            if (scope == null) {
                throw new NormalizationException(ErrorKind.UNBALANCED_PARENTHESES,
                    "Parenthesis left after desugaring next to " + op.value());
            }
            scope.deferredBinaryOperators.add(op);
            return;
        }
        if (isParenthesis(right, CLOSE_PARENTHESIS) || isParenthesis(left, OPEN_PARENTHESIS)) {
            throw new NormalizationException(ErrorKind.MALFORMED_LOGIC_EXPRESSION,
                "Binary logic operator " + op.value() + " is missing an operand inside parentheses");
        }

        left.detach();
        right.detach();
        if (left instanceof BinaryLogicOpNode && left.value().equals(op.value())) {
            // same operator on the left: keep the chain flat
            while (left.childCount() > 0) {
                CommandNode operand = left.firstChild();
                operand.detach();
                op.appendChild(operand);
            }
        } else {
            op.appendChild(left);
        }
        op.appendChild(right);
    }

    /**
     * Replaces every parenthesized group among the children of {@code head} with its single
     * member or with an implicit {@code -and} of its members.
     */
    private void desugarParentheses(HeadCommandNode head) {
        Deque<CommandNode> stack = new ArrayDeque<>();
        int depth = 0;

        int i = 0;
        while (i < head.childCount()) {
            CommandNode child = head.child(i);
            if (isParenthesis(child, OPEN_PARENTHESIS)) {
                stack.push(child);
                depth++;
            } else if (isParenthesis(child, CLOSE_PARENTHESIS)) {
                if (depth < 1) {
                    throw new NormalizationException(ErrorKind.UNBALANCED_PARENTHESES, "Unmatched ')' under " + head.value());
                }
                MutableList<CommandNode> buffer = Lists.mutable.empty();
                CommandNode popped = stack.pop();
                while (!isParenthesis(popped, OPEN_PARENTHESIS)) {
                    buffer.add(0, popped);
                    popped = stack.pop();
                }
                if (buffer.isEmpty()) {
                    throw new NormalizationException(ErrorKind.MALFORMED_LOGIC_EXPRESSION, "Empty parentheses under " + head.value());
                }
                buffer.each(CommandNode::detach);

                CommandNode replacement;
                if (buffer.size() > 1) {
                    replacement = new BinaryLogicOpNode(BinaryLogicOpNode.IMPLICIT_AND);
                    buffer.each(replacement::appendChild);
                } else {
                    replacement = buffer.getFirst();
                }
                i = head.replaceRange(popped, child, replacement);
                depth--;
                if (depth >= 1) {
                    stack.push(replacement);
                }
            } else if (depth >= 1) {
                stack.push(child);
            }
            i++;
        }

        if (!stack.isEmpty() || depth != 0) {
            throw new NormalizationException(ErrorKind.UNBALANCED_PARENTHESES, "Unmatched '(' under " + head.value());
        }
    }

    // an operator of one operand is just that operand
    private void simplifySingleOperandOperators(CommandNode node) {
        for (CommandNode child : Lists.mutable.withAll(node.children())) {
            simplifySingleOperandOperators(child);
        }
        if (node instanceof BinaryLogicOpNode && node.childCount() == 1 && node.parent() != null) {
            node.parent().replaceChild(node, node.firstChild());
        }
    }

    private CommandNode flagAttachPoint(CommandNode attachPoint, String word) {
        CommandNode point = attachPoint;
        while (point instanceof FlagNode) {
            point = point.parent();
        }
        if (point == null || !(point.is(NodeKind.HEADCOMMAND) || point.is(NodeKind.UNARYLOGICOP)
            || point.is(NodeKind.BINARYLOGICOP))) {
            throw new NormalizationException(ErrorKind.MISSING_HEAD_COMMAND,
                "Cannot decide where to attach [" + word + "]");
        }
        return point;
    }

    private static HeadCommandNode headCommandOf(CommandNode node) {
        HeadCommandNode head = node.headCommand();
        if (head == null) {
            throw new NormalizationException(ErrorKind.MISSING_HEAD_COMMAND, node.symbol() + " has no head command");
        }
        return head;
    }

    // grouping markers are reserved words; a quoted "(" is an ordinary argument
    private static boolean isParenthesis(CommandNode node, String parenthesis) {
        return node instanceof ArgumentNode argument
            && argument.argType() == ArgType.RESERVED_WORD
            && argument.value().equals(parenthesis);
    }

    // digits may already have been replaced, as in a rendered -mtime -_NUM
    private static boolean containsDigit(String word) {
        return word.contains(WordNormalizer.NUM) || word.chars().anyMatch(Character::isDigit);
    }

    private static String describe(List<SyntaxNode> parts) {
        return Lists.adapt(parts).collect(SyntaxNode::word).makeString(" ");
    }

    /**
     * Scan state of one atomic command.
     */
    private static final class CommandScope {
        CommandNode attachPoint;
        boolean endOfOptions;
        final MutableList<HeadCommandNode> headCommands = Lists.mutable.empty();
        final MutableList<UnaryLogicOpNode> unaryOperators = Lists.mutable.empty();
        final MutableList<BinaryLogicOpNode> binaryOperators = Lists.mutable.empty();
        final MutableList<UnaryLogicOpNode> deferredUnaryOperators = Lists.mutable.empty();
        final MutableList<BinaryLogicOpNode> deferredBinaryOperators = Lists.mutable.empty();
        final Deque<CommandNode> parenthesisAttachPoints = new ArrayDeque<>();

        CommandScope(CommandNode attachPoint) {
            this.attachPoint = attachPoint;
        }
    }
}
