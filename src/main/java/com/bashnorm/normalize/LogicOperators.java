package com.bashnorm.normalize;

import com.bashnorm.ast.CommandNode;
import com.bashnorm.ast.HeadCommandNode;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Optional;

/**
 * Which words act as logic operators, depending on the head command they appear under.
 */
final class LogicOperators {
    static final ImmutableSet<String> UNARY = Sets.immutable.of("!", "-not");
    static final ImmutableSet<String> BINARY = Sets.immutable.of("-and", "-or", "||", "&&", "-o", "-a");

    private LogicOperators() {
    }

    static boolean isOperatorWord(String word) {
        return UNARY.contains(word) || BINARY.contains(word);
    }

    static boolean isUnary(String word, CommandNode attachPoint) {
        if (word.equals("!")) {
            return isFind(attachPoint);
        }
        return UNARY.contains(word);
    }

    /**
     * The operator {@code word} stands for under {@code attachPoint}, or empty if it is an
     * ordinary flag there. {@code -a}/{@code -o} are operators only under find.
     */
    static Optional<String> binaryOperator(String word, CommandNode attachPoint) {
        if (word.equals("-o") || word.equals("-a")) {
            return isFind(attachPoint) ? Optional.of(word.equals("-o") ? "-or" : "-and") : Optional.empty();
        }
        return BINARY.contains(word) ? Optional.of(word) : Optional.empty();
    }

    private static boolean isFind(CommandNode node) {
        return node instanceof HeadCommandNode && node.value().equals("find");
    }
}
