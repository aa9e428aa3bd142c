package com.bashnorm.normalize;

import com.bashnorm.ast.ArgType;
import com.bashnorm.ast.FlagNode;
import com.bashnorm.grammar.GrammarLookup;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Optional;

/**
 * Assigns a semantic type to an argument, from the grammar of the flag it belongs to or, for
 * positional arguments, from a lexical heuristic over the types the head command accepts.
 */
public class ArgumentTypeResolver {
    protected static final ImmutableSet<String> RESERVED_WORDS = Sets.immutable.of("+", ";", "{}");
    protected static final String SIZE_UNITS = "kMGTP";
    protected static final String TIME_UNITS = "smhdw";
    protected static final ImmutableList<ArgType> FALLBACK_ORDER =
        Lists.immutable.of(ArgType.FILE, ArgType.PATTERN, ArgType.UTILITY);

    private final GrammarLookup grammar;

    public ArgumentTypeResolver(GrammarLookup grammar) {
        this.grammar = grammar;
    }

    /**
     * Type of the argument of {@code flag}; empty if the flag takes none.
     */
    public Optional<ArgType> resolveForFlag(String headCommand, String flag) {
        int terminator = flag.indexOf(FlagNode.TERMINATOR_SEPARATOR);
        String bareFlag = terminator < 0 ? flag : flag.substring(0, terminator);
        return grammar.flagArgType(headCommand, bareFlag);
    }

    /**
     * Type of a positional argument of {@code headCommand}.
     *
     * @throws NormalizationException if no accepted type fits the word
     */
    public ArgType resolveForCommand(String headCommand, String word) {
        return tryResolveForCommand(headCommand, word)
            .orElseThrow(() -> new NormalizationException(ErrorKind.ARGUMENT_TYPE_UNRESOLVABLE,
                "Unable to decide type for [" + word + "] as argument of " + headCommand));
    }

    public Optional<ArgType> tryResolveForCommand(String headCommand, String word) {
        return classify(word, grammar.possibleArgTypes(headCommand));
    }

    protected Optional<ArgType> classify(String word, ImmutableSet<ArgType> possibleTypes) {
        if (RESERVED_WORDS.contains(word)) {
            return Optional.of(ArgType.RESERVED_WORD);
        }
        if (!word.isEmpty() && word.chars().allMatch(Character::isDigit) && possibleTypes.contains(ArgType.NUMBER)) {
            return Optional.of(ArgType.NUMBER);
        }
        if (word.chars().anyMatch(Character::isDigit)) {
            char last = word.charAt(word.length() - 1);
            if (SIZE_UNITS.indexOf(last) >= 0 && possibleTypes.contains(ArgType.SIZE)) {
                return Optional.of(ArgType.SIZE);
            }
            if (TIME_UNITS.indexOf(last) >= 0 && possibleTypes.contains(ArgType.TIME)) {
                return Optional.of(ArgType.TIME);
            }
        }
        return FALLBACK_ORDER.detectOptional(possibleTypes::contains);
    }
}
