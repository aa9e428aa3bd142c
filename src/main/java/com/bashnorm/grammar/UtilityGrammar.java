package com.bashnorm.grammar;

import com.bashnorm.ast.ArgType;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Optional;

/**
 * Grammar of the supported utilities, usually loaded by {@link UtilityGrammarLoader}.
 */
public final class UtilityGrammar implements GrammarLookup, CommandRegistry {

    /**
     * Argument grammar of one utility.
     *
     * @param argumentTypes types its positional arguments may have
     * @param flagArguments argument type of every flag that takes an argument
     */
    public record Utility(ImmutableSet<ArgType> argumentTypes, ImmutableMap<String, ArgType> flagArguments) {
    }

    private final ImmutableMap<String, Utility> utilities;
    private final ImmutableSet<String> shellWrappers;

    public UtilityGrammar(ImmutableMap<String, Utility> utilities, ImmutableSet<String> shellWrappers) {
        this.utilities = utilities;
        this.shellWrappers = shellWrappers;
    }

    @Override
    public ImmutableSet<ArgType> possibleArgTypes(String headCommand) {
        Utility utility = utilities.get(headCommand);
        return utility != null ? utility.argumentTypes() : Sets.immutable.empty();
    }

    @Override
    public Optional<ArgType> flagArgType(String headCommand, String flag) {
        Utility utility = utilities.get(headCommand);
        return utility != null ? Optional.ofNullable(utility.flagArguments().get(flag)) : Optional.empty();
    }

    @Override
    public boolean isHeadCommand(String word) {
        return utilities.containsKey(word);
    }

    @Override
    public ImmutableSet<String> shellWrappers() {
        return shellWrappers;
    }

    public int size() {
        return utilities.size();
    }
}
