package com.bashnorm.grammar;

import com.bashnorm.ast.ArgType;
import org.eclipse.collections.api.set.ImmutableSet;

import java.util.Optional;

/**
 * Per-utility argument grammar. Implementations are read-only and may be shared.
 */
public interface GrammarLookup {
    /**
     * Types a positional argument of {@code headCommand} may have; empty for unknown commands.
     */
    ImmutableSet<ArgType> possibleArgTypes(String headCommand);

    /**
     * Type of the argument taken by {@code flag}, or empty if the flag takes no argument.
     */
    Optional<ArgType> flagArgType(String headCommand, String flag);
}
