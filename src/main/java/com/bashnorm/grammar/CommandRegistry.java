package com.bashnorm.grammar;

import org.eclipse.collections.api.set.ImmutableSet;

/**
 * The set of utilities accepted as head commands.
 */
public interface CommandRegistry {
    boolean isHeadCommand(String word);

    /**
     * Head commands that run another command given as their arguments (sh, xargs, ...).
     */
    ImmutableSet<String> shellWrappers();

    default boolean isShellWrapper(String word) {
        return shellWrappers().contains(word);
    }
}
