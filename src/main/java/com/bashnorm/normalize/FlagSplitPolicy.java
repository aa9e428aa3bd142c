package com.bashnorm.normalize;

/**
 * Decides whether a dash-prefixed word is a cluster of short options ({@code -la}) to be split
 * into one flag per character.
 */
@FunctionalInterface
public interface FlagSplitPolicy {

    /**
     * Splits words longer than two characters unless they are long options, logic operators
     * or arguments of find, whose single-dash options are words.
     */
    FlagSplitPolicy CLUSTERED_SHORT_OPTIONS = (flag, headCommand) ->
        flag.length() > 2
            && flag.startsWith("-")
            && !flag.startsWith("--")
            && !LogicOperators.isOperatorWord(flag)
            && !"find".equals(headCommand);

    FlagSplitPolicy NEVER = (flag, headCommand) -> false;

    boolean shouldSplit(String flag, String headCommand);
}
