package com.bashnorm.output;

/**
 * How a command tree is turned into tokens.
 *
 * @param strict    fail on arity violations instead of degrading
 * @param flagOrder order of the flags of a head command
 * @param valueMode literal argument values or their type tags
 */
public record RenderOptions(boolean strict, FlagOrder flagOrder, ValueMode valueMode) {

    public enum FlagOrder { ORIGINAL, LEXICAL }

    public enum ValueMode { LITERAL, TYPE }

    public static final RenderOptions STRICT = new RenderOptions(true, FlagOrder.ORIGINAL, ValueMode.LITERAL);
    public static final RenderOptions LOOSE = new RenderOptions(false, FlagOrder.ORIGINAL, ValueMode.LITERAL);
    public static final RenderOptions TEMPLATE = new RenderOptions(false, FlagOrder.LEXICAL, ValueMode.TYPE);

    public RenderOptions {
        flagOrder = flagOrder == null ? FlagOrder.ORIGINAL : flagOrder;
        valueMode = valueMode == null ? ValueMode.LITERAL : valueMode;
    }

    public RenderOptions withStrict(boolean value) {
        return new RenderOptions(value, flagOrder, valueMode);
    }

    public RenderOptions withFlagOrder(FlagOrder value) {
        return new RenderOptions(strict, value, valueMode);
    }

    public RenderOptions withValueMode(ValueMode value) {
        return new RenderOptions(strict, flagOrder, value);
    }
}
