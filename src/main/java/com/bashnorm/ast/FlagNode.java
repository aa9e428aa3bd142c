package com.bashnorm.ast;

/**
 * An option of a head command. A flag that introduced an embedded command (such as
 * {@code find -exec}) remembers the terminator that closed it as a {@code ::} suffix of its value,
 * e.g. {@code -exec::;}.
 */
public final class FlagNode extends CommandNode {
    public static final String TERMINATOR_SEPARATOR = "::";

    public FlagNode(String flag) {
        super(NodeKind.FLAG, flag);
    }

    public void setTerminator(String terminator) {
        setValue(bareValue() + TERMINATOR_SEPARATOR + terminator);
    }

    public boolean hasTerminator() {
        return value().contains(TERMINATOR_SEPARATOR);
    }

    /**
     * The flag spelling without any terminator suffix.
     */
    public String bareValue() {
        int index = value().indexOf(TERMINATOR_SEPARATOR);
        return index < 0 ? value() : value().substring(0, index);
    }

    public String terminator() {
        int index = value().indexOf(TERMINATOR_SEPARATOR);
        return index < 0 ? null : value().substring(index + TERMINATOR_SEPARATOR.length());
    }
}
