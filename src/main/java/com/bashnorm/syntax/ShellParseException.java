package com.bashnorm.syntax;

/**
 * Thrown by a {@link ShellParser} when command text cannot be turned into a syntax tree.
 */
public class ShellParseException extends RuntimeException {
    private final ParseErrorKind kind;

    public ShellParseException(ParseErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ParseErrorKind kind() {
        return kind;
    }
}
