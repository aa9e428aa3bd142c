package com.bashnorm.normalize;

/**
 * Aborts the normalization of one command. Never escapes {@link CommandNormalizer}.
 */
public class NormalizationException extends RuntimeException {
    private final ErrorKind kind;

    public NormalizationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
