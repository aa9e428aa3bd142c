package com.bashnorm.syntax;

public enum ParseErrorKind {
    MISMATCHED_DELIMITER,
    GRAMMAR,
    UNIMPLEMENTED,
    EMPTY_INPUT,
    MALFORMED_SHAPE
}
