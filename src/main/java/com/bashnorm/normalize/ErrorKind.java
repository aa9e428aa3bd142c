package com.bashnorm.normalize;

import com.bashnorm.syntax.ParseErrorKind;

/**
 * Classification of a command that could not be normalized.
 */
public enum ErrorKind {
    UNSUPPORTED_CONSTRUCT,
    MISSING_HEAD_COMMAND,
    MULTIPLE_HEAD_COMMANDS,
    UNBALANCED_PARENTHESES,
    ARGUMENT_TYPE_UNRESOLVABLE,
    PIPELINE_ARITY,
    MULTI_STATEMENT_LIST,
    MALFORMED_LOGIC_EXPRESSION,
    NESTING_TOO_DEEP,
    PARSE_MISMATCHED_DELIMITER,
    PARSE_GRAMMAR,
    PARSE_UNIMPLEMENTED,
    PARSE_EMPTY_INPUT,
    PARSE_MALFORMED_SHAPE;

    public static ErrorKind of(ParseErrorKind parseError) {
        return switch (parseError) {
            case MISMATCHED_DELIMITER -> PARSE_MISMATCHED_DELIMITER;
            case GRAMMAR -> PARSE_GRAMMAR;
            case UNIMPLEMENTED -> PARSE_UNIMPLEMENTED;
            case EMPTY_INPUT -> PARSE_EMPTY_INPUT;
            case MALFORMED_SHAPE -> PARSE_MALFORMED_SHAPE;
        };
    }

    public boolean isParseError() {
        return name().startsWith("PARSE_");
    }
}
