package com.bashnorm.syntax;

/**
 * Node kinds of the generic shell syntax tree.
 */
public enum SyntaxKind {
    WORD,
    COMMAND,
    PIPELINE,
    PIPE,
    LIST,
    OPERATOR,
    COMMANDSUBSTITUTION,
    PROCESSSUBSTITUTION,
    PARAMETER,
    TILDE,
    ASSIGNMENT,
    REDIRECT,
    HEREDOC,
    FOR,
    IF,
    WHILE,
    UNTIL,
    FUNCTION
}
