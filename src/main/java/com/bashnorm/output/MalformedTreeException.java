package com.bashnorm.output;

import com.bashnorm.ast.CommandNode;

/**
 * Thrown by strict rendering when a node has a number of children its kind does not allow.
 */
public class MalformedTreeException extends RuntimeException {
    private final transient CommandNode node;

    public MalformedTreeException(CommandNode node, String message) {
        super(message);
        this.node = node;
    }

    public CommandNode node() {
        return node;
    }
}
