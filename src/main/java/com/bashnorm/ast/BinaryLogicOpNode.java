package com.bashnorm.ast;

public final class BinaryLogicOpNode extends CommandNode {
    /** Operator of the node that replaces a parenthesized group. */
    public static final String IMPLICIT_AND = "-and";

    public BinaryLogicOpNode(String operator) {
        super(NodeKind.BINARYLOGICOP, operator);
    }
}
