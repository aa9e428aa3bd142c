package com.bashnorm.ast;

public final class UnaryLogicOpNode extends CommandNode {
    public UnaryLogicOpNode(String operator) {
        super(NodeKind.UNARYLOGICOP, operator);
    }
}
