package com.bashnorm.ast;

public final class ProcessSubstitutionNode extends CommandNode {
    public ProcessSubstitutionNode(String direction) {
        super(NodeKind.PROCESSSUBSTITUTION, direction);
        if (!"<".equals(direction) && !">".equals(direction)) {
            throw new IllegalArgumentException("Process substitution direction must be '<' or '>', got: " + direction);
        }
    }
}
