package com.bashnorm.ast;

public final class CommandSubstitutionNode extends CommandNode {
    public CommandSubstitutionNode() {
        super(NodeKind.COMMANDSUBSTITUTION, "");
    }
}
