package com.bashnorm.ast;

public final class HeadCommandNode extends CommandNode {
    public HeadCommandNode(String name) {
        super(NodeKind.HEADCOMMAND, name);
    }
}
