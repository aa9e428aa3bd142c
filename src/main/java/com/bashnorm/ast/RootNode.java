package com.bashnorm.ast;

public final class RootNode extends CommandNode {
    public RootNode() {
        super(NodeKind.ROOT, "");
    }
}
