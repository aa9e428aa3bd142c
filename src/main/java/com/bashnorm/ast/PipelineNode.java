package com.bashnorm.ast;

public final class PipelineNode extends CommandNode {
    public PipelineNode() {
        super(NodeKind.PIPELINE, "");
    }
}
