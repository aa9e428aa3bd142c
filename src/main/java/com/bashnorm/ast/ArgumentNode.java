package com.bashnorm.ast;

public final class ArgumentNode extends CommandNode {
    private final ArgType argType;

    public ArgumentNode(String value, ArgType argType) {
        super(NodeKind.ARGUMENT, value);
        this.argType = argType == null ? ArgType.UNKNOWN : argType;
    }

    public ArgType argType() {
        return argType;
    }

    public boolean isOpenParenthesis() {
        return "(".equals(value());
    }

    public boolean isCloseParenthesis() {
        return ")".equals(value());
    }
}
