package com.bashnorm.ast;

import java.util.Locale;

public enum NodeKind {
    ROOT,
    PIPELINE,
    HEADCOMMAND,
    FLAG,
    ARGUMENT,
    UNARYLOGICOP,
    BINARYLOGICOP,
    COMMANDSUBSTITUTION,
    PROCESSSUBSTITUTION;

    /**
     * Upper-case name used as the kind part of a linearized symbol.
     */
    public String symbolName() {
        return name();
    }

    public static NodeKind fromSymbolName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node kind: " + name);
        }
    }
}
