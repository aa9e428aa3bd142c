package com.bashnorm.ast;

import java.util.Arrays;

/**
 * Semantic argument types known to the utility grammar.
 */
public enum ArgType {
    FILE("File"),
    PATTERN("Pattern"),
    NUMBER("Number"),
    SIZE("Size"),
    TIME("Time"),
    PERMISSION_MODE("PermissionMode"),
    USER_NAME("UserName"),
    GROUP_NAME("GroupName"),
    UTILITY("Utility"),
    UNKNOWN("Unknown"),
    RESERVED_WORD("ReservedWord");

    private final String tag;

    ArgType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ArgType fromTag(String tag) {
        return Arrays.stream(values())
            .filter(type -> type.tag.equals(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown argument type: " + tag));
    }

    @Override
    public String toString() {
        return tag;
    }
}
