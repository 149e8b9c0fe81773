package com.templet.node;

public enum NodeType {
    TEXT,
    VALUE,
    IF_VALUE,
    ELIF_VALUE,
    ELSE_VALUE,
    FOR_VALUE;

    /** True for the nodes that start an alternative branch of an if block. */
    public boolean isBranch() {
        return this == ELIF_VALUE || this == ELSE_VALUE;
    }
}
