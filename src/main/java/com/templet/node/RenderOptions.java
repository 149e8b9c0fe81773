package com.templet.node;

public record RenderOptions(boolean strictMissingValues) {
    public static final RenderOptions DEFAULT = new RenderOptions(false);
    public static final RenderOptions STRICT = new RenderOptions(true);
}
