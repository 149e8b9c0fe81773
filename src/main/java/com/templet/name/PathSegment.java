package com.templet.name;

public record PathSegment(String name, Integer index) {
    public static PathSegment of(String name) {
        return new PathSegment(name, null);
    }

    public boolean hasIndex() {
        return index != null;
    }
}
