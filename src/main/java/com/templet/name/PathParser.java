package com.templet.name;

import com.templet.error.InvalidTagException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class PathParser {

    public ImmutableList<PathSegment> tokenize(String path) {
        if (path == null) {
            throw new InvalidTagException("Tag name must not be null");
        }

        MutableList<PathSegment> segments = Lists.mutable.empty();
        for (String part : path.split("\\.", -1)) {
            segments.add(parseSegment(part));
        }
        return segments.toImmutable();
    }

    public PathSegment parseSegment(String text) {
        int bracket = text.indexOf('[');
        String name = bracket < 0 ? text : text.substring(0, bracket);
        if (name.isEmpty()) {
            throw new InvalidTagException("Invalid tag name: empty name in '" + text + "'");
        }
        if (bracket < 0) {
            return PathSegment.of(name);
        }

        int index = parseIndex(text.substring(bracket));
        if (index < 0) {
            throw new InvalidTagException("Invalid array index: Value must not be negative");
        }
        return new PathSegment(name, index);
    }

    // Negative values are returned as is; parseSegment rejects them.
    public int parseIndex(String text) {
        if (!text.startsWith("[") || !text.endsWith("]") || text.length() < 2) {
            throw new InvalidTagException("Invalid array syntax: Value must be enclosed with []");
        }

        String number = text.substring(1, text.length() - 1).trim();
        try {
            return Integer.parseInt(number);
        } catch (NumberFormatException e) {
            throw new InvalidTagException("Invalid array index: Value must be an integer, got '" + number + "'");
        }
    }
}
