package com.templet.name;

import com.templet.data.Entity;
import com.templet.data.EntityKind;
import com.templet.error.InvalidTagException;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Walks path expressions through a scope.
 * <p>
 * Every segment but the last must name a map, either directly or through one index into a list.
 * The last segment names any entity, or an element of a list when it carries an index.
 */
public class PathResolver {
    private final PathParser pathParser;

    public PathResolver() {
        this(new PathParser());
    }

    public PathResolver(PathParser pathParser) {
        this.pathParser = pathParser;
    }

    /**
     * Resolves {@code path} against {@code scope}. Malformed path syntax is thrown as
     * {@link InvalidTagException}; lookup failures are returned.
     */
    public Resolution lookup(String path, Entity.MapValue scope) {
        ImmutableList<PathSegment> segments = pathParser.tokenize(path);

        Entity.MapValue current = scope;
        for (int i = 0; i < segments.size(); i++) {
            PathSegment segment = segments.get(i);
            Entity found = current.get(segment.name());
            if (found == null) {
                return Resolution.missing("Tag name not found: " + segment.name());
            }

            Entity target = found;
            if (segment.hasIndex()) {
                Resolution element = element(found, segment);
                if (!(element instanceof Resolution.Found hit)) {
                    return element;
                }
                target = hit.entity();
            }

            if (i == segments.size() - 1) {
                return Resolution.found(target);
            }

            if (target.kind() != EntityKind.MAP) {
                return Resolution.invalid("Invalid index: Name does not match a map object: " + segment.name());
            }
            current = (Entity.MapValue) target;
        }

        // tokenize never yields an empty list
        throw new IllegalStateException("Path has no segments: " + path);
    }

    public Entity resolve(String path, Entity.MapValue scope) {
        return lookup(path, scope).orElseThrow();
    }

    public String resolveString(String path, Entity.MapValue scope) {
        return requireString(path, resolve(path, scope));
    }

    public ImmutableList<Entity> resolveList(String path, Entity.MapValue scope) {
        Entity entity = resolve(path, scope);
        if (entity.kind() != EntityKind.LIST) {
            throw new InvalidTagException("Invalid tag name: Name must reference a list: " + path);
        }
        return entity.asList();
    }

    public String requireString(String path, Entity entity) {
        if (entity.kind() != EntityKind.STRING) {
            throw new InvalidTagException("Invalid tag name: Name must reference a string: " + path);
        }
        return entity.asString();
    }

    private Resolution element(Entity container, PathSegment segment) {
        if (container.kind() != EntityKind.LIST) {
            return Resolution.invalid("Only lists are supported by array indexes: " + segment.name());
        }
        ImmutableList<Entity> elements = container.asList();
        if (segment.index() >= elements.size()) {
            return Resolution.invalid("Index out of range: " + segment.name() + "[" + segment.index() + "]");
        }
        return Resolution.found(elements.get(segment.index()));
    }
}
