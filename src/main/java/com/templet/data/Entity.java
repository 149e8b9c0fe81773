package com.templet.data;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * A value in the template data model: a string, an ordered list of entities or a name to entity map.
 * <p>
 * Entities are immutable, so lists and maps share their elements freely between copies.
 * Callers check {@link #kind()} before using one of the {@code as*} accessors.
 */
public sealed interface Entity {
    EntityKind kind();

    default String asString() {
        throw new IllegalStateException("Entity of kind " + kind() + " is not a string");
    }

    default ImmutableList<Entity> asList() {
        throw new IllegalStateException("Entity of kind " + kind() + " is not a list");
    }

    default ImmutableMap<String, Entity> asMap() {
        throw new IllegalStateException("Entity of kind " + kind() + " is not a map");
    }

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static ListValue list(Entity... elements) {
        return new ListValue(Lists.immutable.of(elements));
    }

    static ListValue list(String... values) {
        return new ListValue(Lists.immutable.of(values).<Entity>collect(StringValue::new));
    }

    record StringValue(String value) implements Entity {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String entity value must not be null");
            }
        }

        @Override
        public EntityKind kind() {
            return EntityKind.STRING;
        }

        @Override
        public String asString() {
            return value;
        }
    }

    record ListValue(ImmutableList<Entity> elements) implements Entity {
        public static ListValue empty() {
            return new ListValue(Lists.immutable.empty());
        }

        @Override
        public EntityKind kind() {
            return EntityKind.LIST;
        }

        @Override
        public ImmutableList<Entity> asList() {
            return elements;
        }
    }

    /**
     * Map entity; also serves as the scope a template is rendered against.
     */
    record MapValue(ImmutableMap<String, Entity> entries) implements Entity {
        public static MapValue empty() {
            return new MapValue(Maps.immutable.empty());
        }

        public boolean contains(String name) {
            return entries.containsKey(name);
        }

        public Entity get(String name) {
            return entries.get(name);
        }

        // Copies the bindings only; the bound entities are shared with this map.
        public MapValue with(String name, Entity value) {
            return new MapValue(entries.newWithKeyValue(name, value));
        }

        public MapValue with(String name, String value) {
            return with(name, new StringValue(value));
        }

        @Override
        public EntityKind kind() {
            return EntityKind.MAP;
        }

        @Override
        public ImmutableMap<String, Entity> asMap() {
            return entries;
        }
    }
}
