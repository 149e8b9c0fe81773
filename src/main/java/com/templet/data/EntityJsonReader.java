package com.templet.data;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

public class EntityJsonReader {
    private final JsonFactory factory = new JsonFactory();

    public Entity.MapValue read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readRoot(parser);
        }
    }

    public Entity.MapValue read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readRoot(parser);
        }
    }

    private Entity.MapValue readRoot(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            return Entity.MapValue.empty();
        }
        if (token != JsonToken.START_OBJECT) {
            throw new IOException("Template data must be a JSON object, found " + token);
        }
        Entity.MapValue root = readObject(parser);
        if (parser.nextToken() != null) {
            throw new IOException("Unexpected content after the template data object");
        }
        return root;
    }

    private Entity readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING, VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT, VALUE_TRUE, VALUE_FALSE ->
                new Entity.StringValue(parser.getText());
            case VALUE_NULL -> throw new IOException(
                "null values are not supported (at " + parser.currentLocation().offsetDescription() + ")");
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private Entity.MapValue readObject(JsonParser parser) throws IOException {
        MutableMap<String, Entity> entries = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String name = parser.currentName();
            entries.put(name, readValue(parser, parser.nextToken()));
        }

        return new Entity.MapValue(entries.toImmutable());
    }

    private Entity.ListValue readArray(JsonParser parser) throws IOException {
        MutableList<Entity> elements = Lists.mutable.empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            elements.add(readValue(parser, token));
        }

        return new Entity.ListValue(elements.toImmutable());
    }
}
