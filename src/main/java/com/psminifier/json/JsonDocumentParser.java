package com.psminifier.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Streams a JSON document into the {@link JsonValue} model.
 */
public class JsonDocumentParser {
    private final JsonFactory factory = new JsonFactory();

    public JsonValue parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Empty JSON document");
            }
            return parseValue(parser, token);
        }
    }

    public JsonValue parse(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input);
        }
    }

    private JsonValue parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON document");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonValue.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> JsonValue.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonValue.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonValue.JsonBoolean(true);
            case VALUE_FALSE -> new JsonValue.JsonBoolean(false);
            case VALUE_NULL -> new JsonValue.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonValue.JsonObject parseObject(JsonParser parser) throws IOException {
        var fields = Maps.mutable.<String, JsonValue>empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonValue value = parseValue(parser, parser.nextToken());
            fields.put(fieldName, value);
        }

        return new JsonValue.JsonObject(fields);
    }

    private JsonValue.JsonArray parseArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<JsonValue>empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new JsonValue.JsonArray(elements);
    }
}
