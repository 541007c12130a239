package com.challenges.collector.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads JSON into plain records: objects become {@link MutableMap}s, arrays
 * {@link MutableList}s, integers {@link Long}s, other numbers {@link Double}s.
 */
public class JsonRecordReader {
    private final JsonFactory factory = new JsonFactory();

    /**
     * Reads a single JSON document. Anything but whitespace after it is an error.
     */
    public Object read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("No JSON content");
            }
            Object value = parseValue(parser, token);
            if (parser.nextToken() != null) {
                throw new IOException("Unexpected content after the JSON document");
            }
            return value;
        }
    }

    public Object read(String json) throws IOException {
        return read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Reads a batch of records. A top-level array is the list of records; any
     * other input is read as a sequence of concatenated documents, one record each.
     */
    public MutableList<Object> readAll(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.START_ARRAY) {
                MutableList<Object> records = parseArray(parser);
                if (parser.nextToken() != null) {
                    throw new IOException("Unexpected content after the top-level array");
                }
                return records;
            }

            MutableList<Object> records = Lists.mutable.empty();
            while (token != null) {
                records.add(parseValue(parser, token));
                token = parser.nextToken();
            }
            return records;
        }
    }

    public MutableList<Object> readAll(String json) throws IOException {
        return readAll(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private MutableMap<String, Object> parseObject(JsonParser parser) throws IOException {
        MutableMap<String, Object> fields = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return fields;
    }

    private MutableList<Object> parseArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            elements.add(parseValue(parser, token));
        }

        return elements;
    }
}
