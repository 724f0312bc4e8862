package com.example.promptstudio.service;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the free-form JSON documents kept in text columns (graphs, variables, messages, ...).
 * Serialization failures are programming errors and surface as {@link IllegalStateException}.
 */
@Component
@RequiredArgsConstructor
public class JsonDocuments {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() { };

    private final JsonMapper jsonMapper;

    public String write(Object value) {
        try {
            return jsonMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize JSON document", e);
        }
    }

    public String writeObject(Map<String, Object> value) {
        return write(value != null ? value : Map.of());
    }

    public Map<String, Object> readObject(String json) {
        return read(json, OBJECT);
    }

    public List<String> readStrings(String json) {
        return read(json, STRINGS);
    }

    public <T> T read(String json, TypeReference<T> type) {
        try {
            return jsonMapper.readValue(json, type);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize JSON document", e);
        }
    }

    /** Reads any JSON value (object, array, scalar) into plain Java maps/lists. */
    public Object readTree(String json) {
        try {
            return jsonMapper.readValue(json, Object.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize JSON document", e);
        }
    }
}
