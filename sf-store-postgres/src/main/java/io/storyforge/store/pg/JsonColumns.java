package io.storyforge.store.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storyforge.store.StorageException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** JSON text columns: payloads, world-state documents, citations. */
public final class JsonColumns {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS = new TypeReference<>() {};

    private final ObjectMapper json;

    public JsonColumns(ObjectMapper json) {
        this.json = Objects.requireNonNull(json);
    }

    public String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public Map<String, Object> readMap(String text) {
        if (text == null || text.isBlank()) return new LinkedHashMap<>();
        try {
            return json.readValue(text, MAP);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt JSON object column", e);
        }
    }

    public List<Map<String, Object>> readList(String text) {
        if (text == null || text.isBlank()) return List.of();
        try {
            return json.readValue(text, LIST_OF_MAPS);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt JSON array column", e);
        }
    }
}
