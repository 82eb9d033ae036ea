package net.dbbeat.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text columns (ARGS_JSON / KWARGS_JSON).
 * Reading is lenient: a row with broken JSON still loads, with empty args.
 */
public final class JsonColumns {
    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonColumns() {
        this(new ObjectMapper());
    }

    public JsonColumns(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Object> readList(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            List<Object> v = mapper.readValue(json, LIST);
            return v == null ? new ArrayList<>() : v;
        } catch (JsonProcessingException e) {
            log.warn("unreadable args JSON, using an empty list: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
    }

    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            Map<String, Object> v = mapper.readValue(json, MAP);
            return v == null ? new LinkedHashMap<>() : v;
        } catch (JsonProcessingException e) {
            log.warn("unreadable kwargs JSON, using an empty map: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    /** @throws IllegalArgumentException when the value cannot be rendered as JSON */
    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }
}
