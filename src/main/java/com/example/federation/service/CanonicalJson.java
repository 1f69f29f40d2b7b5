package com.example.federation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Matrix canonical JSON: object keys sorted, no insignificant whitespace, UTF-8.
 */
@Component
public class CanonicalJson {

    private final ObjectMapper mapper;

    public CanonicalJson() {
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public byte[] encode(Map<String, Object> value) {
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not representable as JSON", e);
        }
    }

    /**
     * Canonical bytes of {@code value} with the given top-level keys removed.
     */
    public byte[] encodeWithout(Map<String, Object> value, String... keys) {
        Map<String, Object> copy = new LinkedHashMap<>(value);
        for (String key : keys) {
            copy.remove(key);
        }
        return encode(copy);
    }
}
