package io.infrautomater.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Converts the free-form per-type config bag of a request to and from the
/// JSON document stored alongside the request row.
///
/// A null or blank document reads as an empty map. A document that is not a
/// JSON object is rejected rather than coerced.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class RequestConfigCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RequestConfigCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /// Encodes a config map.
    ///
    /// @param config the config values, may be null
    /// @return JSON object text, `{}` for null or empty input
    /// @throws IllegalArgumentException if a value cannot be serialized
    public String toJson(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode request config: " + e.getOriginalMessage(), e);
        }
    }

    /// Decodes a stored config document.
    ///
    /// @param json stored JSON text, may be null
    /// @return mutable map preserving key order, never null
    /// @throws IllegalArgumentException if the text is not a JSON object
    public Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || node.isNull()) {
                return new LinkedHashMap<>();
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException(
                        "Request config must be a JSON object, got " + node.getNodeType());
            }
            return objectMapper.convertValue(node, CONFIG_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode request config: " + e.getOriginalMessage(), e);
        }
    }
}
