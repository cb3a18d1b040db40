package io.infrautomater.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.infrautomater.core.request.ResourceRequest;

/// Utility class for serializing resource requests to and from JSON.
///
/// Provides a pre-configured `ObjectMapper` that writes `java.time` values as
/// ISO-8601 strings and request statuses as their lowercase wire values.
///
/// ### Usage
/// {@snippet :
/// String json = InfrautomaterSerializer.toJson(request);
/// ResourceRequest restored = InfrautomaterSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see InfrautomaterJacksonModule for the registered type handlers
public final class InfrautomaterSerializer {

    private InfrautomaterSerializer() {}

    /// Serializes a request to JSON.
    ///
    /// @param request the request to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ResourceRequest request) {
        try {
            return createMapper().writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request: " + e.getMessage(), e);
        }
    }

    /// Deserializes a request from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized request, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static ResourceRequest fromJson(String json) {
        try {
            return createMapper().readValue(json, ResourceRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize request: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for infrautomater types.
    ///
    /// Registers:
    /// - `InfrautomaterJacksonModule` for status wire values
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new InfrautomaterJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
