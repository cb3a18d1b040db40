package io.infrautomater.core.request;

import java.util.Locale;
import java.util.Optional;

/// Closed set of infrastructure categories a request can ask for.
///
/// Lookup accepts the canonical wire value plus the legacy aliases still
/// present in older request rows (`s3`, `k8s_namespace`).
public enum ResourceType {
    DATABASE("database"),
    OBJECT_STORAGE("object_storage", "s3"),
    NAMESPACE("namespace", "k8s_namespace");

    private final String value;
    private final String alias;

    ResourceType(String value) {
        this(value, null);
    }

    ResourceType(String value, String alias) {
        this.value = value;
        this.alias = alias;
    }

    /// Returns the canonical wire value.
    ///
    /// @return value such as `object_storage`, never null
    public String value() {
        return value;
    }

    /// Resolves a stored type string.
    ///
    /// @param raw the stored value, may be null
    /// @return the matching type, or empty for unknown values
    public static Optional<ResourceType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ResourceType type : values()) {
            if (type.value.equals(normalized) || normalized.equals(type.alias)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
