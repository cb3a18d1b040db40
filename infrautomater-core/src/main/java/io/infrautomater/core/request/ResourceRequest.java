package io.infrautomater.core.request;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable snapshot of a resource request as read from the {@link RequestStore}.
///
/// The resource type is kept as the raw stored string so that rows carrying an
/// unknown type can still be loaded and reported; resolve it with
/// {@link #type()}.
///
/// @param id store identity, immutable
/// @param name user-supplied display name, free text, not null
/// @param resourceType raw stored type value, may be unknown, not null
/// @param config scalar parameters keyed by name, semantics per type, never null
/// @param status current lifecycle status, not null
/// @param notes append-only admin/system annotations, never null (may be empty)
/// @param userId owning user, opaque, may be null
/// @param teamId owning team, opaque, may be null
/// @param createdAt creation time, may be null for unsaved requests
/// @param updatedAt last write time, may be null for unsaved requests
public record ResourceRequest(
        long id,
        String name,
        String resourceType,
        Map<String, Object> config,
        RequestStatus status,
        String notes,
        Long userId,
        Long teamId,
        Instant createdAt,
        Instant updatedAt) {

    public ResourceRequest {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(resourceType, "resourceType must not be null");
        Objects.requireNonNull(status, "status must not be null");
        config =
                config == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        notes = notes == null ? "" : notes;
    }

    /// Resolves the raw type string against the closed {@link ResourceType} set.
    ///
    /// @return the resource type, or empty when the stored value is unknown
    public Optional<ResourceType> type() {
        return ResourceType.fromValue(resourceType);
    }

    /// Returns a copy with a new status and update time.
    ///
    /// Does not validate the transition; stores call
    /// {@link RequestStatus#transitionTo(RequestStatus)} first.
    ///
    /// @param next the new status, not null
    /// @param at the write time, not null
    /// @return updated copy, never null
    public ResourceRequest withStatus(RequestStatus next, Instant at) {
        return new ResourceRequest(
                id, name, resourceType, config, next, notes, userId, teamId, createdAt, at);
    }

    /// Returns a copy with `text` appended to the notes log.
    ///
    /// @param text the annotation to append, not null
    /// @param at the write time, not null
    /// @return updated copy, never null
    public ResourceRequest withAppendedNote(String text, Instant at) {
        return new ResourceRequest(
                id,
                name,
                resourceType,
                config,
                status,
                appendNote(notes, text),
                userId,
                teamId,
                createdAt,
                at);
    }

    /// Appends an annotation to an existing notes log, separated by a blank line.
    ///
    /// @param existing current notes, may be null or blank
    /// @param text annotation to append, not null
    /// @return combined notes, never null
    public static String appendNote(String existing, String text) {
        if (existing == null || existing.isBlank()) {
            return text;
        }
        return existing + "\n\n" + text;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder, mainly for tests and the in-memory store.
    public static final class Builder {
        private long id;
        private String name;
        private String resourceType;
        private Map<String, Object> config = new LinkedHashMap<>();
        private RequestStatus status = RequestStatus.PENDING;
        private String notes = "";
        private Long userId;
        private Long teamId;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder resourceType(ResourceType resourceType) {
            this.resourceType = resourceType.value();
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = new LinkedHashMap<>(config);
            return this;
        }

        public Builder configValue(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder status(RequestStatus status) {
            this.status = status;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder userId(Long userId) {
            this.userId = userId;
            return this;
        }

        public Builder teamId(Long teamId) {
            this.teamId = teamId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ResourceRequest build() {
            return new ResourceRequest(
                    id,
                    name,
                    resourceType,
                    config,
                    status,
                    notes,
                    userId,
                    teamId,
                    createdAt,
                    updatedAt);
        }
    }
}
