package io.infrautomater.core.request;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Lifecycle status of a {@link ResourceRequest}.
///
/// ### Transition Table
/// | From           | Allowed next                                    |
/// |----------------|-------------------------------------------------|
/// | `PENDING`      | `APPROVED`, `REJECTED`                          |
/// | `APPROVED`     | `PROVISIONING`, `REJECTED`                      |
/// | `PROVISIONING` | `PROVISIONED`, `FAILED`, `APPROVED` (reclaim)   |
/// | `PROVISIONED`  | `DESTROYED`                                     |
/// | `FAILED`       | `DESTROYED`                                     |
/// | `REJECTED`     | terminal                                        |
/// | `DESTROYED`    | terminal                                        |
///
/// `PROVISIONING → APPROVED` exists only for stale-claim recovery, see
/// {@link RequestStore#reclaimStale(java.time.Instant)}.
///
/// @see #transitionTo(RequestStatus)
public enum RequestStatus {
    PENDING,
    APPROVED,
    PROVISIONING,
    PROVISIONED,
    FAILED,
    REJECTED,
    DESTROYED;

    private static final Map<RequestStatus, Set<RequestStatus>> TRANSITIONS =
            Map.of(
                    PENDING, EnumSet.of(APPROVED, REJECTED),
                    APPROVED, EnumSet.of(PROVISIONING, REJECTED),
                    PROVISIONING, EnumSet.of(PROVISIONED, FAILED, APPROVED),
                    PROVISIONED, EnumSet.of(DESTROYED),
                    FAILED, EnumSet.of(DESTROYED),
                    REJECTED, EnumSet.noneOf(RequestStatus.class),
                    DESTROYED, EnumSet.noneOf(RequestStatus.class));

    /// Returns the lower-case form stored in the request table.
    ///
    /// @return wire value, never null
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Returns whether this status may move directly to `next`.
    ///
    /// @param next the target status, not null
    /// @return true if the transition table allows it
    public boolean canTransitionTo(RequestStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /// Validates a transition against the table.
    ///
    /// @param next the target status, not null
    /// @return `next`, for chaining
    /// @throws IllegalStatusTransitionException if the table does not allow it
    public RequestStatus transitionTo(RequestStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(this, next);
        }
        return next;
    }

    /// Returns every status that may move directly to `target`.
    ///
    /// @param target the status being written, not null
    /// @return predecessors of `target`, never null, may be empty
    public static Set<RequestStatus> predecessorsOf(RequestStatus target) {
        EnumSet<RequestStatus> result = EnumSet.noneOf(RequestStatus.class);
        for (RequestStatus candidate : values()) {
            if (candidate.canTransitionTo(target)) {
                result.add(candidate);
            }
        }
        return result;
    }

    /// Parses a stored status value, case-insensitively.
    ///
    /// @param value the stored value, may be null
    /// @return the matching status, or empty if unknown
    public static Optional<RequestStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.name().equals(normalized)).findFirst();
    }
}
