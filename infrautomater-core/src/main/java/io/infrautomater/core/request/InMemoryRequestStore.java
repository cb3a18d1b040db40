package io.infrautomater.core.request;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory request store (default implementation).
///
/// Thread-safe, no external dependencies. Every write goes through
/// {@link ConcurrentHashMap#computeIfPresent}, which makes each status or
/// notes update atomic per request id.
///
/// @see RequestStore for contract
public final class InMemoryRequestStore implements RequestStore {

    static final String RECLAIM_NOTE = "Reclaimed stale provisioning claim last updated at ";

    private final Map<Long, ResourceRequest> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryRequestStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRequestStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Stores a request, assigning an id when `request.id()` is zero.
    ///
    /// Missing timestamps are filled with the store clock.
    ///
    /// @param request the request to store, not null
    /// @return the stored copy, never null
    public ResourceRequest save(ResourceRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        long id = request.id() > 0 ? request.id() : sequence.incrementAndGet();
        sequence.accumulateAndGet(id, Math::max);
        Instant now = clock.instant();
        ResourceRequest stored =
                new ResourceRequest(
                        id,
                        request.name(),
                        request.resourceType(),
                        request.config(),
                        request.status(),
                        request.notes(),
                        request.userId(),
                        request.teamId(),
                        request.createdAt() != null ? request.createdAt() : now,
                        request.updatedAt() != null ? request.updatedAt() : now);
        storage.put(id, stored);
        return stored;
    }

    @Override
    public Optional<ResourceRequest> get(long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public boolean compareAndSetStatus(long id, RequestStatus expected, RequestStatus next) {
        return compareAndSetStatus(id, expected, next, null);
    }

    @Override
    public boolean compareAndSetStatus(
            long id, RequestStatus expected, RequestStatus next, String note) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(next, "next must not be null");
        expected.transitionTo(next);

        AtomicBoolean moved = new AtomicBoolean(false);
        storage.computeIfPresent(
                id,
                (key, current) -> {
                    if (current.status() != expected) {
                        return current;
                    }
                    moved.set(true);
                    Instant now = clock.instant();
                    ResourceRequest updated = current.withStatus(next, now);
                    return note != null ? updated.withAppendedNote(note, now) : updated;
                });
        return moved.get();
    }

    @Override
    public void appendNotes(long id, String text) {
        Objects.requireNonNull(text, "text must not be null");
        storage.computeIfPresent(id, (key, current) -> current.withAppendedNote(text, clock.instant()));
    }

    @Override
    public void setStatus(long id, RequestStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        storage.computeIfPresent(
                id,
                (key, current) -> {
                    if (current.status() == status) {
                        return current;
                    }
                    current.status().transitionTo(status);
                    return current.withStatus(status, clock.instant());
                });
    }

    @Override
    public List<Long> findIdsByStatus(RequestStatus status, int limit) {
        Objects.requireNonNull(status, "status must not be null");
        return storage.values().stream()
                .filter(r -> r.status() == status)
                .sorted(
                        Comparator.comparing(ResourceRequest::createdAt)
                                .thenComparingLong(ResourceRequest::id))
                .limit(limit)
                .map(ResourceRequest::id)
                .toList();
    }

    @Override
    public List<Long> reclaimStale(Instant olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        List<Long> reclaimed = new ArrayList<>();
        for (Long id : storage.keySet()) {
            storage.computeIfPresent(
                    id,
                    (key, current) -> {
                        if (current.status() != RequestStatus.PROVISIONING
                                || !current.updatedAt().isBefore(olderThan)) {
                            return current;
                        }
                        reclaimed.add(key);
                        Instant now = clock.instant();
                        return current.withStatus(RequestStatus.APPROVED, now)
                                .withAppendedNote(RECLAIM_NOTE + current.updatedAt(), now);
                    });
        }
        return reclaimed;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    /// Returns the number of stored requests (useful for testing).
    public int size() {
        return storage.size();
    }
}
