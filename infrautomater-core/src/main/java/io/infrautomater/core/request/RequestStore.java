package io.infrautomater.core.request;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/// Narrow read/update contract onto the request persistence layer.
///
/// The provisioning core never owns request rows; it only reads them and
/// issues single-writer status and notes updates. Every method must be
/// callable from a worker thread with no request-serving context, and every
/// write must be one atomic commit.
///
/// ### Mutual Exclusion
/// {@link #compareAndSetStatus(long, RequestStatus, RequestStatus)} is the sole
/// synchronization point between workers: of two racing callers expecting
/// `APPROVED`, exactly one observes `true`.
///
/// ### Errors
/// Connectivity or commit failures surface as {@link RequestStoreException}.
/// Writes not allowed by the {@link RequestStatus} transition table raise
/// {@link IllegalStatusTransitionException}.
///
/// @see InMemoryRequestStore
public interface RequestStore {

    /// Loads a request.
    ///
    /// @param id the request id
    /// @return the request, or empty if no such row exists
    Optional<ResourceRequest> get(long id);

    /// Atomically moves a request from `expected` to `next`.
    ///
    /// @param id the request id
    /// @param expected the status the row must currently hold, not null
    /// @param next the new status, not null
    /// @return true if this call performed the write, false if the row was
    ///     missing or held a different status
    /// @throws IllegalStatusTransitionException if `expected → next` is not allowed
    boolean compareAndSetStatus(long id, RequestStatus expected, RequestStatus next);

    /// Atomically moves a request from `expected` to `next` and appends `note`
    /// in the same commit.
    ///
    /// The default implementation issues two writes; persistent stores override
    /// it with a single statement.
    ///
    /// @param id the request id
    /// @param expected the status the row must currently hold, not null
    /// @param next the new status, not null
    /// @param note annotation to append when the transition happens, not null
    /// @return true if this call performed the write
    default boolean compareAndSetStatus(
            long id, RequestStatus expected, RequestStatus next, String note) {
        boolean moved = compareAndSetStatus(id, expected, next);
        if (moved) {
            appendNotes(id, note);
        }
        return moved;
    }

    /// Appends text to the request's notes log.
    ///
    /// @param id the request id
    /// @param text the annotation, not null
    void appendNotes(long id, String text);

    /// Sets the status unconditionally, subject to the transition table.
    ///
    /// @param id the request id
    /// @param status the new status, not null
    /// @throws IllegalStatusTransitionException if the current status cannot move to `status`
    void setStatus(long id, RequestStatus status);

    /// Lists ids of requests holding a given status, oldest first.
    ///
    /// @param status the status to filter on, not null
    /// @param limit maximum number of ids to return, positive
    /// @return matching ids, never null
    List<Long> findIdsByStatus(RequestStatus status, int limit);

    /// Returns `PROVISIONING` requests whose last write is older than
    /// `olderThan` to `APPROVED`, annotating each with a recovery note.
    ///
    /// Each row is moved atomically; concurrent sweepers never both reclaim
    /// the same request.
    ///
    /// @param olderThan claims last written before this instant are stale, not null
    /// @return ids of reclaimed requests, never null
    List<Long> reclaimStale(Instant olderThan);
}
