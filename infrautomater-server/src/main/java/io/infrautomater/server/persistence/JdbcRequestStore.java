package io.infrautomater.server.persistence;

import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.serialization.RequestConfigCodec;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed {@link RequestStore}.
///
/// Rows live in `infrautomater.resource_requests`; the per-type config bag is a
/// JSONB column encoded by {@link RequestConfigCodec}.
///
/// ### Atomicity
/// - compare-and-set is a single `UPDATE … WHERE id = ? AND status = ?`; under
///   `READ COMMITTED` the second of two racing updates re-checks the predicate
///   against the committed row and affects nothing
/// - status plus note writes are one statement, so a transition and its
///   annotation commit together
/// - {@link #setStatus} locks the row (`FOR UPDATE`) while it validates the
///   transition
/// - {@link #reclaimStale} is one `UPDATE … RETURNING`
///
/// Notes are joined with a blank line, matching
/// {@link ResourceRequest#appendNote(String, String)}.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_resource_requests` has run
/// - **Errors**: every {@link SQLException} surfaces as {@link PersistenceException}
///
/// @implNote Thread-safe. Each call acquires its own connection from the
/// Agroal pool via {@link JdbcSupport}.
public class JdbcRequestStore implements RequestStore {

    static final String RECLAIM_NOTE = "Reclaimed stale provisioning claim last updated at ";

    // --- SQL constants ---

    private static final String COLUMNS =
            "id, name, resource_type, config, status, admin_notes, user_id, team_id, created_at, updated_at";

    private static final String SQL_INSERT =
            """
            INSERT INTO infrautomater.resource_requests
                   (name, resource_type, config, status, admin_notes, user_id, team_id)
            VALUES (?, ?, ?::jsonb, ?, ?, ?, ?)
            RETURNING id, name, resource_type, config, status, admin_notes, user_id, team_id,
                      created_at, updated_at
            """;

    private static final String SQL_FIND_BY_ID =
            "SELECT " + COLUMNS + " FROM infrautomater.resource_requests WHERE id = ?";

    private static final String SQL_COMPARE_AND_SET =
            """
            UPDATE infrautomater.resource_requests
               SET status = ?, updated_at = now()
             WHERE id = ? AND status = ?
            """;

    private static final String SQL_COMPARE_AND_SET_WITH_NOTE =
            """
            UPDATE infrautomater.resource_requests
               SET status      = ?,
                   admin_notes = CASE WHEN btrim(admin_notes) = '' THEN ?
                                      ELSE admin_notes || chr(10) || chr(10) || ? END,
                   updated_at  = now()
             WHERE id = ? AND status = ?
            """;

    private static final String SQL_APPEND_NOTE =
            """
            UPDATE infrautomater.resource_requests
               SET admin_notes = CASE WHEN btrim(admin_notes) = '' THEN ?
                                      ELSE admin_notes || chr(10) || chr(10) || ? END,
                   updated_at  = now()
             WHERE id = ?
            """;

    private static final String SQL_LOCK_STATUS =
            "SELECT status FROM infrautomater.resource_requests WHERE id = ? FOR UPDATE";

    private static final String SQL_SET_STATUS =
            "UPDATE infrautomater.resource_requests SET status = ?, updated_at = now() WHERE id = ?";

    private static final String SQL_FIND_IDS_BY_STATUS =
            """
            SELECT id FROM infrautomater.resource_requests
             WHERE status = ?
             ORDER BY created_at, id
             LIMIT ?
            """;

    /// Column references on the right-hand side of SET see the pre-update row,
    /// so the note records the stale timestamp.
    private static final String SQL_RECLAIM_STALE =
            """
            UPDATE infrautomater.resource_requests
               SET status      = 'approved',
                   admin_notes = CASE
                       WHEN btrim(admin_notes) = ''
                       THEN ? || to_char(updated_at AT TIME ZONE 'UTC', 'YYYY-MM-DD"T"HH24:MI:SS"Z"')
                       ELSE admin_notes || chr(10) || chr(10) || ?
                            || to_char(updated_at AT TIME ZONE 'UTC', 'YYYY-MM-DD"T"HH24:MI:SS"Z"')
                   END,
                   updated_at  = now()
             WHERE status = 'provisioning' AND updated_at < ?
             RETURNING id
            """;

    // --- Fields ---

    private final JdbcSupport jdbc;
    private final RequestConfigCodec configCodec;

    public JdbcRequestStore(DataSource dataSource, RequestConfigCodec configCodec) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
        this.configCodec = Objects.requireNonNull(configCodec, "configCodec must not be null");
    }

    /// Inserts a new request row; the id and timestamps are assigned by the database.
    ///
    /// @param request the request to insert, not null; its id is ignored
    /// @return the stored row, never null
    public ResourceRequest insert(ResourceRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String config = configCodec.toJson(request.config());
        return jdbc.queryOne(
                        SQL_INSERT,
                        ps -> {
                            ps.setString(1, request.name());
                            ps.setString(2, request.resourceType());
                            ps.setString(3, config);
                            ps.setString(4, request.status().value());
                            ps.setString(5, request.notes());
                            setNullableLong(ps, 6, request.userId());
                            setNullableLong(ps, 7, request.teamId());
                        },
                        this::mapRow,
                        "Failed to insert request: " + request.name())
                .orElseThrow(() -> new PersistenceException("Insert returned no row"));
    }

    @Override
    public Optional<ResourceRequest> get(long id) {
        return jdbc.queryOne(
                SQL_FIND_BY_ID, ps -> ps.setLong(1, id), this::mapRow, "Failed to load request: " + id);
    }

    @Override
    public boolean compareAndSetStatus(long id, RequestStatus expected, RequestStatus next) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(next, "next must not be null");
        expected.transitionTo(next);

        return jdbc.update(
                        SQL_COMPARE_AND_SET,
                        ps -> {
                            ps.setString(1, next.value());
                            ps.setLong(2, id);
                            ps.setString(3, expected.value());
                        },
                        "Failed to move request " + id + " to " + next.value())
                > 0;
    }

    @Override
    public boolean compareAndSetStatus(
            long id, RequestStatus expected, RequestStatus next, String note) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(next, "next must not be null");
        Objects.requireNonNull(note, "note must not be null");
        expected.transitionTo(next);

        return jdbc.update(
                        SQL_COMPARE_AND_SET_WITH_NOTE,
                        ps -> {
                            ps.setString(1, next.value());
                            ps.setString(2, note);
                            ps.setString(3, note);
                            ps.setLong(4, id);
                            ps.setString(5, expected.value());
                        },
                        "Failed to move request " + id + " to " + next.value())
                > 0;
    }

    @Override
    public void appendNotes(long id, String text) {
        Objects.requireNonNull(text, "text must not be null");
        jdbc.update(
                SQL_APPEND_NOTE,
                ps -> {
                    ps.setString(1, text);
                    ps.setString(2, text);
                    ps.setLong(3, id);
                },
                "Failed to append notes to request: " + id);
    }

    @Override
    public void setStatus(long id, RequestStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        jdbc.inTransaction(
                conn -> {
                    Optional<String> current =
                            JdbcSupport.queryOne(
                                    conn, SQL_LOCK_STATUS, ps -> ps.setLong(1, id), rs -> rs.getString(1));
                    if (current.isEmpty()) {
                        return null;
                    }
                    RequestStatus from = parseStatus(current.get(), id);
                    if (from == status) {
                        return null;
                    }
                    from.transitionTo(status);
                    JdbcSupport.update(
                            conn,
                            SQL_SET_STATUS,
                            ps -> {
                                ps.setString(1, status.value());
                                ps.setLong(2, id);
                            });
                    return null;
                },
                "Failed to set status of request " + id);
    }

    @Override
    public List<Long> findIdsByStatus(RequestStatus status, int limit) {
        Objects.requireNonNull(status, "status must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return jdbc.queryList(
                SQL_FIND_IDS_BY_STATUS,
                ps -> {
                    ps.setString(1, status.value());
                    ps.setInt(2, limit);
                },
                rs -> rs.getLong("id"),
                "Failed to list " + status.value() + " requests");
    }

    @Override
    public List<Long> reclaimStale(Instant olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        return jdbc.queryList(
                SQL_RECLAIM_STALE,
                ps -> {
                    ps.setString(1, RECLAIM_NOTE);
                    ps.setString(2, RECLAIM_NOTE);
                    ps.setObject(3, OffsetDateTime.ofInstant(olderThan, ZoneOffset.UTC));
                },
                rs -> rs.getLong("id"),
                "Failed to reclaim stale provisioning claims");
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private ResourceRequest mapRow(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        return new ResourceRequest(
                id,
                rs.getString("name"),
                rs.getString("resource_type"),
                configCodec.fromJson(rs.getString("config")),
                parseStatus(rs.getString("status"), id),
                rs.getString("admin_notes"),
                rs.getObject("user_id", Long.class),
                rs.getObject("team_id", Long.class),
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
    }

    private static RequestStatus parseStatus(String raw, long id) {
        return RequestStatus.fromValue(raw)
                .orElseThrow(
                        () -> new PersistenceException("Request " + id + " has unknown status: " + raw));
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }
}
