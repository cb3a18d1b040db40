package io.infrautomater.server.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Thin JDBC helper shared by the request store.
///
/// SQL lives in `static final` constants on the caller; parameters are bound
/// only through a {@link StatementPreparer}, so statements are never built by
/// concatenation. Every {@link SQLException} leaves as a
/// {@link PersistenceException} carrying the caller's context message.
///
/// Single statements run in auto-commit mode on their own pooled connection.
/// {@link #inTransaction} groups several statements on one connection.
///
/// @implNote Thread-safe. Stateless beyond the injected {@link DataSource}.
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes an INSERT, UPDATE or DELETE.
    ///
    /// @return number of affected rows
    /// @throws PersistenceException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return update(conn, sql, preparer);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a query (or a DML statement with `RETURNING`) yielding at most one row.
    ///
    /// @throws PersistenceException if the query fails
    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return queryOne(conn, sql, preparer, mapper);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a query (or a DML statement with `RETURNING`) yielding any number of rows.
    ///
    /// @throws PersistenceException if the query fails
    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Runs `work` on one connection inside a transaction.
    ///
    /// Commits when `work` returns, rolls back when it throws. Runtime
    /// exceptions raised by `work` are rethrown unchanged after the rollback.
    ///
    /// @throws PersistenceException if a statement or the commit fails
    <T> T inTransaction(TransactionWork<T> work, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    static int update(Connection conn, String sql, StatementPreparer preparer) throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        }
    }

    static <T> Optional<T> queryOne(
            Connection conn, String sql, StatementPreparer preparer, RowMapper<T> mapper)
            throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    /// Binds parameters to a {@link PreparedStatement} before execution.
    ///
    /// {@snippet :
    /// StatementPreparer binder = ps -> {
    ///     ps.setString(1, status.value());
    ///     ps.setLong(2, requestId);
    /// };
    /// }
    @FunctionalInterface
    interface StatementPreparer {

        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps the current {@link ResultSet} row to a value.
    @FunctionalInterface
    interface RowMapper<T> {

        T map(ResultSet rs) throws SQLException;
    }

    /// Statements to run on a single transactional connection.
    @FunctionalInterface
    interface TransactionWork<T> {

        T run(Connection conn) throws SQLException;
    }
}
