package io.infrautomater.server.persistence;

import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import io.infrautomater.serialization.InfrautomaterSerializer;
import io.infrautomater.serialization.RequestConfigCodec;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/// Shared Testcontainers setup for JDBC store tests.
///
/// Starts a PostgreSQL container per test class and runs the Flyway migrations
/// shipped with the server. Skipped when no Docker daemon is reachable.
@Testcontainers(disabledWithoutDocker = true)
abstract class JdbcRequestStoreTestBase {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:17-alpine");

    static DataSource dataSource;
    static RequestConfigCodec configCodec;

    /// @apiNote **Side effects**: creates the `infrautomater` schema and tables
    @BeforeAll
    static void initPostgres() {
        PGSimpleDataSource ds = new PGSimpleDataSource();
        ds.setUrl(POSTGRES.getJdbcUrl());
        ds.setUser(POSTGRES.getUsername());
        ds.setPassword(POSTGRES.getPassword());
        dataSource = ds;

        Flyway.configure()
                .dataSource(dataSource)
                .schemas("infrautomater")
                .locations("classpath:db/migration")
                .load()
                .migrate();

        configCodec = new RequestConfigCodec(InfrautomaterSerializer.createMapper());
    }

    static void truncate() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE infrautomater.resource_requests RESTART IDENTITY");
        }
    }

    static ResourceRequest request(String name, RequestStatus status) {
        return ResourceRequest.builder()
                .name(name)
                .resourceType(ResourceType.DATABASE)
                .configValue("engine", "postgres")
                .configValue("size", "small")
                .status(status)
                .userId(11L)
                .teamId(7L)
                .build();
    }
}
