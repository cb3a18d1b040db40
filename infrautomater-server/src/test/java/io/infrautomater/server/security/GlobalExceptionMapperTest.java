package io.infrautomater.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.infrautomater.core.request.IllegalStatusTransitionException;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.server.persistence.PersistenceException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.sql.SQLException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(Response response) {
        return (Map<String, Object>) response.getEntity();
    }

    @Test
    void shouldHideNotFoundDetails() {
        try (Response response = mapper.toResponse(new NotFoundException("Request not found: 7"))) {
            assertThat(response.getStatus()).isEqualTo(404);
            assertThat(body(response)).containsEntry("error", "Resource not found").containsEntry("status", 404);
        }
    }

    @Test
    void shouldKeepConflictMessage() {
        WebApplicationException conflict =
                new WebApplicationException("Request 7 is pending, expected approved", Response.Status.CONFLICT);

        try (Response response = mapper.toResponse(conflict)) {
            assertThat(response.getStatus()).isEqualTo(409);
            assertThat(body(response)).containsEntry("error", "Request 7 is pending, expected approved");
        }
    }

    @Test
    void shouldMapIllegalTransitionToConflict() {
        IllegalStatusTransitionException e =
                new IllegalStatusTransitionException(RequestStatus.DESTROYED, RequestStatus.APPROVED);

        try (Response response = mapper.toResponse(e)) {
            assertThat(response.getStatus()).isEqualTo(409);
        }
    }

    @Test
    void shouldMapStoreFailureToServiceUnavailable() {
        PersistenceException e = new PersistenceException("Failed to load request: 7", new SQLException("password=hunter2"));

        try (Response response = mapper.toResponse(e)) {
            assertThat(response.getStatus()).isEqualTo(503);
            assertThat(body(response).get("error")).isEqualTo("Request store unavailable");
        }
    }

    @Test
    void shouldHideUnexpectedErrors() {
        try (Response response = mapper.toResponse(new IllegalStateException("internal detail"))) {
            assertThat(response.getStatus()).isEqualTo(500);
            assertThat(body(response)).containsEntry("error", "Internal server error");
        }
    }
}
