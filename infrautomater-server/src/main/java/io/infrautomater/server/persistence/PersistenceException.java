package io.infrautomater.server.persistence;

import io.infrautomater.core.request.RequestStoreException;
import java.io.Serial;

/// Unchecked exception for database persistence failures.
///
/// Wraps {@link java.sql.SQLException} as a {@link RequestStoreException} so the
/// provisioning core treats database faults as transient.
///
/// @see JdbcRequestStore
public class PersistenceException extends RequestStoreException {

    @Serial private static final long serialVersionUID = -2280514403512467201L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
