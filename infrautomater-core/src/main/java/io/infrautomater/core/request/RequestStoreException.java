package io.infrautomater.core.request;

import java.io.Serial;

/// Unchecked failure raised by a {@link RequestStore} when the backing store
/// cannot be reached or a write cannot be committed.
///
/// The orchestrator treats it as transient: the attempt is abandoned and
/// handed back to the retry wrapper.
public class RequestStoreException extends RuntimeException {

    @Serial private static final long serialVersionUID = 6120855263710935410L;

    public RequestStoreException(String message) {
        super(message);
    }

    public RequestStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
