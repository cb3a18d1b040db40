package io.infrautomater.core.request;

import java.io.Serial;

/// Thrown when a status write is not permitted by the {@link RequestStatus} transition table.
public class IllegalStatusTransitionException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127340921658813270L;

    private final RequestStatus from;
    private final RequestStatus to;

    public IllegalStatusTransitionException(RequestStatus from, RequestStatus to) {
        super("Illegal status transition: " + from.value() + " -> " + to.value());
        this.from = from;
        this.to = to;
    }

    public RequestStatus getFrom() {
        return from;
    }

    public RequestStatus getTo() {
        return to;
    }
}
