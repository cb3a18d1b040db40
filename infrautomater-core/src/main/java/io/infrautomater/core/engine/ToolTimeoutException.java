package io.infrautomater.core.engine;

import java.io.IOException;
import java.time.Duration;

/// A tool process exceeded its wall-clock limit and was killed.
public class ToolTimeoutException extends IOException {

    private final Duration timeout;

    public ToolTimeoutException(String step, Duration timeout) {
        super("Tool step '" + step + "' timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
