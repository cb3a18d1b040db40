package io.infrautomater.core.execution;

/// Classification of a failed provisioning step.
///
/// The retry wrapper consults {@link #isRetryable()}; terminal kinds finalize
/// the request as `failed` without consuming a retry.
public enum FailureKind {
    /// Request carries a resource type with no generator. Terminal, no side effects.
    UNKNOWN_RESOURCE_TYPE(false),
    /// Request parameters cannot be turned into definitions. Terminal.
    INVALID_CONFIG(false),
    /// Provisioning tool binary is not installed. Terminal, environment misconfiguration.
    TOOL_NOT_FOUND(false),
    /// A tool step exceeded its wall-clock limit.
    TOOL_TIMEOUT(true),
    /// A tool step exited non-zero.
    TOOL_EXECUTION(true),
    /// Store or filesystem fault outside the tool.
    TRANSIENT(true);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
