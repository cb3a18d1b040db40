package io.infrautomater.core.orchestration;

import java.time.Duration;

/// Lifecycle callbacks from the {@link ProvisioningWorkerPool}.
///
/// All methods have no-op defaults. Callbacks arrive on worker threads and
/// must not block.
///
/// ```
/// onAttemptStarted(id, action, 1/3)
/// onRetryScheduled(id, action, 1/3, 60s, reason)
/// onAttemptStarted(id, action, 2/3)
/// onCompleted(id, action, outcome)
/// ```
public interface ProvisioningListener {

    ProvisioningListener NOOP = new ProvisioningListener() {};

    /// Called before an attempt runs.
    ///
    /// @param requestId the request
    /// @param action job kind, not null
    /// @param attempt the attempt about to run, not null
    default void onAttemptStarted(long requestId, ProvisioningAction action, ProvisioningAttempt attempt) {}

    /// Called when a failed attempt will be retried.
    ///
    /// @param requestId the request
    /// @param action job kind, not null
    /// @param failedAttempt the attempt that failed, not null
    /// @param delay wait before the next attempt, not null
    /// @param reason scrubbed failure text, not null
    default void onRetryScheduled(
            long requestId,
            ProvisioningAction action,
            ProvisioningAttempt failedAttempt,
            Duration delay,
            String reason) {}

    /// Called once per job with its final outcome.
    ///
    /// @param requestId the request
    /// @param action job kind, not null
    /// @param outcome terminal outcome, not null
    default void onCompleted(long requestId, ProvisioningAction action, ProvisioningOutcome outcome) {}
}
