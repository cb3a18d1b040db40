package io.infrautomater.core.orchestration;

import io.infrautomater.core.execution.FailureKind;
import java.util.Objects;

/// Result of one provisioning or destroy attempt, as seen by the caller.
///
/// ### Permitted Subtypes
/// - {@link Provisioned} - request moved to `provisioned`
/// - {@link Failed} - attempt failed; for provisioning the request is `failed`
/// - {@link Skipped} - request was not in a state this attempt may act on; nothing written
/// - {@link NotFound} - request (or, for destroy, its workspace) does not exist
/// - {@link RetryScheduled} - retryable failure, request still claimed, caller should retry
/// - {@link Destroyed} - request moved to `destroyed` and its workspace removed
/// - {@link Planned} - destroy dry-run computed a plan; nothing mutated
///
/// All text carried here has been scrubbed of secrets seen during the attempt.
public sealed interface ProvisioningOutcome {

    /// Returns the request this outcome belongs to.
    ///
    /// @return request id
    long requestId();

    /// Returns whether the caller should stop retrying.
    ///
    /// @return false only for {@link RetryScheduled}
    default boolean isTerminal() {
        return true;
    }

    /// Returns whether the attempt achieved what it set out to do.
    ///
    /// @return true for {@link Provisioned}, {@link Destroyed} and {@link Planned}
    default boolean isSuccess() {
        return false;
    }

    /// @param requestId the request
    /// @param output summary of tool outputs, or plan text under dry-run, not null
    record Provisioned(long requestId, String output) implements ProvisioningOutcome {
        public Provisioned {
            Objects.requireNonNull(output, "output must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /// @param requestId the request
    /// @param kind failure classification, not null
    /// @param error diagnostic text, not null
    record Failed(long requestId, FailureKind kind, String error) implements ProvisioningOutcome {
        public Failed {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /// @param requestId the request
    /// @param reason why the attempt did nothing, not null
    record Skipped(long requestId, String reason) implements ProvisioningOutcome {
        public Skipped {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    /// @param requestId the request
    /// @param reason what was missing, not null
    record NotFound(long requestId, String reason) implements ProvisioningOutcome {
        public NotFound {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    /// @param requestId the request
    /// @param kind retryable failure classification, not null
    /// @param error diagnostic text of the failed attempt, not null
    record RetryScheduled(long requestId, FailureKind kind, String error)
            implements ProvisioningOutcome {
        public RetryScheduled {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    /// @param requestId the request
    /// @param output tool output of the destroy step, not null
    record Destroyed(long requestId, String output) implements ProvisioningOutcome {
        public Destroyed {
            Objects.requireNonNull(output, "output must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /// @param requestId the request
    /// @param plan destroy plan text, not null
    record Planned(long requestId, String plan) implements ProvisioningOutcome {
        public Planned {
            Objects.requireNonNull(plan, "plan must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }
}
