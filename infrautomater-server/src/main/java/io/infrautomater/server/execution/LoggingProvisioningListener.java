package io.infrautomater.server.execution;

import io.infrautomater.core.orchestration.ProvisioningAction;
import io.infrautomater.core.orchestration.ProvisioningAttempt;
import io.infrautomater.core.orchestration.ProvisioningListener;
import io.infrautomater.core.orchestration.ProvisioningOutcome;
import io.infrautomater.server.validation.LogSanitizer;
import java.time.Duration;
import org.jboss.logging.Logger;

/// Logs worker-pool job progress to the server log.
///
/// ### Log Format
/// ```
/// [request 42] provision attempt 1/3 started
/// [request 42] provision attempt 1/3 failed, retrying in 60s: <reason>
/// [request 42] provision finished: Provisioned
/// ```
///
/// Reasons and outcomes reach this listener already scrubbed of secrets; they
/// are still sanitized for log injection since tool diagnostics are multi-line.
///
/// @implNote Thread-safe. Stateless.
public class LoggingProvisioningListener implements ProvisioningListener {

    private static final Logger LOG = Logger.getLogger(LoggingProvisioningListener.class);

    @Override
    public void onAttemptStarted(long requestId, ProvisioningAction action, ProvisioningAttempt attempt) {
        LOG.debugv("[request {0}] {1} attempt {2} started", requestId, action.value(), attempt);
    }

    @Override
    public void onRetryScheduled(
            long requestId,
            ProvisioningAction action,
            ProvisioningAttempt failedAttempt,
            Duration delay,
            String reason) {
        LOG.warnv(
                "[request {0}] {1} attempt {2} failed, retrying in {3}s: {4}",
                requestId,
                action.value(),
                failedAttempt,
                delay.toSeconds(),
                LogSanitizer.sanitize(reason));
    }

    @Override
    public void onCompleted(long requestId, ProvisioningAction action, ProvisioningOutcome outcome) {
        String kind = outcome.getClass().getSimpleName();
        if (outcome.isSuccess()) {
            LOG.infov("[request {0}] {1} finished: {2}", requestId, action.value(), kind);
        } else if (outcome instanceof ProvisioningOutcome.Failed failed) {
            LOG.warnv(
                    "[request {0}] {1} failed ({2}): {3}",
                    requestId,
                    action.value(),
                    failed.kind(),
                    LogSanitizer.sanitize(failed.error()));
        } else {
            LOG.infov("[request {0}] {1} finished: {2}", requestId, action.value(), kind);
        }
    }
}
