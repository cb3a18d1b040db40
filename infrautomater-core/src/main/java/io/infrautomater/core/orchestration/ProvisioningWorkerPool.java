package io.infrautomater.core.orchestration;

import io.infrautomater.core.execution.FailureKind;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs provisioning and destroy jobs on a fixed pool of worker threads,
/// applying the {@link RetryPolicy} between attempts.
///
/// ### Retry rules
/// - {@link ProvisioningOutcome.RetryScheduled}: retried with the claim held
/// - {@link TransientProvisioningException}: retried, carrying the
///   exception's `claimHeld` flag; once attempts run out a held claim is
///   finalized through {@link ProvisioningOrchestrator#abandon}, and an
///   exhausted destroy job is noted through {@link DestroyWorkflow#abandon}
/// - any other outcome is terminal and completes the job's future
///
/// Listener failures are logged and never affect the job.
///
/// Backoff waits happen on a separate scheduler thread, so a waiting job does
/// not occupy a worker.
///
/// ### De-duplication
/// At most one job per request id is in flight. Submitting while one is
/// running returns the existing future, whatever its action.
///
/// @implNote Thread-safe.
public class ProvisioningWorkerPool implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ProvisioningWorkerPool.class.getName());

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ProvisioningOrchestrator orchestrator;
    private final DestroyWorkflow destroyWorkflow;
    private final RetryPolicy retryPolicy;
    private final ProvisioningListener listener;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Map<Long, CompletableFuture<ProvisioningOutcome>> inFlight =
            new ConcurrentHashMap<>();

    /// Creates a pool.
    ///
    /// @param orchestrator provisioning attempts, not null
    /// @param destroyWorkflow destroy attempts, not null
    /// @param retryPolicy attempt cap and backoff, not null
    /// @param poolSize number of worker threads, positive
    /// @param listener lifecycle callbacks, not null
    public ProvisioningWorkerPool(
            ProvisioningOrchestrator orchestrator,
            DestroyWorkflow destroyWorkflow,
            RetryPolicy retryPolicy,
            int poolSize,
            ProvisioningListener listener) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.destroyWorkflow = Objects.requireNonNull(destroyWorkflow, "destroyWorkflow must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1");
        }
        this.workers = Executors.newFixedThreadPool(poolSize, namedThreads("provisioning-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("provisioning-retry"));
    }

    /// Queues provisioning of a request.
    ///
    /// @param requestId the request id
    /// @return future completed with the job's terminal outcome, never null
    public CompletableFuture<ProvisioningOutcome> submitProvision(long requestId) {
        return submit(requestId, ProvisioningAction.PROVISION);
    }

    /// Queues destruction of a request's resources.
    ///
    /// @param requestId the request id
    /// @return future completed with the job's terminal outcome, never null
    public CompletableFuture<ProvisioningOutcome> submitDestroy(long requestId) {
        return submit(requestId, ProvisioningAction.DESTROY);
    }

    /// Returns whether a job for `requestId` is queued or running.
    public boolean isInFlight(long requestId) {
        return inFlight.containsKey(requestId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private CompletableFuture<ProvisioningOutcome> submit(long requestId, ProvisioningAction action) {
        CompletableFuture<ProvisioningOutcome> future = new CompletableFuture<>();
        CompletableFuture<ProvisioningOutcome> existing = inFlight.putIfAbsent(requestId, future);
        if (existing != null) {
            logger.fine("Request " + requestId + " already has a job in flight");
            return existing;
        }
        Job job = new Job(requestId, action, future);
        schedule(job, retryPolicy.firstAttempt(), Duration.ZERO);
        return future;
    }

    private void schedule(Job job, ProvisioningAttempt attempt, Duration delay) {
        try {
            if (delay.isZero()) {
                workers.execute(() -> runAttempt(job, attempt));
            } else {
                scheduler.schedule(
                        () -> schedule(job, attempt, Duration.ZERO),
                        delay.toMillis(),
                        TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            fail(job, e);
        }
    }

    private void runAttempt(Job job, ProvisioningAttempt attempt) {
        long id = job.requestId();
        notifyListener(job, () -> listener.onAttemptStarted(id, job.action(), attempt));

        ProvisioningOutcome outcome;
        try {
            outcome =
                    job.action() == ProvisioningAction.PROVISION
                            ? orchestrator.provision(id, attempt)
                            : destroyWorkflow.destroy(id);
        } catch (TransientProvisioningException e) {
            if (retryPolicy.hasAttemptsAfter(attempt.number())) {
                retry(job, attempt, attempt.next(e.isClaimHeld()), e.getMessage());
                return;
            }
            if (job.action() == ProvisioningAction.DESTROY) {
                destroyWorkflow.abandon(id, String.valueOf(e.getMessage()));
            } else if (e.isClaimHeld()) {
                orchestrator.abandon(id, e.getMessage());
            }
            outcome = new ProvisioningOutcome.Failed(id, FailureKind.TRANSIENT, String.valueOf(e.getMessage()));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error in " + job.action().value() + " job for request " + id, e);
            fail(job, e);
            return;
        }

        if (outcome instanceof ProvisioningOutcome.RetryScheduled scheduled && !attempt.isFinal()) {
            retry(job, attempt, attempt.next(true), scheduled.error());
            return;
        }
        complete(job, outcome);
    }

    private void retry(Job job, ProvisioningAttempt failed, ProvisioningAttempt next, String reason) {
        Duration delay = retryPolicy.delayBefore(next.number());
        notifyListener(
                job,
                () ->
                        listener.onRetryScheduled(
                                job.requestId(), job.action(), failed, delay, String.valueOf(reason)));
        schedule(job, next, delay);
    }

    private void complete(Job job, ProvisioningOutcome outcome) {
        inFlight.remove(job.requestId(), job.future());
        notifyListener(job, () -> listener.onCompleted(job.requestId(), job.action(), outcome));
        job.future().complete(outcome);
    }

    private void notifyListener(Job job, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Listener failed for " + job.action().value() + " job of request " + job.requestId(),
                    e);
        }
    }

    private void fail(Job job, Throwable error) {
        inFlight.remove(job.requestId(), job.future());
        job.future().completeExceptionally(error);
    }

    /// Stops accepting jobs and waits for running attempts to finish.
    ///
    /// Jobs waiting on a backoff delay are dropped and their futures
    /// cancelled.
    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        inFlight.values().forEach(f -> f.cancel(false));
        inFlight.clear();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Job(
            long requestId, ProvisioningAction action, CompletableFuture<ProvisioningOutcome> future) {}
}
