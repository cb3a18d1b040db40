package io.infrautomater.server.job;

import io.infrautomater.core.orchestration.ProvisioningWorkerPool;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.request.RequestStoreException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Scheduled job that hands approved requests to the worker pool.
///
/// Approval happens outside this service; polling the store means an
/// approval is picked up even if it was recorded while no worker was running,
/// and requests reclaimed by {@link StaleClaimRecoveryJob} are re-queued the
/// same way. Requests that already have a job in flight are left alone; the
/// orchestrator's compare-and-set guards against everything else.
///
/// ### Configuration
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `infrautomater.dispatch.interval` | `15s` | How often approved rows are polled |
/// | `infrautomater.dispatch.batch-size` | `20` | Maximum rows submitted per tick |
@ApplicationScoped
public class ApprovedRequestDispatchJob {

    private static final Logger LOG = Logger.getLogger(ApprovedRequestDispatchJob.class);

    private final RequestStore requestStore;
    private final ProvisioningWorkerPool workerPool;

    @ConfigProperty(name = "infrautomater.dispatch.batch-size", defaultValue = "20")
    int batchSize;

    @Inject
    public ApprovedRequestDispatchJob(RequestStore requestStore, ProvisioningWorkerPool workerPool) {
        this.requestStore = requestStore;
        this.workerPool = workerPool;
    }

    @Scheduled(
            every = "${infrautomater.dispatch.interval:15s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        try {
            dispatch();
        } catch (RequestStoreException e) {
            LOG.warnv("Dispatch skipped, request store unavailable: {0}", e.getMessage());
        }
    }

    /// Submits up to one batch of approved requests.
    ///
    /// @return number of newly submitted jobs
    int dispatch() {
        List<Long> approved = requestStore.findIdsByStatus(RequestStatus.APPROVED, batchSize);
        int submitted = 0;
        for (Long id : approved) {
            if (workerPool.isInFlight(id)) {
                continue;
            }
            workerPool.submitProvision(id);
            submitted++;
        }
        if (submitted > 0) {
            LOG.infov("Dispatched {0} approved request(s)", submitted);
        }
        return submitted;
    }
}
