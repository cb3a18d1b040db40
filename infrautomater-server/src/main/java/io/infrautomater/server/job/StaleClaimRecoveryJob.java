package io.infrautomater.server.job;

import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.request.RequestStoreException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Scheduled job that returns abandoned `provisioning` claims to `approved`.
///
/// A worker that dies mid-attempt leaves its request in `provisioning` with no
/// one to finish it. Once a claim has not been written for longer than the
/// stale threshold it is moved back to `approved` (with a note), and
/// {@link ApprovedRequestDispatchJob} picks it up again. The retained
/// workspace keeps the tool state, so the re-run converges.
///
/// The threshold must exceed the longest legitimate attempt sequence:
/// attempts × steps × step timeout plus backoff.
///
/// ### Configuration
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `infrautomater.recovery.interval` | `5m` | How often stale claims are swept |
/// | `infrautomater.recovery.stale-threshold` | `3h` | Age of the last write that marks a claim stale |
///
/// @implNote `reclaimStale` is atomic per row; concurrent sweepers on several
/// nodes never reclaim the same request twice.
@ApplicationScoped
public class StaleClaimRecoveryJob {

    private static final Logger LOG = Logger.getLogger(StaleClaimRecoveryJob.class);

    private final RequestStore requestStore;
    private final Clock clock;

    @ConfigProperty(name = "infrautomater.recovery.stale-threshold", defaultValue = "3h")
    Duration staleThreshold;

    @Inject
    public StaleClaimRecoveryJob(RequestStore requestStore) {
        this(requestStore, Clock.systemUTC());
    }

    /// Package-private constructor for unit tests.
    StaleClaimRecoveryJob(RequestStore requestStore, Clock clock) {
        this.requestStore = requestStore;
        this.clock = clock;
    }

    @Scheduled(
            every = "${infrautomater.recovery.interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        try {
            recover();
        } catch (RequestStoreException e) {
            LOG.warnv("Stale claim recovery skipped, request store unavailable: {0}", e.getMessage());
        }
    }

    /// Reclaims every claim older than the stale threshold.
    ///
    /// @return ids of reclaimed requests
    List<Long> recover() {
        Instant threshold = clock.instant().minus(staleThreshold);
        List<Long> reclaimed = requestStore.reclaimStale(threshold);
        if (!reclaimed.isEmpty()) {
            LOG.warnv("Reclaimed {0} stale provisioning claim(s): {1}", reclaimed.size(), reclaimed);
        }
        return reclaimed;
    }
}
