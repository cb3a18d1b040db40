package io.infrautomater.core.orchestration;

import io.infrautomater.core.credential.CloudCredentials;
import io.infrautomater.core.credential.CredentialProvider;
import io.infrautomater.core.execution.GeneratorOutcome;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.execution.SecretMasker;
import io.infrautomater.core.generator.ResourceRouter;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.request.RequestStoreException;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.workspace.WorkspaceManager;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Entry point of a provisioning attempt: claims an approved request, routes it
/// to its generator and reconciles the persisted status with the outcome.
///
/// ### Attempt lifecycle
///
/// ```
/// get(id) ──absent──────────────────────────────> NotFound
///    │
///    ├─ fresh attempt:   status != approved ─────> Skipped
///    │                   CAS approved→provisioning lost ─> Skipped
///    ├─ continued claim: status != provisioning ─> Skipped
///    ↓
/// resolve credentials, route(request, context)
///    │
///    ├─ success ──────────────> provisioned  + "Provisioned successfully: ..."
///    ├─ retryable, not final ─> provisioning + "Attempt n/m failed ...; retrying"
///    └─ otherwise ────────────> failed       + "Provisioning failed: ..."
/// ```
///
/// Store or I/O faults after the request was read are re-raised as
/// {@link TransientProvisioningException}; nothing further is written. Retry
/// scheduling is the caller's job, see {@link ProvisioningWorkerPool}.
///
/// ### Contracts
/// - **Mutual exclusion**: only the caller whose compare-and-set moved the
///   request to `provisioning` ever runs the tool for it
/// - **Secrets**: every note passes through the attempt's {@link SecretMasker}
///   and is capped at 4000 characters
///
/// @implNote Thread-safe. Holds no per-attempt state; each call builds its own
/// {@link ProvisioningContext}.
public class ProvisioningOrchestrator {

    private static final Logger logger = Logger.getLogger(ProvisioningOrchestrator.class.getName());

    static final String SUCCESS_PREFIX = "Provisioned successfully: ";
    static final String DRY_RUN_SUCCESS_PREFIX = "Provisioned successfully (dry-run, apply skipped): ";
    static final String FAILURE_PREFIX = "Provisioning failed: ";
    static final String ERROR_PREFIX = "Provisioning error: ";

    private final RequestStore store;
    private final ResourceRouter router;
    private final WorkspaceManager workspaces;
    private final CredentialProvider credentials;
    private final boolean dryRun;

    /// Creates an orchestrator.
    ///
    /// @param store request store, not null
    /// @param router resource-type router, not null
    /// @param workspaces workspace manager, not null
    /// @param credentials credential lookup, not null
    /// @param dryRun when true, attempts stop after `plan`
    public ProvisioningOrchestrator(
            RequestStore store,
            ResourceRouter router,
            WorkspaceManager workspaces,
            CredentialProvider credentials,
            boolean dryRun) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.workspaces = Objects.requireNonNull(workspaces, "workspaces must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.dryRun = dryRun;
    }

    /// Runs a single, non-retried attempt.
    ///
    /// A retryable failure finalizes the request as `failed`.
    ///
    /// @param requestId the request id
    /// @return the outcome, never null
    /// @throws TransientProvisioningException on store or I/O faults
    public ProvisioningOutcome provision(long requestId) {
        return provision(requestId, ProvisioningAttempt.single());
    }

    /// Runs one attempt of a possibly retried job.
    ///
    /// @param requestId the request id
    /// @param attempt position of this attempt in its job, not null
    /// @return the outcome, never null
    /// @throws TransientProvisioningException on store or I/O faults
    public ProvisioningOutcome provision(long requestId, ProvisioningAttempt attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");

        Optional<ResourceRequest> loaded;
        try {
            loaded = store.get(requestId);
        } catch (RequestStoreException e) {
            throw new TransientProvisioningException(
                    "Could not load request " + requestId + ": " + e.getMessage(),
                    e,
                    attempt.claimHeld());
        }
        if (loaded.isEmpty()) {
            logger.warning("Request not found: " + requestId);
            return new ProvisioningOutcome.NotFound(requestId, "request " + requestId + " not found");
        }
        ResourceRequest request = loaded.get();

        Optional<ProvisioningOutcome> skipped = claim(request, attempt);
        if (skipped.isPresent()) {
            return skipped.get();
        }

        logger.info(
                "Provisioning request "
                        + requestId
                        + " ("
                        + request.resourceType()
                        + ", attempt "
                        + attempt
                        + (dryRun ? ", dry-run" : "")
                        + ")");

        SecretMasker masker = new SecretMasker();
        try {
            ProvisioningContext context =
                    new ProvisioningContext(
                            workspaces.resolve(requestId), dryRun, environmentFor(request, masker), masker);
            GeneratorOutcome outcome = router.route(request, context);
            return reconcile(request, attempt, outcome, masker);
        } catch (IOException | RuntimeException e) {
            String message = masker.mask(String.valueOf(e.getMessage()));
            logger.warning(
                    "Transient fault provisioning request "
                            + requestId
                            + ": "
                            + e.getClass().getSimpleName()
                            + ": "
                            + message);
            throw new TransientProvisioningException(message, e, true);
        }
    }

    /// Finalizes a claimed request as `failed` after the caller gave up
    /// retrying transient faults.
    ///
    /// Best effort: a store fault here is logged, not raised.
    ///
    /// @param requestId the request id
    /// @param error last error text, already scrubbed, not null
    /// @return true if the request was moved to `failed`
    public boolean abandon(long requestId, String error) {
        try {
            boolean moved =
                    store.compareAndSetStatus(
                            requestId,
                            RequestStatus.PROVISIONING,
                            RequestStatus.FAILED,
                            NoteText.truncate(ERROR_PREFIX + error));
            if (moved) {
                logger.warning("Abandoned request " + requestId + " after transient faults");
            }
            return moved;
        } catch (RequestStoreException e) {
            logger.warning("Could not abandon request " + requestId + ": " + e.getMessage());
            return false;
        }
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /// Returns a skip outcome, or empty once this attempt owns the claim.
    private Optional<ProvisioningOutcome> claim(ResourceRequest request, ProvisioningAttempt attempt) {
        long id = request.id();
        if (attempt.claimHeld()) {
            if (request.status() != RequestStatus.PROVISIONING) {
                return Optional.of(
                        skip(id, "status is " + request.status().value() + ", expected provisioning"));
            }
            return Optional.empty();
        }

        if (request.status() != RequestStatus.APPROVED) {
            return Optional.of(skip(id, "status is " + request.status().value() + ", expected approved"));
        }
        boolean claimed;
        try {
            claimed = store.compareAndSetStatus(id, RequestStatus.APPROVED, RequestStatus.PROVISIONING);
        } catch (RequestStoreException e) {
            throw new TransientProvisioningException(
                    "Could not claim request " + id + ": " + e.getMessage(), e, false);
        }
        if (!claimed) {
            return Optional.of(skip(id, "already in progress"));
        }
        return Optional.empty();
    }

    private ProvisioningOutcome skip(long id, String reason) {
        logger.info("Skipping request " + id + ": " + reason);
        return new ProvisioningOutcome.Skipped(id, reason);
    }

    private Map<String, String> environmentFor(ResourceRequest request, SecretMasker masker) {
        Optional<CloudCredentials> found = credentials.lookup(request.teamId());
        if (found.isEmpty()) {
            logger.fine("No credentials for team " + request.teamId() + ", using ambient configuration");
            return Map.of();
        }
        found.get().secrets().forEach(masker::register);
        return found.get().toEnvironment();
    }

    private ProvisioningOutcome reconcile(
            ResourceRequest request,
            ProvisioningAttempt attempt,
            GeneratorOutcome outcome,
            SecretMasker masker) {
        long id = request.id();

        if (outcome instanceof GeneratorOutcome.Success success) {
            String output = masker.mask(success.output());
            String prefix = dryRun ? DRY_RUN_SUCCESS_PREFIX : SUCCESS_PREFIX;
            boolean moved =
                    store.compareAndSetStatus(
                            id,
                            RequestStatus.PROVISIONING,
                            RequestStatus.PROVISIONED,
                            NoteText.of(prefix, output, masker));
            if (!moved) {
                logger.warning("Request " + id + " left provisioning before it could be completed");
                return new ProvisioningOutcome.Skipped(id, "provisioning claim lost before completion");
            }
            logger.info("Provisioned request " + id);
            return new ProvisioningOutcome.Provisioned(id, output);
        }

        GeneratorOutcome.Failure failure = (GeneratorOutcome.Failure) outcome;
        String error = masker.mask(failure.error());

        if (failure.kind().isRetryable() && !attempt.isFinal()) {
            store.appendNotes(
                    id,
                    NoteText.of(
                            "Attempt " + attempt + " failed (" + failure.kind() + "): ",
                            error + "; retrying",
                            masker));
            logger.warning(
                    "Attempt " + attempt + " for request " + id + " failed (" + failure.kind() + ")");
            return new ProvisioningOutcome.RetryScheduled(id, failure.kind(), error);
        }

        boolean moved =
                store.compareAndSetStatus(
                        id,
                        RequestStatus.PROVISIONING,
                        RequestStatus.FAILED,
                        NoteText.of(FAILURE_PREFIX, error, masker));
        if (!moved) {
            logger.warning("Request " + id + " left provisioning before its failure was recorded");
        }
        logger.warning("Provisioning failed for request " + id + " (" + failure.kind() + ")");
        return new ProvisioningOutcome.Failed(id, failure.kind(), error);
    }
}
