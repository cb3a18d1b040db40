package io.infrautomater.core.orchestration;

import io.infrautomater.core.credential.CloudCredentials;
import io.infrautomater.core.credential.CredentialProvider;
import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.execution.FailureKind;
import io.infrautomater.core.execution.GeneratorOutcome;
import io.infrautomater.core.execution.SecretMasker;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.request.RequestStoreException;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.workspace.WorkspaceManager;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Tears down the infrastructure of a provisioned (or failed) request.
///
/// The request's workspace holds the tool state, the only record of what
/// exists remotely, so a missing workspace means there is nothing to destroy.
///
/// | Result            | Status      | Notes    | Workspace |
/// |-------------------|-------------|----------|-----------|
/// | destroy succeeded | `destroyed` | appended | deleted   |
/// | destroy failed    | unchanged   | appended | preserved |
/// | dry-run           | unchanged   | none     | preserved |
///
/// Destroy holds no claim. Callers serialize destroy jobs per request; the
/// {@link ProvisioningWorkerPool} does so by allowing one in-flight job per id.
public class DestroyWorkflow {

    private static final Logger logger = Logger.getLogger(DestroyWorkflow.class.getName());

    static final String SUCCESS_PREFIX = "Destroyed successfully: ";
    static final String FAILURE_PREFIX = "Destroy failed: ";

    private final RequestStore store;
    private final WorkspaceManager workspaces;
    private final ExecutionEngine engine;
    private final CredentialProvider credentials;
    private final boolean dryRun;

    public DestroyWorkflow(
            RequestStore store,
            WorkspaceManager workspaces,
            ExecutionEngine engine,
            CredentialProvider credentials,
            boolean dryRun) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.workspaces = Objects.requireNonNull(workspaces, "workspaces must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.dryRun = dryRun;
    }

    /// Destroys the resources of a request.
    ///
    /// @param requestId the request id
    /// @return the outcome, never null
    /// @throws TransientProvisioningException on store or I/O faults
    public ProvisioningOutcome destroy(long requestId) {
        Optional<ResourceRequest> loaded;
        try {
            loaded = store.get(requestId);
        } catch (RequestStoreException e) {
            throw new TransientProvisioningException(
                    "Could not load request " + requestId + ": " + e.getMessage(), e, false);
        }
        if (loaded.isEmpty()) {
            return new ProvisioningOutcome.NotFound(requestId, "request " + requestId + " not found");
        }
        ResourceRequest request = loaded.get();
        RequestStatus status = request.status();
        if (!status.canTransitionTo(RequestStatus.DESTROYED)) {
            logger.info("Skipping destroy of request " + requestId + ": status is " + status.value());
            return new ProvisioningOutcome.Skipped(
                    requestId, "status is " + status.value() + ", expected provisioned or failed");
        }
        if (!workspaces.exists(requestId)) {
            logger.warning("No workspace for request " + requestId + ", nothing to destroy");
            return new ProvisioningOutcome.NotFound(
                    requestId, "no workspace for request " + requestId);
        }

        Path workspace = workspaces.resolve(requestId);
        SecretMasker masker = new SecretMasker();
        logger.info("Destroying request " + requestId + (dryRun ? " (dry-run)" : ""));

        try {
            GeneratorOutcome outcome =
                    engine.runDestroy(workspace, dryRun, environmentFor(request, masker));
            return reconcile(request, outcome, masker);
        } catch (IOException | RuntimeException e) {
            String message = masker.mask(String.valueOf(e.getMessage()));
            logger.warning("Transient fault destroying request " + requestId + ": " + message);
            throw new TransientProvisioningException(message, e, false);
        }
    }

    /// Records a destroy that gave up after repeated transient faults.
    ///
    /// Best effort: the status is left unchanged and a store failure is only
    /// logged. Nothing is written in dry-run mode.
    ///
    /// @param requestId the request id
    /// @param error last fault message, already masked
    /// @return true if the note was written
    public boolean abandon(long requestId, String error) {
        if (dryRun) {
            return false;
        }
        try {
            store.appendNotes(requestId, NoteText.truncate(FAILURE_PREFIX + error));
            logger.warning("Gave up destroying request " + requestId + " after transient faults");
            return true;
        } catch (RequestStoreException e) {
            logger.warning("Could not record abandoned destroy of request " + requestId + ": " + e.getMessage());
            return false;
        }
    }

    private ProvisioningOutcome reconcile(
            ResourceRequest request, GeneratorOutcome outcome, SecretMasker masker) {
        long id = request.id();

        if (outcome instanceof GeneratorOutcome.Failure failure) {
            String error = masker.mask(failure.error());
            if (!dryRun) {
                store.appendNotes(id, NoteText.of(FAILURE_PREFIX, error, masker));
            }
            logger.warning("Destroy failed for request " + id + " (" + failure.kind() + ")");
            return new ProvisioningOutcome.Failed(id, failure.kind(), error);
        }

        String output = masker.mask(((GeneratorOutcome.Success) outcome).output());
        if (dryRun) {
            return new ProvisioningOutcome.Planned(id, output);
        }

        boolean moved =
                store.compareAndSetStatus(
                        id,
                        request.status(),
                        RequestStatus.DESTROYED,
                        NoteText.of(SUCCESS_PREFIX, output, masker));
        if (!moved) {
            logger.warning("Request " + id + " changed status during destroy, workspace kept");
            return new ProvisioningOutcome.Failed(
                    id, FailureKind.TRANSIENT, "status changed while destroying");
        }
        try {
            workspaces.delete(id);
        } catch (IOException e) {
            // status is already committed; a leftover directory is harmless
            logger.warning("Could not remove workspace of request " + id + ": " + e.getMessage());
        }
        logger.info("Destroyed request " + id);
        return new ProvisioningOutcome.Destroyed(id, output);
    }

    private Map<String, String> environmentFor(ResourceRequest request, SecretMasker masker) {
        Optional<CloudCredentials> found = credentials.lookup(request.teamId());
        if (found.isEmpty()) {
            return Map.of();
        }
        found.get().secrets().forEach(masker::register);
        return found.get().toEnvironment();
    }
}
