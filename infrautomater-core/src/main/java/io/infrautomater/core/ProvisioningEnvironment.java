package io.infrautomater.core;

import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.generator.ResourceRouter;
import io.infrautomater.core.orchestration.DestroyWorkflow;
import io.infrautomater.core.orchestration.ProvisioningOrchestrator;
import io.infrautomater.core.orchestration.ProvisioningWorkerPool;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.workspace.WorkspaceManager;

/// Container holding the wired provisioning components.
///
/// Closing the environment shuts down the worker pool; running attempts are
/// allowed to finish.
///
/// @apiNote Create instances via {@link ProvisioningFactory#builder()}.
public final class ProvisioningEnvironment implements AutoCloseable {

    private final ProvisioningConfig config;
    private final RequestStore requestStore;
    private final WorkspaceManager workspaceManager;
    private final ExecutionEngine executionEngine;
    private final ResourceRouter resourceRouter;
    private final ProvisioningOrchestrator orchestrator;
    private final DestroyWorkflow destroyWorkflow;
    private final ProvisioningWorkerPool workerPool;

    public ProvisioningEnvironment(
            ProvisioningConfig config,
            RequestStore requestStore,
            WorkspaceManager workspaceManager,
            ExecutionEngine executionEngine,
            ResourceRouter resourceRouter,
            ProvisioningOrchestrator orchestrator,
            DestroyWorkflow destroyWorkflow,
            ProvisioningWorkerPool workerPool) {
        this.config = config;
        this.requestStore = requestStore;
        this.workspaceManager = workspaceManager;
        this.executionEngine = executionEngine;
        this.resourceRouter = resourceRouter;
        this.orchestrator = orchestrator;
        this.destroyWorkflow = destroyWorkflow;
        this.workerPool = workerPool;
    }

    public ProvisioningConfig getConfig() {
        return config;
    }

    public RequestStore getRequestStore() {
        return requestStore;
    }

    public WorkspaceManager getWorkspaceManager() {
        return workspaceManager;
    }

    public ExecutionEngine getExecutionEngine() {
        return executionEngine;
    }

    public ResourceRouter getResourceRouter() {
        return resourceRouter;
    }

    /// Returns the orchestrator for direct, single-attempt provisioning.
    ///
    /// @return the orchestrator, never null
    public ProvisioningOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public DestroyWorkflow getDestroyWorkflow() {
        return destroyWorkflow;
    }

    /// Returns the worker pool that runs retried jobs.
    ///
    /// @return the worker pool, never null
    public ProvisioningWorkerPool getWorkerPool() {
        return workerPool;
    }

    @Override
    public void close() {
        workerPool.close();
    }
}
