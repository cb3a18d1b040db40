package io.infrautomater.core;

import io.infrautomater.core.credential.CredentialProvider;
import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.engine.ProcessToolRunner;
import io.infrautomater.core.engine.ToolOutputParser;
import io.infrautomater.core.engine.ToolRunner;
import io.infrautomater.core.generator.ConfigGenerator;
import io.infrautomater.core.generator.DatabaseConfigGenerator;
import io.infrautomater.core.generator.NamespaceConfigGenerator;
import io.infrautomater.core.generator.ObjectStorageConfigGenerator;
import io.infrautomater.core.generator.ResourceRouter;
import io.infrautomater.core.generator.SecretGenerator;
import io.infrautomater.core.orchestration.DestroyWorkflow;
import io.infrautomater.core.orchestration.ProvisioningListener;
import io.infrautomater.core.orchestration.ProvisioningOrchestrator;
import io.infrautomater.core.orchestration.ProvisioningWorkerPool;
import io.infrautomater.core.request.InMemoryRequestStore;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.workspace.WorkspaceManager;
import java.util.List;
import java.util.logging.Logger;

/// Factory for wiring {@link ProvisioningEnvironment} instances.
///
/// Every seam has a default: an {@link InMemoryRequestStore}, no credentials,
/// a {@link ProcessToolRunner}, a verbatim output parser and a no-op
/// listener. Hosts replace the ones they own.
///
/// {@snippet :
/// ProvisioningEnvironment env = ProvisioningFactory.builder()
///     .config(ProvisioningConfig.builder().dryRun(true).build())
///     .requestStore(jdbcStore)
///     .credentialProvider(teamCredentials)
///     .outputParser(new JacksonToolOutputParser())
///     .build();
/// env.getWorkerPool().submitProvision(42);
/// }
///
/// @see ProvisioningEnvironment
/// @see ProvisioningConfig
public final class ProvisioningFactory {

    private static final Logger logger = Logger.getLogger(ProvisioningFactory.class.getName());

    private ProvisioningFactory() {}

    /// Creates an environment with default seams.
    ///
    /// @param config provisioning settings, not null
    /// @return wired environment, never null
    public static ProvisioningEnvironment createEnvironment(ProvisioningConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ProvisioningEnvironment}.
    public static class Builder {
        private ProvisioningConfig config = new ProvisioningConfig();
        private RequestStore requestStore;
        private CredentialProvider credentialProvider = CredentialProvider.none();
        private ToolRunner toolRunner;
        private ToolOutputParser outputParser = ToolOutputParser.verbatim();
        private SecretGenerator secretGenerator;
        private ProvisioningListener listener = ProvisioningListener.NOOP;

        private Builder() {}

        public Builder config(ProvisioningConfig config) {
            this.config = config;
            return this;
        }

        public Builder requestStore(RequestStore requestStore) {
            this.requestStore = requestStore;
            return this;
        }

        public Builder credentialProvider(CredentialProvider credentialProvider) {
            this.credentialProvider = credentialProvider;
            return this;
        }

        /// Replaces the process launcher, mainly for tests.
        ///
        /// @param toolRunner the runner, not null
        /// @return this builder for chaining, never null
        public Builder toolRunner(ToolRunner toolRunner) {
            this.toolRunner = toolRunner;
            return this;
        }

        public Builder outputParser(ToolOutputParser outputParser) {
            this.outputParser = outputParser;
            return this;
        }

        public Builder secretGenerator(SecretGenerator secretGenerator) {
            this.secretGenerator = secretGenerator;
            return this;
        }

        public Builder listener(ProvisioningListener listener) {
            this.listener = listener;
            return this;
        }

        /// Wires and returns the environment.
        ///
        /// @return the environment, never null
        /// @throws IllegalArgumentException if the config holds out-of-range values
        public ProvisioningEnvironment build() {
            RequestStore store = requestStore != null ? requestStore : new InMemoryRequestStore();
            ToolRunner runner = toolRunner != null ? toolRunner : new ProcessToolRunner();
            SecretGenerator secrets = secretGenerator != null ? secretGenerator : new SecretGenerator();

            WorkspaceManager workspaces =
                    new WorkspaceManager(config.getWorkspacesRoot(), config.getTemplatesRoot());
            ExecutionEngine engine =
                    new ExecutionEngine(
                            runner, config.getToolBinary(), config.getStepTimeout(), outputParser);

            List<ConfigGenerator> generators =
                    List.of(
                            new DatabaseConfigGenerator(engine, secrets),
                            new ObjectStorageConfigGenerator(engine),
                            new NamespaceConfigGenerator(engine));
            ResourceRouter router = new ResourceRouter(workspaces, generators);

            ProvisioningOrchestrator orchestrator =
                    new ProvisioningOrchestrator(
                            store, router, workspaces, credentialProvider, config.isDryRun());
            DestroyWorkflow destroyWorkflow =
                    new DestroyWorkflow(
                            store, workspaces, engine, credentialProvider, config.isDryRun());
            ProvisioningWorkerPool workerPool =
                    new ProvisioningWorkerPool(
                            orchestrator,
                            destroyWorkflow,
                            config.toRetryPolicy(),
                            config.getWorkerPoolSize(),
                            listener);

            logger.info(
                    "Provisioning environment ready: workspaces="
                            + workspaces.getRoot()
                            + ", tool="
                            + config.getToolBinary()
                            + ", dryRun="
                            + config.isDryRun()
                            + ", workers="
                            + config.getWorkerPoolSize());

            return new ProvisioningEnvironment(
                    config, store, workspaces, engine, router, orchestrator, destroyWorkflow, workerPool);
        }
    }
}
