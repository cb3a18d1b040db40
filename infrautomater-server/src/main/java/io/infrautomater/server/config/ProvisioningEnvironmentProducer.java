package io.infrautomater.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.infrautomater.core.ProvisioningConfig;
import io.infrautomater.core.ProvisioningEnvironment;
import io.infrautomater.core.ProvisioningFactory;
import io.infrautomater.serialization.RequestConfigCodec;
import io.infrautomater.serialization.output.JacksonToolOutputParser;
import io.infrautomater.server.credential.ConfiguredCredentialProvider;
import io.infrautomater.server.execution.LoggingProvisioningListener;
import io.infrautomater.server.persistence.JdbcRequestStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the provisioning environment.
///
/// Wires the core components via {@link ProvisioningFactory}: request store,
/// execution engine, generators, orchestrator, destroy workflow and worker pool.
///
/// ### Configuration Properties
/// | Property | Type | Default |
/// |----------|------|---------|
/// | `infrautomater.provisioning.dry-run` | Boolean | `false` |
/// | `infrautomater.provisioning.tool-binary` | String | `terraform` |
/// | `infrautomater.provisioning.step-timeout` | Duration | `600s` |
/// | `infrautomater.provisioning.workspaces-root` | Path | `./workspaces` |
/// | `infrautomater.provisioning.templates-root` | Path | `./templates` |
/// | `infrautomater.retry.max-attempts` | Integer | `3` |
/// | `infrautomater.retry.backoff` | Duration | `60s` |
/// | `infrautomater.retry.multiplier` | Double | `1.0` |
/// | `infrautomater.retry.max-backoff` | Duration | `30m` |
/// | `infrautomater.workers.pool-size` | Integer | `4` |
///
/// Credentials are read from `infrautomater.credentials.*`, see
/// {@link ConfiguredCredentialProvider}.
///
/// ### Persistence
/// Uses {@link JdbcRequestStore} when a datasource is active and resolvable,
/// otherwise the core's in-memory store.
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
@ApplicationScoped
public class ProvisioningEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(ProvisioningEnvironmentProducer.class);

    private ProvisioningEnvironment environment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    @Inject ObjectMapper objectMapper;

    @Inject RequestConfigCodec configCodec;

    /// Produces the provisioning environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public ProvisioningEnvironment provisioningEnvironment() {
        ProvisioningConfig provisioningConfig = toProvisioningConfig(config);

        ProvisioningFactory.Builder factoryBuilder =
                ProvisioningFactory.builder()
                        .config(provisioningConfig)
                        .credentialProvider(
                                ConfiguredCredentialProvider.fromProperties(extractCredentialProperties()))
                        .outputParser(new JacksonToolOutputParser(objectMapper))
                        .listener(new LoggingProvisioningListener());

        boolean dsActive =
                config.getOptionalValue("quarkus.datasource.active", Boolean.class).orElse(true);

        if (dsActive && dataSourceInstance.isResolvable()) {
            factoryBuilder.requestStore(new JdbcRequestStore(dataSourceInstance.get(), configCodec));
            LOG.info("Using JDBC request store (PostgreSQL)");
        } else {
            LOG.info("Using in-memory request store");
        }

        environment = factoryBuilder.build();

        LOG.infov(
                "Configured ProvisioningEnvironment: tool={0}, dryRun={1}, workspaces={2}",
                provisioningConfig.getToolBinary(),
                provisioningConfig.isDryRun(),
                environment.getWorkspaceManager().getRoot());
        return environment;
    }

    /// Maps `infrautomater.*` properties onto a core config object.
    static ProvisioningConfig toProvisioningConfig(Config config) {
        ProvisioningConfig defaults = new ProvisioningConfig();
        return ProvisioningConfig.builder()
                .dryRun(
                        config.getOptionalValue("infrautomater.provisioning.dry-run", Boolean.class)
                                .orElse(defaults.isDryRun()))
                .toolBinary(
                        config.getOptionalValue("infrautomater.provisioning.tool-binary", String.class)
                                .orElse(defaults.getToolBinary()))
                .stepTimeout(
                        config.getOptionalValue("infrautomater.provisioning.step-timeout", Duration.class)
                                .orElse(defaults.getStepTimeout()))
                .workspacesRoot(
                        config.getOptionalValue("infrautomater.provisioning.workspaces-root", String.class)
                                .map(Path::of)
                                .orElse(defaults.getWorkspacesRoot()))
                .templatesRoot(
                        config.getOptionalValue("infrautomater.provisioning.templates-root", String.class)
                                .map(Path::of)
                                .orElse(defaults.getTemplatesRoot()))
                .maxAttempts(
                        config.getOptionalValue("infrautomater.retry.max-attempts", Integer.class)
                                .orElse(defaults.getMaxAttempts()))
                .retryBackoff(
                        config.getOptionalValue("infrautomater.retry.backoff", Duration.class)
                                .orElse(defaults.getRetryBackoff()))
                .retryMultiplier(
                        config.getOptionalValue("infrautomater.retry.multiplier", Double.class)
                                .orElse(defaults.getRetryMultiplier()))
                .maxRetryBackoff(
                        config.getOptionalValue("infrautomater.retry.max-backoff", Duration.class)
                                .orElse(defaults.getMaxRetryBackoff()))
                .workerPoolSize(
                        config.getOptionalValue("infrautomater.workers.pool-size", Integer.class)
                                .orElse(defaults.getWorkerPoolSize()))
                .build();
    }

    /// Extracts `infrautomater.credentials.*` from Quarkus config.
    Map<String, String> extractCredentialProperties() {
        Map<String, String> properties = new HashMap<>();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(ConfiguredCredentialProvider.PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.put(propertyName, value));
            }
        }
        return properties;
    }

    /// Closes the environment on shutdown, draining the worker pool.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("ProvisioningEnvironment closed");
        }
    }
}
