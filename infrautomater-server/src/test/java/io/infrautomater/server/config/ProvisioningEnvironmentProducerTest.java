package io.infrautomater.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.infrautomater.core.ProvisioningConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProvisioningEnvironmentProducerTest {

    private Config config;

    @BeforeEach
    void setUp() {
        config = mock(Config.class);
        when(config.getOptionalValue(anyString(), any())).thenReturn(Optional.empty());
    }

    @Nested
    class ToProvisioningConfig {

        @Test
        void shouldUseCoreDefaultsWhenUnset() {
            ProvisioningConfig result = ProvisioningEnvironmentProducer.toProvisioningConfig(config);

            assertThat(result.isDryRun()).isFalse();
            assertThat(result.getToolBinary()).isEqualTo("terraform");
            assertThat(result.getStepTimeout()).isEqualTo(Duration.ofSeconds(600));
            assertThat(result.getMaxAttempts()).isEqualTo(3);
            assertThat(result.getRetryBackoff()).isEqualTo(Duration.ofSeconds(60));
            assertThat(result.getWorkerPoolSize()).isEqualTo(4);
        }

        @Test
        void shouldApplyConfiguredValues() {
            when(config.getOptionalValue("infrautomater.provisioning.dry-run", Boolean.class))
                    .thenReturn(Optional.of(true));
            when(config.getOptionalValue("infrautomater.provisioning.tool-binary", String.class))
                    .thenReturn(Optional.of("tofu"));
            when(config.getOptionalValue("infrautomater.provisioning.step-timeout", Duration.class))
                    .thenReturn(Optional.of(Duration.ofMinutes(2)));
            when(config.getOptionalValue("infrautomater.provisioning.workspaces-root", String.class))
                    .thenReturn(Optional.of("/var/lib/infrautomater/workspaces"));
            when(config.getOptionalValue("infrautomater.retry.max-attempts", Integer.class))
                    .thenReturn(Optional.of(5));
            when(config.getOptionalValue("infrautomater.workers.pool-size", Integer.class))
                    .thenReturn(Optional.of(8));

            ProvisioningConfig result = ProvisioningEnvironmentProducer.toProvisioningConfig(config);

            assertThat(result.isDryRun()).isTrue();
            assertThat(result.getToolBinary()).isEqualTo("tofu");
            assertThat(result.getStepTimeout()).isEqualTo(Duration.ofMinutes(2));
            assertThat(result.getWorkspacesRoot()).isEqualTo(Path.of("/var/lib/infrautomater/workspaces"));
            assertThat(result.getMaxAttempts()).isEqualTo(5);
            assertThat(result.getWorkerPoolSize()).isEqualTo(8);
        }
    }

    @Nested
    class ExtractCredentialProperties {

        @Test
        void shouldKeepOnlyCredentialProperties() {
            ProvisioningEnvironmentProducer producer = new ProvisioningEnvironmentProducer();
            producer.config = config;
            when(config.getPropertyNames())
                    .thenReturn(
                            List.of(
                                    "infrautomater.credentials.default.access-key-id",
                                    "infrautomater.credentials.default.secret-access-key",
                                    "quarkus.http.port"));
            when(config.getOptionalValue("infrautomater.credentials.default.access-key-id", String.class))
                    .thenReturn(Optional.of("AKIA1"));
            when(config.getOptionalValue("infrautomater.credentials.default.secret-access-key", String.class))
                    .thenReturn(Optional.of("s3cr3t-value"));

            assertThat(producer.extractCredentialProperties())
                    .containsOnlyKeys(
                            "infrautomater.credentials.default.access-key-id",
                            "infrautomater.credentials.default.secret-access-key");
        }
    }
}
