package io.infrautomater.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.infrautomater.core.ProvisioningEnvironment;
import io.infrautomater.core.orchestration.ProvisioningWorkerPool;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.serialization.InfrautomaterSerializer;
import io.infrautomater.serialization.RequestConfigCodec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// The provisioning components themselves are produced by
/// {@link ProvisioningEnvironmentProducer} via
/// {@link io.infrautomater.core.ProvisioningFactory}. This class produces the
/// shared `ObjectMapper` and delegating producers that expose environment
/// components for direct injection.
@ApplicationScoped
public class ServerConfiguration {

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return InfrautomaterSerializer.createMapper();
    }

    @Produces
    @Singleton
    public RequestConfigCodec requestConfigCodec(ObjectMapper objectMapper) {
        return new RequestConfigCodec(objectMapper);
    }

    // ========== ProvisioningEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public RequestStore requestStore(ProvisioningEnvironment env) {
        return env.getRequestStore();
    }

    @Produces
    @Singleton
    public ProvisioningWorkerPool provisioningWorkerPool(ProvisioningEnvironment env) {
        return env.getWorkerPool();
    }
}
