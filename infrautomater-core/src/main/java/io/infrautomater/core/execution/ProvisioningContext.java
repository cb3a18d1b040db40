package io.infrautomater.core.execution;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/// Per-attempt parameters threaded from the orchestrator through the router and
/// generator into the execution engine.
///
/// Dry-run travels here rather than as process-wide state, so concurrent
/// attempts with different modes do not interfere.
///
/// @param workspace the request's workspace directory, not null
/// @param dryRun when true, the engine stops after `plan` and never runs `apply`
/// @param environment extra process environment for the tool (credentials), never null
/// @param masker collects secrets seen during the attempt, not null
public record ProvisioningContext(
        Path workspace, boolean dryRun, Map<String, String> environment, SecretMasker masker) {

    public ProvisioningContext {
        Objects.requireNonNull(workspace, "workspace must not be null");
        Objects.requireNonNull(masker, "masker must not be null");
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    /// Returns a copy bound to a different workspace.
    ///
    /// @param workspace the workspace path, not null
    /// @return new context, never null
    public ProvisioningContext withWorkspace(Path workspace) {
        return new ProvisioningContext(workspace, dryRun, environment, masker);
    }
}
