package io.infrautomater.core.generator;

import io.infrautomater.core.execution.GeneratorOutcome;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import java.io.IOException;

/// Writes the tool definitions for one resource type and drives the tool.
///
/// ### Contracts
/// - **Precondition**: `context.workspace()` exists and is exclusively owned
///   by the caller for the duration of the call
/// - **Postcondition**: the workspace holds `provider.tf`, `main.tf` and
///   `terraform.tfvars` whenever the config was valid
/// - **Secrets**: generated secrets are written only to `terraform.tfvars`
///   and registered with `context.masker()`
///
/// @see AbstractConfigGenerator
/// @see ResourceRouter
public interface ConfigGenerator {

    /// Returns the resource type this generator handles.
    ///
    /// @return handled type, never null
    ResourceType resourceType();

    /// Generates definitions for `request` and runs the tool workflow.
    ///
    /// @param request the request being provisioned, not null
    /// @param context per-attempt parameters, not null
    /// @return the execution engine's outcome, or an `INVALID_CONFIG`
    ///     failure, never null
    /// @throws IOException if the workspace cannot be written or the tool
    ///     cannot be launched
    GeneratorOutcome generate(ResourceRequest request, ProvisioningContext context)
            throws IOException;
}
