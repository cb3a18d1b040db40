package io.infrautomater.core.generator;

import io.infrautomater.core.execution.FailureKind;
import io.infrautomater.core.execution.GeneratorOutcome;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import io.infrautomater.core.workspace.WorkspaceManager;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Dispatches a request to the {@link ConfigGenerator} for its resource type.
///
/// The type is resolved before anything else: an unknown type yields an
/// `UNKNOWN_RESOURCE_TYPE` failure and no workspace is created. For a known
/// type the router prepares the workspace, copies static templates into it,
/// and returns the generator's outcome unchanged.
public class ResourceRouter {

    private static final Logger logger = Logger.getLogger(ResourceRouter.class.getName());

    private final WorkspaceManager workspaces;
    private final Map<ResourceType, ConfigGenerator> generators = new EnumMap<>(ResourceType.class);

    /// Creates a router.
    ///
    /// @param workspaces workspace manager, not null
    /// @param generators one generator per supported type, not null
    /// @throws IllegalArgumentException if two generators claim the same type
    public ResourceRouter(WorkspaceManager workspaces, Collection<? extends ConfigGenerator> generators) {
        this.workspaces = Objects.requireNonNull(workspaces, "workspaces must not be null");
        for (ConfigGenerator generator : generators) {
            ConfigGenerator previous = this.generators.put(generator.resourceType(), generator);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Duplicate generator for resource type: " + generator.resourceType().value());
            }
        }
    }

    /// Routes a request to its generator.
    ///
    /// @param request the request, not null
    /// @param context per-attempt parameters; its workspace is replaced by the
    ///     request's own workspace path, not null
    /// @return generator outcome, or an `UNKNOWN_RESOURCE_TYPE` failure, never null
    /// @throws IOException if the workspace cannot be prepared or the
    ///     generator fails with I/O
    public GeneratorOutcome route(ResourceRequest request, ProvisioningContext context)
            throws IOException {
        Optional<ConfigGenerator> generator = request.type().map(generators::get);
        if (generator.isEmpty()) {
            logger.warning(
                    "No generator for resource type '"
                            + request.resourceType()
                            + "' (request "
                            + request.id()
                            + ")");
            return GeneratorOutcome.failure(
                    FailureKind.UNKNOWN_RESOURCE_TYPE,
                    "unknown resource type: " + request.resourceType());
        }

        Path workspace = workspaces.ensureWorkspace(request.id());
        workspaces.copyTemplates(generator.get().resourceType(), workspace);
        return generator.get().generate(request, context.withWorkspace(workspace));
    }

    /// Returns whether a generator is registered for `type`.
    ///
    /// @param type the resource type, not null
    /// @return true if requests of this type can be routed
    public boolean supports(ResourceType type) {
        return generators.containsKey(type);
    }
}
