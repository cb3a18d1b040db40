package io.infrautomater.core.generator;

import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.execution.FailureKind;
import io.infrautomater.core.execution.GeneratorOutcome;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.hcl.HclBlock;
import io.infrautomater.core.hcl.HclDocument;
import io.infrautomater.core.hcl.HclExpression;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.workspace.WorkspaceLayout;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Base class for generators: builds the three definition files, writes them
/// into the workspace, then hands over to the {@link ExecutionEngine}.
///
/// Subclasses only describe their resources in {@link #define}. Config errors
/// raised there become a terminal `INVALID_CONFIG` outcome with nothing
/// written. The engine's outcome is returned unchanged.
///
/// ### Naming
/// {@link #resourceName(ResourceRequest)} derives a DNS-safe name from the
/// request's display name: lower-case `[a-z0-9-]`, starting with a letter,
/// at most 63 characters, always ending in `-<id>` so two requests with the
/// same display name never collide.
public abstract class AbstractConfigGenerator implements ConfigGenerator {

    private static final Logger logger = Logger.getLogger(AbstractConfigGenerator.class.getName());

    public static final String MANAGED_BY = "infrautomater";
    static final int MAX_NAME_LENGTH = 63;

    private final ExecutionEngine engine;

    protected AbstractConfigGenerator(ExecutionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public final GeneratorOutcome generate(ResourceRequest request, ProvisioningContext context)
            throws IOException {
        Definitions definitions;
        try {
            definitions = define(request, new ConfigValues(request.config()), context);
        } catch (InvalidResourceConfigException e) {
            logger.warning("Invalid config for request " + request.id() + ": " + e.getMessage());
            return GeneratorOutcome.failure(FailureKind.INVALID_CONFIG, e.getMessage());
        }

        Path workspace = context.workspace();
        write(workspace.resolve(WorkspaceLayout.PROVIDER_FILE), definitions.provider());
        write(workspace.resolve(WorkspaceLayout.RESOURCES_FILE), definitions.resources());
        write(workspace.resolve(WorkspaceLayout.VARIABLES_FILE), definitions.variables());
        logger.info(
                "Wrote " + resourceType().value() + " definitions for request " + request.id());

        return engine.runWorkflow(workspace, context.dryRun(), context.environment());
    }

    /// Describes the resources for a request.
    ///
    /// Must not touch the filesystem. Generated secrets go into
    /// {@link Definitions#variables()} only, after being registered with
    /// `context.masker()`.
    ///
    /// @param request the request being provisioned, not null
    /// @param config defaulted view of `request.config()`, not null
    /// @param context per-attempt parameters, not null
    /// @return the three documents to write, never null
    /// @throws InvalidResourceConfigException if the config is unusable
    protected abstract Definitions define(
            ResourceRequest request, ConfigValues config, ProvisioningContext context)
            throws InvalidResourceConfigException;

    /// Derives the DNS-safe physical name of a request's resource.
    ///
    /// @param request the request, not null
    /// @return name matching `[a-z][a-z0-9-]*`, at most 63 characters
    public static String resourceName(ResourceRequest request) {
        String suffix = "-" + request.id();
        String base =
                request.name()
                        .toLowerCase(Locale.ROOT)
                        .replaceAll("[^a-z0-9-]+", "-")
                        .replaceAll("-{2,}", "-")
                        .replaceAll("^-+|-+$", "");
        if (base.isEmpty() || !Character.isLetter(base.charAt(0))) {
            base = base.isEmpty() ? "resource" : "r-" + base;
        }
        int room = MAX_NAME_LENGTH - suffix.length();
        if (base.length() > room) {
            base = base.substring(0, room).replaceAll("-+$", "");
        }
        return base + suffix;
    }

    /// Standard tags applied to every managed resource.
    ///
    /// @param request the request, not null
    /// @param name the resource name from {@link #resourceName}, not null
    /// @return ordered tag map, never null
    protected static Map<String, Object> standardTags(ResourceRequest request, String name) {
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("Name", name);
        tags.put("RequestId", String.valueOf(request.id()));
        tags.put("TeamId", request.teamId() != null ? String.valueOf(request.teamId()) : "none");
        tags.put("ManagedBy", MANAGED_BY);
        return tags;
    }

    /// Adds a `variable` declaration.
    ///
    /// @param doc target document, not null
    /// @param name variable name, not null
    /// @param type type constraint such as `string` or `map(string)`, not null
    /// @return the declaration block, for extra attributes
    protected static HclBlock declareVariable(HclDocument doc, String name, String type) {
        return doc.block("variable", name).attribute("type", HclExpression.of(type));
    }

    /// Builds the `terraform { required_providers { ... } }` header.
    ///
    /// @param doc target document, not null
    /// @param provider local provider name, not null
    /// @param source registry source such as `hashicorp/aws`, not null
    /// @param version version constraint, not null
    protected static void requireProvider(
            HclDocument doc, String provider, String source, String version) {
        Map<String, Object> requirement = new LinkedHashMap<>();
        requirement.put("source", source);
        requirement.put("version", version);
        doc.block("terraform").block("required_providers").attribute(provider, requirement);
    }

    private static void write(Path file, HclDocument document) throws IOException {
        Files.writeString(file, document.render(), StandardCharsets.UTF_8);
    }

    /// The three files making up a workspace's definitions.
    ///
    /// @param provider contents of `provider.tf`, not null
    /// @param resources contents of `main.tf`, not null
    /// @param variables contents of `terraform.tfvars`, not null
    public record Definitions(HclDocument provider, HclDocument resources, HclDocument variables) {

        public Definitions {
            Objects.requireNonNull(provider, "provider must not be null");
            Objects.requireNonNull(resources, "resources must not be null");
            Objects.requireNonNull(variables, "variables must not be null");
        }
    }
}
