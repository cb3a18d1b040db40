package io.infrautomater.core.workspace;

/// File names inside a request workspace.
///
/// ```
/// <workspaces-root>/request-<id>/
///   provider.tf          provider and connection configuration
///   main.tf              generated resource definitions
///   terraform.tfvars     variable values (may hold generated secrets)
///   tfplan               saved execution plan
///   terraform.tfstate    tool-owned state, required for destroy
/// ```
public final class WorkspaceLayout {

    public static final String DIRECTORY_PREFIX = "request-";
    public static final String PROVIDER_FILE = "provider.tf";
    public static final String RESOURCES_FILE = "main.tf";
    public static final String VARIABLES_FILE = "terraform.tfvars";
    public static final String PLAN_FILE = "tfplan";
    public static final String STATE_FILE = "terraform.tfstate";

    private WorkspaceLayout() {}

    /// Returns the directory name for a request.
    ///
    /// @param requestId the request id
    /// @return directory name, never null
    public static String directoryName(long requestId) {
        return DIRECTORY_PREFIX + requestId;
    }
}
