package io.infrautomater.core.workspace;

import io.infrautomater.core.request.ResourceType;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates, locates and removes per-request provisioning workspaces.
///
/// The workspace path is a pure function of the request id:
/// `<root>/request-<id>`. Distinct ids never share a directory, and the same
/// id always maps to the same directory.
///
/// ### Ownership
/// A workspace is owned by the single attempt holding the request's
/// `PROVISIONING` claim. The manager itself does no locking.
///
/// @implNote Thread-safe. Stateless beyond the two root paths.
///
/// @see WorkspaceLayout for the files a workspace holds
public class WorkspaceManager {

    private static final Logger logger = Logger.getLogger(WorkspaceManager.class.getName());

    private final Path root;
    private final Path templatesRoot;

    /// Creates a manager rooted at `root`.
    ///
    /// @param root directory under which workspaces are created, not null
    /// @param templatesRoot directory holding per-type `*.tf` templates, may be null
    public WorkspaceManager(Path root, Path templatesRoot) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.templatesRoot = templatesRoot != null ? templatesRoot.toAbsolutePath().normalize() : null;
    }

    /// Returns the workspace path for a request without touching the filesystem.
    ///
    /// @param requestId the request id
    /// @return deterministic workspace path, never null
    public Path resolve(long requestId) {
        return root.resolve(WorkspaceLayout.directoryName(requestId));
    }

    /// Returns the workspace for a request, creating it if absent.
    ///
    /// Idempotent: repeated calls return the same path and leave existing
    /// contents untouched.
    ///
    /// @param requestId the request id
    /// @return writable workspace path, never null
    /// @throws IOException if the directory cannot be created
    public Path ensureWorkspace(long requestId) throws IOException {
        Path workspace = resolve(requestId);
        if (!Files.isDirectory(workspace)) {
            Files.createDirectories(workspace);
            logger.info("Created workspace for request " + requestId + ": " + workspace);
        }
        return workspace;
    }

    /// Returns whether a workspace exists for the request.
    ///
    /// @param requestId the request id
    /// @return true if the workspace directory exists
    public boolean exists(long requestId) {
        return Files.isDirectory(resolve(requestId));
    }

    /// Recursively removes a request's workspace.
    ///
    /// @param requestId the request id
    /// @return true if a directory was removed, false if none existed
    /// @throws IOException if any file cannot be deleted
    public boolean delete(long requestId) throws IOException {
        Path workspace = resolve(requestId);
        if (!Files.exists(workspace)) {
            return false;
        }
        Files.walkFileTree(
                workspace,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                            throws IOException {
                        if (exc != null) {
                            throw exc;
                        }
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
        logger.info("Removed workspace for request " + requestId + ": " + workspace);
        return true;
    }

    /// Copies static `*.tf` templates for a resource type into a workspace.
    ///
    /// Templates live in `<templatesRoot>/<type-value>/`. A missing templates
    /// root or type directory is not an error.
    ///
    /// @param type the resource type, not null
    /// @param workspace the target workspace, not null
    /// @return number of files copied
    /// @throws IOException if a template cannot be copied
    public int copyTemplates(ResourceType type, Path workspace) throws IOException {
        if (templatesRoot == null) {
            return 0;
        }
        Path source = templatesRoot.resolve(type.value());
        if (!Files.isDirectory(source)) {
            return 0;
        }
        int copied = 0;
        try (DirectoryStream<Path> templates = Files.newDirectoryStream(source, "*.tf")) {
            for (Path template : templates) {
                Files.copy(
                        template,
                        workspace.resolve(template.getFileName().toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                copied++;
            }
        }
        if (copied > 0) {
            logger.fine("Copied " + copied + " template(s) from " + source);
        }
        return copied;
    }

    public Path getRoot() {
        return root;
    }
}
