package io.infrautomater.core.workspace;

import static org.assertj.core.api.Assertions.assertThat;

import io.infrautomater.core.request.ResourceType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceManagerTest {

    @TempDir Path tempDir;

    private Path templates;
    private WorkspaceManager manager;

    @BeforeEach
    void setUp() throws IOException {
        templates = Files.createDirectories(tempDir.resolve("templates"));
        manager = new WorkspaceManager(tempDir.resolve("workspaces"), templates);
    }

    @Nested
    class PathTest {

        @Test
        void shouldResolveDeterministicPathWithoutCreatingIt() {
            Path first = manager.resolve(7);
            Path second = manager.resolve(7);

            assertThat(first).isEqualTo(second);
            assertThat(first.getFileName().toString()).isEqualTo("request-7");
            assertThat(first).doesNotExist();
        }

        @Test
        void shouldGiveDistinctRequestsDistinctPaths() {
            assertThat(manager.resolve(1)).isNotEqualTo(manager.resolve(2));
        }
    }

    @Nested
    class EnsureWorkspaceTest {

        @Test
        void shouldCreateWorkspace() throws IOException {
            Path workspace = manager.ensureWorkspace(3);

            assertThat(workspace).isDirectory();
            assertThat(manager.exists(3)).isTrue();
        }

        @Test
        void shouldBeIdempotentAndKeepContents() throws IOException {
            Path workspace = manager.ensureWorkspace(3);
            Files.writeString(workspace.resolve(WorkspaceLayout.STATE_FILE), "{}");

            Path again = manager.ensureWorkspace(3);

            assertThat(again).isEqualTo(workspace);
            assertThat(again.resolve(WorkspaceLayout.STATE_FILE)).hasContent("{}");
        }
    }

    @Nested
    class DeleteTest {

        @Test
        void shouldDeleteRecursively() throws IOException {
            Path workspace = manager.ensureWorkspace(5);
            Files.createDirectories(workspace.resolve(".terraform/providers"));
            Files.writeString(workspace.resolve(".terraform/providers/lock"), "x");
            Files.writeString(workspace.resolve(WorkspaceLayout.RESOURCES_FILE), "x");

            boolean removed = manager.delete(5);

            assertThat(removed).isTrue();
            assertThat(workspace).doesNotExist();
        }

        @Test
        void shouldReturnFalseWhenNothingToDelete() throws IOException {
            assertThat(manager.delete(404)).isFalse();
        }
    }

    @Nested
    class CopyTemplatesTest {

        @Test
        void shouldCopyOnlyTerraformFilesOfType() throws IOException {
            Path dbTemplates = Files.createDirectories(templates.resolve("database"));
            Files.writeString(dbTemplates.resolve("backup.tf"), "# backup");
            Files.writeString(dbTemplates.resolve("README.md"), "docs");
            Path workspace = manager.ensureWorkspace(9);

            int copied = manager.copyTemplates(ResourceType.DATABASE, workspace);

            assertThat(copied).isEqualTo(1);
            assertThat(workspace.resolve("backup.tf")).hasContent("# backup");
            assertThat(workspace.resolve("README.md")).doesNotExist();
        }

        @Test
        void shouldIgnoreMissingTemplateDirectory() throws IOException {
            Path workspace = manager.ensureWorkspace(9);

            assertThat(manager.copyTemplates(ResourceType.NAMESPACE, workspace)).isZero();
        }

        @Test
        void shouldIgnoreMissingTemplatesRoot() throws IOException {
            WorkspaceManager withoutTemplates = new WorkspaceManager(tempDir.resolve("ws2"), null);
            Path workspace = withoutTemplates.ensureWorkspace(1);

            assertThat(withoutTemplates.copyTemplates(ResourceType.DATABASE, workspace)).isZero();
        }
    }
}
