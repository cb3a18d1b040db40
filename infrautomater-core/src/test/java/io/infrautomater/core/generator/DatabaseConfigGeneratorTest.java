package io.infrautomater.core.generator;

import static io.infrautomater.core.generator.GeneratorTestSupport.context;
import static io.infrautomater.core.generator.GeneratorTestSupport.engine;
import static io.infrautomater.core.generator.GeneratorTestSupport.read;
import static org.assertj.core.api.Assertions.assertThat;

import io.infrautomater.core.engine.ScriptedToolRunner;
import io.infrautomater.core.execution.FailureKind;
import io.infrautomater.core.execution.GeneratorOutcome;
import io.infrautomater.core.execution.SecretMasker;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import io.infrautomater.core.workspace.WorkspaceLayout;
import java.io.IOException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatabaseConfigGeneratorTest {

    private static final Pattern PASSWORD = Pattern.compile("db_password = \"([A-Za-z0-9]+)\"");

    @TempDir Path workspace;

    private ScriptedToolRunner runner;
    private DatabaseConfigGenerator generator;
    private SecretMasker masker;

    @BeforeEach
    void setUp() {
        runner = new ScriptedToolRunner();
        generator = new DatabaseConfigGenerator(engine(runner));
        masker = new SecretMasker();
    }

    private static ResourceRequest request(String engine, String size) {
        ResourceRequest.Builder builder =
                ResourceRequest.builder()
                        .id(21)
                        .name("Orders")
                        .resourceType(ResourceType.DATABASE)
                        .status(RequestStatus.PROVISIONING)
                        .teamId(4L);
        if (engine != null) {
            builder.configValue("engine", engine);
        }
        if (size != null) {
            builder.configValue("size", size);
        }
        return builder.build();
    }

    private String password() throws IOException {
        Matcher matcher = PASSWORD.matcher(read(workspace, WorkspaceLayout.VARIABLES_FILE));
        assertThat(matcher.find()).isTrue();
        return matcher.group(1);
    }

    @Nested
    class DefinitionsTest {

        @Test
        void shouldWriteMappedInstanceClassForSmallPostgres() throws IOException {
            GeneratorOutcome outcome =
                    generator.generate(request("postgres", "small"), context(workspace, true, masker));

            assertThat(outcome.isSuccess()).isTrue();
            String tfvars = read(workspace, WorkspaceLayout.VARIABLES_FILE);
            assertThat(tfvars)
                    .contains("engine = \"postgres\"")
                    .contains("instance_class = \"db.t3.micro\"")
                    .contains("allocated_storage = 20")
                    .contains("master_username = \"dbadmin\"")
                    .contains("name = \"orders-21\"")
                    .contains("ManagedBy = \"infrautomater\"");
            assertThat(read(workspace, WorkspaceLayout.RESOURCES_FILE))
                    .contains("resource \"aws_db_instance\" \"this\"")
                    .contains("password = var.db_password");
            assertThat(read(workspace, WorkspaceLayout.PROVIDER_FILE))
                    .contains("provider \"aws\"")
                    .contains("region = var.region");
        }

        @Test
        void shouldApplyDefaultsWhenConfigEmpty() throws IOException {
            generator.generate(request(null, null), context(workspace, true, masker));

            assertThat(read(workspace, WorkspaceLayout.VARIABLES_FILE))
                    .contains("engine = \"postgres\"")
                    .contains("instance_class = \"db.t3.micro\"")
                    .contains("region = \"us-east-1\"");
        }

        @Test
        void shouldMapLargerTiers() throws IOException {
            generator.generate(request("mysql", "XLarge"), context(workspace, true, masker));

            assertThat(read(workspace, WorkspaceLayout.VARIABLES_FILE))
                    .contains("engine = \"mysql\"")
                    .contains("instance_class = \"db.t3.large\"")
                    .contains("allocated_storage = 250");
        }

        @Test
        void shouldFallBackToSmallForUnknownSize() throws IOException {
            generator.generate(request("mariadb", "galactic"), context(workspace, true, masker));

            assertThat(read(workspace, WorkspaceLayout.VARIABLES_FILE))
                    .contains("instance_class = \"db.t3.micro\"");
        }

        @Test
        void shouldRejectUnknownEngineWithoutWritingOrRunning() throws IOException {
            GeneratorOutcome outcome =
                    generator.generate(request("oracle", "small"), context(workspace, true, masker));

            assertThat(outcome).isInstanceOf(GeneratorOutcome.Failure.class);
            assertThat(((GeneratorOutcome.Failure) outcome).kind()).isEqualTo(FailureKind.INVALID_CONFIG);
            assertThat(workspace.resolve(WorkspaceLayout.VARIABLES_FILE)).doesNotExist();
            assertThat(runner.calls()).isEmpty();
        }
    }

    @Nested
    class SecretTest {

        @Test
        void shouldWritePasswordOnlyToVariablesFile() throws IOException {
            generator.generate(request("postgres", "small"), context(workspace, true, masker));

            String password = password();
            assertThat(password).hasSize(24).matches("[A-Za-z0-9]+");
            assertThat(read(workspace, WorkspaceLayout.RESOURCES_FILE)).doesNotContain(password);
            assertThat(read(workspace, WorkspaceLayout.PROVIDER_FILE)).doesNotContain(password);
            assertThat(read(workspace, WorkspaceLayout.RESOURCES_FILE)).contains("sensitive = true");
        }

        @Test
        void shouldRegisterPasswordWithMasker() throws IOException {
            generator.generate(request("postgres", "small"), context(workspace, true, masker));

            String password = password();
            assertThat(masker.mask("leaked " + password)).isEqualTo("leaked " + SecretMasker.MASK);
        }

        @Test
        void shouldGenerateFreshPasswordPerCall() throws IOException {
            generator.generate(request("postgres", "small"), context(workspace, true, masker));
            String first = password();
            generator.generate(request("postgres", "small"), context(workspace, true, masker));

            assertThat(password()).isNotEqualTo(first);
        }
    }

    @Test
    void shouldReturnEngineOutcomeUnchanged() throws IOException {
        runner.fail("apply", 1, "Error: creating DB Instance");

        GeneratorOutcome outcome =
                generator.generate(request("postgres", "small"), context(workspace, false, masker));

        assertThat(outcome)
                .isEqualTo(
                        GeneratorOutcome.failure(
                                FailureKind.TOOL_EXECUTION,
                                "apply failed with exit code 1: Error: creating DB Instance"));
    }
}
