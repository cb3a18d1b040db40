package io.infrautomater.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessToolRunnerTest {

    @TempDir Path workDir;

    private final ProcessToolRunner runner = new ProcessToolRunner();

    @Test
    void shouldCaptureStdoutStderrAndExitCode() throws IOException {
        ToolInvocation result =
                runner.run(
                        workDir,
                        List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"),
                        Map.of(),
                        Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.succeeded()).isFalse();
        assertThat(result.stdout()).isEqualTo("out\n");
        assertThat(result.stderr()).isEqualTo("err\n");
        assertThat(result.diagnostic()).isEqualTo("err");
    }

    @Test
    void shouldRunInWorkDirWithExtraEnvironment() throws IOException {
        ToolInvocation result =
                runner.run(
                        workDir,
                        List.of("sh", "-c", "pwd; echo $EXTRA; echo $TF_IN_AUTOMATION"),
                        Map.of("EXTRA", "value"),
                        Duration.ofSeconds(10));

        List<String> lines = result.stdout().lines().toList();
        assertThat(Path.of(lines.get(0)).toRealPath()).isEqualTo(workDir.toRealPath());
        assertThat(lines.get(1)).isEqualTo("value");
        assertThat(lines.get(2)).isEqualTo("1");
    }

    @Test
    void shouldKillProcessOnTimeout() {
        long started = System.nanoTime();

        assertThatThrownBy(
                        () ->
                                runner.run(
                                        workDir,
                                        List.of("sleep", "30"),
                                        Map.of(),
                                        Duration.ofMillis(200)))
                .isInstanceOf(ToolTimeoutException.class);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void shouldReportMissingExecutable() {
        assertThatThrownBy(
                        () ->
                                runner.run(
                                        workDir,
                                        List.of("definitely-not-a-provisioning-tool-xyz", "init"),
                                        Map.of(),
                                        Duration.ofSeconds(5)))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessageContaining("definitely-not-a-provisioning-tool-xyz");
    }

    @Test
    void shouldRecognizeMissingExecutableMessage() {
        assertThat(
                        ProcessToolRunner.isMissingExecutable(
                                new IOException(
                                        "Cannot run program \"terraform\": error=2, No such file or directory")))
                .isTrue();
        assertThat(ProcessToolRunner.isMissingExecutable(new IOException("error=13, Permission denied")))
                .isFalse();
    }
}
