package io.infrautomater.core.engine;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Captured result of one finished tool process.
///
/// @param command executable and arguments as launched, not null
/// @param exitCode process exit status
/// @param stdout captured standard output, never null
/// @param stderr captured standard error, never null
/// @param elapsed wall-clock duration of the process, not null
public record ToolInvocation(
        List<String> command, int exitCode, String stdout, String stderr, Duration elapsed) {

    public ToolInvocation {
        command = List.copyOf(command);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /// Returns the text that best explains a failure: stderr, or stdout when
    /// stderr is blank.
    ///
    /// @return diagnostic text, never null
    public String diagnostic() {
        return stderr.isBlank() ? stdout.strip() : stderr.strip();
    }
}
