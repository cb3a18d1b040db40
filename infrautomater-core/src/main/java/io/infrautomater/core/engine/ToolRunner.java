package io.infrautomater.core.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/// Launches one bounded invocation of the external provisioning tool.
///
/// The execution engine never starts processes itself; it goes through this
/// seam so tests can script tool behaviour and record the invocation sequence.
///
/// ### Contracts
/// - **Blocking**: returns only after the process exited or was killed
/// - **Bounded**: a process outliving `timeout` is destroyed forcibly and
///   reported as {@link ToolTimeoutException}
/// - **No exit-code judgement**: a non-zero exit is a normal return
///
/// @see ProcessToolRunner
@FunctionalInterface
public interface ToolRunner {

    /// Runs `command` in `workDir` and captures its output.
    ///
    /// @param workDir working directory of the process, not null
    /// @param command executable followed by its arguments, not empty
    /// @param environment variables added to the inherited environment, not null
    /// @param timeout wall-clock limit for the process, positive
    /// @return captured result, never null
    /// @throws ToolNotFoundException if the executable does not exist
    /// @throws ToolTimeoutException if the process exceeded `timeout`
    /// @throws IOException for any other launch or capture failure
    ToolInvocation run(
            Path workDir, List<String> command, Map<String, String> environment, Duration timeout)
            throws IOException;
}
