package io.infrautomater.core.engine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link ToolRunner} backed by {@link ProcessBuilder}.
///
/// Standard output and standard error are drained concurrently on daemon
/// threads so a chatty process can never block on a full pipe while the
/// caller waits for it. The child's stdin is closed immediately.
///
/// `TF_IN_AUTOMATION=1` is always set, which stops the tool from printing
/// suggestions aimed at interactive users.
///
/// @implNote Thread-safe. Holds no state between invocations.
public class ProcessToolRunner implements ToolRunner {

    private static final Logger logger = Logger.getLogger(ProcessToolRunner.class.getName());

    static final String AUTOMATION_VARIABLE = "TF_IN_AUTOMATION";

    /// Grace period for the reader threads to finish after the process exits.
    private static final long DRAIN_TIMEOUT_MS = 5_000;

    @Override
    public ToolInvocation run(
            Path workDir, List<String> command, Map<String, String> environment, Duration timeout)
            throws IOException {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        ProcessBuilder builder = new ProcessBuilder(command).directory(workDir.toFile());
        builder.environment().putAll(environment);
        builder.environment().put(AUTOMATION_VARIABLE, "1");

        long started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            if (isMissingExecutable(e)) {
                throw new ToolNotFoundException(command.get(0), e);
            }
            throw e;
        }
        process.getOutputStream().close();

        StreamDrain stdout = StreamDrain.start(process.getInputStream(), "stdout");
        StreamDrain stderr = StreamDrain.start(process.getErrorStream(), "stderr");

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
        }

        if (!finished) {
            process.destroyForcibly();
            logger.warning(
                    "Killed '" + String.join(" ", command) + "' after " + timeout.toSeconds() + "s");
            throw new ToolTimeoutException(describe(command), timeout);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        return new ToolInvocation(
                command, process.exitValue(), stdout.await(), stderr.await(), elapsed);
    }

    /// The JDK reports a missing executable as an `IOException` whose message
    /// carries the OS error 2 (ENOENT).
    static boolean isMissingExecutable(IOException e) {
        String message = e.getMessage();
        return message != null && message.contains("error=2,");
    }

    private static String describe(List<String> command) {
        return command.size() > 1 ? command.get(1) : command.get(0);
    }

    private static final class StreamDrain {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;

        private StreamDrain(InputStream in, String name) {
            this.thread =
                    new Thread(
                            () -> {
                                try (in) {
                                    in.transferTo(buffer);
                                } catch (IOException e) {
                                    logger.log(Level.FINE, "Stopped reading " + name, e);
                                }
                            },
                            "tool-" + name);
            this.thread.setDaemon(true);
        }

        static StreamDrain start(InputStream in, String name) {
            StreamDrain drain = new StreamDrain(in, name);
            drain.thread.start();
            return drain;
        }

        String await() throws InterruptedIOException {
            try {
                thread.join(DRAIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while collecting tool output");
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
