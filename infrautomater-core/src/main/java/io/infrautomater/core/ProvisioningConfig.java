package io.infrautomater.core;

import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.orchestration.RetryPolicy;
import java.nio.file.Path;
import java.time.Duration;

/// Configuration of a provisioning environment.
///
/// ### Default Values
/// | Setting           | Default         |
/// |-------------------|-----------------|
/// | `dryRun`          | `false`         |
/// | `toolBinary`      | `terraform`     |
/// | `stepTimeout`     | 600 s           |
/// | `workspacesRoot`  | `./workspaces`  |
/// | `templatesRoot`   | `./templates`   |
/// | `maxAttempts`     | 3               |
/// | `retryBackoff`    | 60 s            |
/// | `retryMultiplier` | 1.0 (fixed)     |
/// | `maxRetryBackoff` | 30 min          |
/// | `workerPoolSize`  | 4               |
///
/// @implNote **Not thread-safe**. Configure fully before passing to
/// {@link ProvisioningFactory}; later changes have no effect on a built
/// environment.
///
/// @see ProvisioningFactory.Builder#config(ProvisioningConfig)
public class ProvisioningConfig {

    private boolean dryRun = false;
    private String toolBinary = ExecutionEngine.DEFAULT_TOOL_BINARY;
    private Duration stepTimeout = ExecutionEngine.DEFAULT_STEP_TIMEOUT;
    private Path workspacesRoot = Path.of("workspaces");
    private Path templatesRoot = Path.of("templates");
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration retryBackoff = RetryPolicy.DEFAULT_BACKOFF;
    private double retryMultiplier = 1.0;
    private Duration maxRetryBackoff = Duration.ofMinutes(30);
    private int workerPoolSize = 4;

    public ProvisioningConfig() {}

    /// Returns whether attempts stop after `plan` without applying.
    ///
    /// @return `true` in dry-run mode
    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public String getToolBinary() {
        return toolBinary;
    }

    public void setToolBinary(String toolBinary) {
        this.toolBinary = toolBinary;
    }

    /// Returns the wall-clock limit applied to each tool step.
    ///
    /// @return per-step timeout, never null
    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public void setStepTimeout(Duration stepTimeout) {
        this.stepTimeout = stepTimeout;
    }

    public Path getWorkspacesRoot() {
        return workspacesRoot;
    }

    public void setWorkspacesRoot(Path workspacesRoot) {
        this.workspacesRoot = workspacesRoot;
    }

    /// Returns the directory holding per-type static templates.
    ///
    /// @return templates root, may be null when templates are not used
    public Path getTemplatesRoot() {
        return templatesRoot;
    }

    public void setTemplatesRoot(Path templatesRoot) {
        this.templatesRoot = templatesRoot;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public void setRetryMultiplier(double retryMultiplier) {
        this.retryMultiplier = retryMultiplier;
    }

    public Duration getMaxRetryBackoff() {
        return maxRetryBackoff;
    }

    public void setMaxRetryBackoff(Duration maxRetryBackoff) {
        this.maxRetryBackoff = maxRetryBackoff;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    /// Builds the retry policy described by the retry settings.
    ///
    /// The backoff cap is raised to `retryBackoff` if configured lower.
    ///
    /// @return retry policy, never null
    /// @throws IllegalArgumentException if the settings are out of range
    public RetryPolicy toRetryPolicy() {
        Duration cap = maxRetryBackoff.compareTo(retryBackoff) < 0 ? retryBackoff : maxRetryBackoff;
        return new RetryPolicy(maxAttempts, retryBackoff, retryMultiplier, cap);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ProvisioningConfig}.
    public static class Builder {
        private final ProvisioningConfig config = new ProvisioningConfig();

        public Builder dryRun(boolean dryRun) {
            config.dryRun = dryRun;
            return this;
        }

        public Builder toolBinary(String toolBinary) {
            config.toolBinary = toolBinary;
            return this;
        }

        public Builder stepTimeout(Duration stepTimeout) {
            config.stepTimeout = stepTimeout;
            return this;
        }

        public Builder workspacesRoot(Path workspacesRoot) {
            config.workspacesRoot = workspacesRoot;
            return this;
        }

        public Builder templatesRoot(Path templatesRoot) {
            config.templatesRoot = templatesRoot;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            config.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            config.retryBackoff = retryBackoff;
            return this;
        }

        public Builder retryMultiplier(double retryMultiplier) {
            config.retryMultiplier = retryMultiplier;
            return this;
        }

        public Builder maxRetryBackoff(Duration maxRetryBackoff) {
            config.maxRetryBackoff = maxRetryBackoff;
            return this;
        }

        public Builder workerPoolSize(int workerPoolSize) {
            config.workerPoolSize = workerPoolSize;
            return this;
        }

        /// @return the configured instance, never null
        public ProvisioningConfig build() {
            return config;
        }
    }
}
