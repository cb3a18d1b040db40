package io.infrautomater.core.engine;

import java.io.IOException;

/// The provisioning tool executable could not be found.
///
/// Signals environment misconfiguration; never retried.
public class ToolNotFoundException extends IOException {

    private final String executable;

    public ToolNotFoundException(String executable, Throwable cause) {
        super("Provisioning tool not found: " + executable, cause);
        this.executable = executable;
    }

    public String getExecutable() {
        return executable;
    }
}
