package io.infrautomater.core.engine;

import java.io.Serial;

/// The tool's machine-readable output could not be interpreted.
public class ToolOutputParseException extends Exception {

    @Serial private static final long serialVersionUID = -5107935868311562817L;

    public ToolOutputParseException(String message) {
        super(message);
    }

    public ToolOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
