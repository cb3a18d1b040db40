package io.infrautomater.core.generator;

/// Request parameters cannot be turned into resource definitions.
///
/// Raised while building definitions, before anything is written to the
/// workspace, and reported as a terminal `INVALID_CONFIG` failure.
public class InvalidResourceConfigException extends Exception {

    public InvalidResourceConfigException(String message) {
        super(message);
    }
}
