package io.infrautomater.server.validation;

/// Strips control characters from strings to prevent log injection.
///
/// Request names, resource types and tool diagnostics can carry newlines.
/// Apply to any such value before passing it to a logger:
/// ```
/// LOG.infov("Dispatching request: name={0}", LogSanitizer.sanitize(request.name()));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", " ");
    }
}
