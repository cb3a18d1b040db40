package io.infrautomater.core.engine;

/// Turns the tool's `output -json` document into the human-readable summary
/// stored in request notes.
///
/// The core ships only {@link #verbatim()}; the serialization module provides a
/// JSON-aware implementation that hides sensitive outputs.
@FunctionalInterface
public interface ToolOutputParser {

    /// Summarizes raw output text.
    ///
    /// @param rawOutput stdout of the `output -json` step, not null
    /// @return summary text, never null
    /// @throws ToolOutputParseException if the text is not in the expected format
    String summarize(String rawOutput) throws ToolOutputParseException;

    /// Returns a parser that passes the output through, stripped of
    /// surrounding whitespace.
    ///
    /// @return pass-through parser, never null
    static ToolOutputParser verbatim() {
        return String::strip;
    }
}
