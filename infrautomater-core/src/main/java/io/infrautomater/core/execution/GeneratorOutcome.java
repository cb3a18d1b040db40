package io.infrautomater.core.execution;

import java.util.Objects;

/// Result of generating definitions and driving the provisioning tool.
///
/// ### Permitted Subtypes
/// - {@link Success} - tool workflow completed; carries the captured summary
/// - {@link Failure} - a step failed; carries the {@link FailureKind} and diagnostic text
///
/// Returned unmodified from the execution engine through the generator and
/// router to the orchestrator.
public sealed interface GeneratorOutcome {

    /// Returns whether the workflow completed.
    ///
    /// @return true for {@link Success}
    boolean isSuccess();

    /// Workflow completed.
    ///
    /// @param output human-readable summary (outputs, or plan text under dry-run), not null
    record Success(String output) implements GeneratorOutcome {
        public Success {
            Objects.requireNonNull(output, "output must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /// Workflow failed.
    ///
    /// @param kind failure classification, not null
    /// @param error diagnostic text, not null
    record Failure(FailureKind kind, String error) implements GeneratorOutcome {
        public Failure {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static GeneratorOutcome success(String output) {
        return new Success(output);
    }

    static GeneratorOutcome failure(FailureKind kind, String error) {
        return new Failure(kind, error);
    }
}
