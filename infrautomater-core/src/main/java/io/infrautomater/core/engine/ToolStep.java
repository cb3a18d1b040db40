package io.infrautomater.core.engine;

import io.infrautomater.core.workspace.WorkspaceLayout;
import java.util.List;

/// Fixed tool invocations issued by the {@link ExecutionEngine}.
///
/// Every step disables interactive input and colour so the captured text is
/// plain and the process never waits on a terminal.
public enum ToolStep {
    INIT("init", "init", "-input=false", "-no-color"),
    PLAN("plan", "plan", "-input=false", "-no-color", "-out=" + WorkspaceLayout.PLAN_FILE),
    APPLY(
            "apply",
            "apply",
            "-input=false",
            "-no-color",
            "-auto-approve",
            WorkspaceLayout.PLAN_FILE),
    OUTPUT("output", "output", "-json"),
    PLAN_DESTROY("plan-destroy", "plan", "-destroy", "-input=false", "-no-color"),
    DESTROY("destroy", "destroy", "-input=false", "-no-color", "-auto-approve");

    private final String label;
    private final List<String> arguments;

    ToolStep(String label, String... arguments) {
        this.label = label;
        this.arguments = List.of(arguments);
    }

    /// Short name used in logs and failure text.
    public String label() {
        return label;
    }

    public List<String> arguments() {
        return arguments;
    }
}
