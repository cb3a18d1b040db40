package io.infrautomater.core.engine;

import io.infrautomater.core.execution.FailureKind;
import io.infrautomater.core.execution.GeneratorOutcome;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Drives the external provisioning tool through its lifecycle inside one
/// workspace and classifies the result.
///
/// ### Provisioning sequence
/// 1. `init -input=false -no-color`
/// 2. `plan -input=false -no-color -out=tfplan`
/// 3. dry-run stops here, returning the plan text as output
/// 4. `apply -input=false -no-color -auto-approve tfplan`
/// 5. `output -json`, summarized by the {@link ToolOutputParser}
///
/// ### Destroy sequence
/// `init` then `destroy -auto-approve`; under dry-run `plan -destroy` replaces
/// the destroy step so nothing is mutated.
///
/// ### Failure classification
/// | Cause                 | Outcome                                      |
/// |-----------------------|----------------------------------------------|
/// | executable missing    | {@link FailureKind#TOOL_NOT_FOUND}            |
/// | step exceeded timeout | {@link FailureKind#TOOL_TIMEOUT}              |
/// | non-zero exit         | {@link FailureKind#TOOL_EXECUTION} + diagnostic |
/// | other launch I/O      | `IOException` propagates                     |
///
/// The first failing step ends the sequence; later steps never run.
///
/// @implNote Thread-safe. Dry-run is a call parameter, so concurrent calls
/// with different modes are independent.
///
/// @see ToolRunner
public class ExecutionEngine {

    private static final Logger logger = Logger.getLogger(ExecutionEngine.class.getName());

    public static final String DEFAULT_TOOL_BINARY = "terraform";
    public static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(600);

    private final ToolRunner runner;
    private final String toolBinary;
    private final Duration stepTimeout;
    private final ToolOutputParser outputParser;

    /// Creates an engine.
    ///
    /// @param runner process launcher, not null
    /// @param toolBinary executable name or path of the provisioning tool, not null
    /// @param stepTimeout wall-clock limit per step, positive
    /// @param outputParser summarizer for `output -json`, not null
    public ExecutionEngine(
            ToolRunner runner,
            String toolBinary,
            Duration stepTimeout,
            ToolOutputParser outputParser) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.toolBinary = Objects.requireNonNull(toolBinary, "toolBinary must not be null");
        this.stepTimeout = Objects.requireNonNull(stepTimeout, "stepTimeout must not be null");
        this.outputParser = Objects.requireNonNull(outputParser, "outputParser must not be null");
        if (stepTimeout.isZero() || stepTimeout.isNegative()) {
            throw new IllegalArgumentException("stepTimeout must be positive");
        }
    }

    /// Creates an engine with the default binary, timeout and a verbatim parser.
    ///
    /// @param runner process launcher, not null
    public ExecutionEngine(ToolRunner runner) {
        this(runner, DEFAULT_TOOL_BINARY, DEFAULT_STEP_TIMEOUT, ToolOutputParser.verbatim());
    }

    /// Runs the provisioning sequence.
    ///
    /// @param workspace directory holding the generated definitions, not null
    /// @param dryRun when true, `apply` never runs
    /// @param environment extra tool environment such as credentials, not null
    /// @return typed outcome, never null
    /// @throws IOException if a step could not be launched for a reason other
    ///     than a missing executable
    public GeneratorOutcome runWorkflow(
            Path workspace, boolean dryRun, Map<String, String> environment) throws IOException {
        try {
            ToolInvocation init = execute(ToolStep.INIT, workspace, environment);
            if (!init.succeeded()) {
                return stepFailed(ToolStep.INIT, init);
            }
            ToolInvocation plan = execute(ToolStep.PLAN, workspace, environment);
            if (!plan.succeeded()) {
                return stepFailed(ToolStep.PLAN, plan);
            }
            if (dryRun) {
                logger.info("Dry-run: skipping apply in " + workspace);
                return GeneratorOutcome.success(plan.stdout().strip());
            }
            ToolInvocation apply = execute(ToolStep.APPLY, workspace, environment);
            if (!apply.succeeded()) {
                return stepFailed(ToolStep.APPLY, apply);
            }
            ToolInvocation output = execute(ToolStep.OUTPUT, workspace, environment);
            if (!output.succeeded()) {
                return stepFailed(ToolStep.OUTPUT, output);
            }
            return GeneratorOutcome.success(summarize(output.stdout()));
        } catch (ToolNotFoundException e) {
            logger.warning(e.getMessage());
            return GeneratorOutcome.failure(FailureKind.TOOL_NOT_FOUND, e.getMessage());
        } catch (ToolTimeoutException e) {
            logger.warning(e.getMessage());
            return GeneratorOutcome.failure(FailureKind.TOOL_TIMEOUT, e.getMessage());
        }
    }

    /// Runs the destroy sequence against an existing workspace.
    ///
    /// @param workspace directory holding definitions and state, not null
    /// @param dryRun when true, only `plan -destroy` runs
    /// @param environment extra tool environment such as credentials, not null
    /// @return typed outcome, never null; success carries the tool's stdout
    /// @throws IOException if a step could not be launched for a reason other
    ///     than a missing executable
    public GeneratorOutcome runDestroy(
            Path workspace, boolean dryRun, Map<String, String> environment) throws IOException {
        try {
            ToolInvocation init = execute(ToolStep.INIT, workspace, environment);
            if (!init.succeeded()) {
                return stepFailed(ToolStep.INIT, init);
            }
            ToolStep step = dryRun ? ToolStep.PLAN_DESTROY : ToolStep.DESTROY;
            ToolInvocation destroy = execute(step, workspace, environment);
            if (!destroy.succeeded()) {
                return stepFailed(step, destroy);
            }
            return GeneratorOutcome.success(destroy.stdout().strip());
        } catch (ToolNotFoundException e) {
            logger.warning(e.getMessage());
            return GeneratorOutcome.failure(FailureKind.TOOL_NOT_FOUND, e.getMessage());
        } catch (ToolTimeoutException e) {
            logger.warning(e.getMessage());
            return GeneratorOutcome.failure(FailureKind.TOOL_TIMEOUT, e.getMessage());
        }
    }

    private ToolInvocation execute(ToolStep step, Path workspace, Map<String, String> environment)
            throws IOException {
        List<String> command = new ArrayList<>(step.arguments().size() + 1);
        command.add(toolBinary);
        command.addAll(step.arguments());
        logger.fine("Running " + step.label() + " in " + workspace);
        ToolInvocation invocation;
        try {
            invocation = runner.run(workspace, command, environment, stepTimeout);
        } catch (ToolTimeoutException e) {
            // re-labelled with the step name the engine knows
            throw new ToolTimeoutException(step.label(), stepTimeout);
        }
        logger.fine(
                step.label()
                        + " exited with "
                        + invocation.exitCode()
                        + " after "
                        + invocation.elapsed().toMillis()
                        + "ms");
        return invocation;
    }

    private GeneratorOutcome stepFailed(ToolStep step, ToolInvocation invocation) {
        logger.warning(step.label() + " failed with exit code " + invocation.exitCode());
        String diagnostic = invocation.diagnostic();
        String error = step.label() + " failed with exit code " + invocation.exitCode();
        if (!diagnostic.isEmpty()) {
            error += ": " + diagnostic;
        }
        return GeneratorOutcome.failure(FailureKind.TOOL_EXECUTION, error);
    }

    private String summarize(String rawOutput) {
        try {
            return outputParser.summarize(rawOutput);
        } catch (ToolOutputParseException e) {
            logger.warning("Could not parse tool output, keeping raw text: " + e.getMessage());
            return rawOutput.strip();
        }
    }

    public String getToolBinary() {
        return toolBinary;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }
}
