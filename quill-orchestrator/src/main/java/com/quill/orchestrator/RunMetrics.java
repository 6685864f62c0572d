package com.quill.orchestrator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer meters for runs, steps and tool calls.
 */
public final class RunMetrics {

    static final String STEP_EXECUTIONS = "quill.step.executions";
    static final String TOOL_ATTEMPTS = "quill.tool.attempts";
    static final String TOOL_EXECUTION = "quill.tool.execution";
    static final String QUALITY_CORRECTIONS = "quill.quality.corrections";
    static final String CLARIFICATIONS = "quill.clarifications";
    static final String RUNS = "quill.runs";

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static RunMetrics inMemory() {
        return new RunMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /** outcome is one of success, error, missing_args. */
    void stepExecuted(String toolName, String outcome) {
        Counter.builder(STEP_EXECUTIONS)
                .description("Steps recorded in run history")
                .tag("tool", toolName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    void toolAttempt(String toolName) {
        Counter.builder(TOOL_ATTEMPTS)
                .description("Individual tool invocations, retries included")
                .tag("tool", toolName)
                .register(registry)
                .increment();
    }

    void toolExecution(String toolName, boolean success, Duration duration) {
        Timer.builder(TOOL_EXECUTION)
                .description("Tool step wall time across all attempts")
                .tag("tool", toolName)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(duration);
    }

    void qualityCorrection() {
        registry.counter(QUALITY_CORRECTIONS).increment();
    }

    void clarification() {
        registry.counter(CLARIFICATIONS).increment();
    }

    void runEnded(RunState state, TerminationReason reason) {
        Counter.builder(RUNS)
                .description("Finished runs")
                .tag("state", state.name())
                .tag("reason", reason.name())
                .register(registry)
                .increment();
    }
}
