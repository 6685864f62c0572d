package com.quill.orchestrator;

import com.quill.ledger.ExecutionRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link Orchestrator#run}.
 *
 * @param runId             id assigned to the run
 * @param steps             history records in execution order
 * @param state             terminal state
 * @param terminationReason why the loop stopped
 * @param workingContext    final working context (read-only copy)
 */
public record RunResult(String runId, List<ExecutionRecord> steps, RunState state,
                        TerminationReason terminationReason, Map<String, Object> workingContext) {

    public RunResult {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(terminationReason, "terminationReason");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("RunResult needs a terminal state: " + state);
        }
        steps = steps != null ? List.copyOf(steps) : List.of();
        workingContext = workingContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(workingContext))
                : Map.of();
    }

    public int stepCount() {
        return steps.size();
    }

    public boolean isAborted() {
        return state == RunState.ABORTED;
    }
}
