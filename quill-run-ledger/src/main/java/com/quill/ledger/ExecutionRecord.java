package com.quill.ledger;

import com.quill.planner.StepOrigin;
import com.quill.tools.ToolError;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One executed (or abandoned) step in a run's {@link History}. Immutable.
 *
 * @param sequence     0-based position in the history
 * @param toolName     tool that ran
 * @param resolvedArgs arguments the tool was called with (explicit args when resolution failed)
 * @param value        result value; null when {@code error} is set
 * @param error        error after the last attempt; null on success
 * @param duration     wall time of all attempts
 * @param origin       why the step was in the plan
 * @param attempts     tool invocations made; 0 when the step never reached the tool
 */
public record ExecutionRecord(int sequence, String toolName, Map<String, Object> resolvedArgs, Object value,
                              ToolError error, Duration duration, StepOrigin origin, int attempts) {

    public ExecutionRecord {
        Objects.requireNonNull(toolName, "toolName");
        resolvedArgs = resolvedArgs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(resolvedArgs)) : Map.of();
        duration = duration != null ? duration : Duration.ZERO;
        origin = origin != null ? origin : StepOrigin.PLANNED;
        if (value != null && error != null) {
            throw new IllegalArgumentException("ExecutionRecord cannot hold both a value and an error");
        }
    }

    public boolean isSuccess() {
        return error == null;
    }
}
