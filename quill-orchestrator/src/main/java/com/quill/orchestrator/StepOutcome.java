package com.quill.orchestrator;

import com.quill.tools.ToolResult;

import java.time.Duration;

/**
 * Result of running one step through {@link StepExecutor}.
 *
 * @param result   last attempt's result
 * @param attempts tool invocations made (at least 1)
 * @param duration wall time across all attempts and backoff sleeps
 */
public record StepOutcome(ToolResult result, int attempts, Duration duration) {
}
