package com.quill.orchestrator;

import com.quill.tools.ToolError;
import com.quill.tools.ToolInvoker;
import com.quill.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one tool with resolved arguments, bounded by a per-attempt timeout and retried with
 * exponential backoff. Never throws for tool failures: the last attempt's error is returned.
 */
public final class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ToolInvoker invoker;
    private final ExecutorService executor;
    private final int maxRetries;
    private final long timeoutMs;
    private final long retryInitialIntervalMs;
    private final double retryBackoffCoefficient;
    private final long maxRetryIntervalMs;
    private final RunMetrics metrics;

    /**
     * @param timeoutMs          per-attempt limit; 0 runs the tool on the calling thread without a limit
     * @param maxRetryIntervalMs upper bound on any single backoff wait
     */
    public StepExecutor(ToolInvoker invoker, ExecutorService executor, int maxRetries, long timeoutMs,
                        long retryInitialIntervalMs, double retryBackoffCoefficient, long maxRetryIntervalMs,
                        RunMetrics metrics) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.executor = executor;
        this.maxRetries = Math.max(0, maxRetries);
        this.timeoutMs = Math.max(0L, timeoutMs);
        this.retryInitialIntervalMs = Math.max(0L, retryInitialIntervalMs);
        this.retryBackoffCoefficient = Math.max(1.0, retryBackoffCoefficient);
        this.maxRetryIntervalMs = Math.max(0L, maxRetryIntervalMs);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (this.timeoutMs > 0 && executor == null) {
            throw new IllegalArgumentException("executor is required when timeoutMs > 0");
        }
    }

    public StepOutcome execute(String toolName, Map<String, Object> resolvedArgs) {
        long start = System.nanoTime();
        ToolResult result = null;
        int attempts = 0;
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts = attempt;
            metrics.toolAttempt(toolName);
            result = invokeOnce(toolName, resolvedArgs);
            if (result.isSuccess() || !isRetryable(result.error())) {
                break;
            }
            if (attempt < maxAttempts) {
                long sleepMs = backoffMillis(attempt);
                log.warn("Tool attempt failed; retrying | tool={} | attempt={} | maxAttempts={} | sleepMs={} | error={}",
                        toolName, attempt, maxAttempts, sleepMs, result.error());
                if (!sleep(sleepMs)) {
                    result = ToolResult.failure(new ToolError(ToolError.INTERRUPTED,
                            "Interrupted during retry backoff for " + toolName));
                    break;
                }
            }
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        metrics.toolExecution(toolName, result.isSuccess(), duration);
        return new StepOutcome(result, attempts, duration);
    }

    /** Wait after the given failed attempt (1-based), capped at {@code maxRetryIntervalMs}. */
    long backoffMillis(int attempt) {
        double ms = retryInitialIntervalMs * Math.pow(retryBackoffCoefficient, attempt - 1);
        return (long) Math.min(ms, (double) maxRetryIntervalMs);
    }

    private ToolResult invokeOnce(String toolName, Map<String, Object> args) {
        if (timeoutMs == 0) {
            return invokeGuarded(toolName, args);
        }
        Future<ToolResult> future;
        try {
            future = executor.submit(() -> invokeGuarded(toolName, args));
        } catch (RejectedExecutionException e) {
            log.warn("Tool executor rejected the call | tool={} | error={}", toolName, e.toString());
            return ToolResult.failure(new ToolError(ToolError.REJECTED,
                    "Tool executor rejected " + toolName + " (orchestrator closed?)"));
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ToolResult.failure(new ToolError(ToolError.TIMEOUT,
                    "Tool " + toolName + " did not finish within " + timeoutMs + " ms"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ToolResult.failure(new ToolError(ToolError.INTERRUPTED, "Interrupted while waiting for " + toolName));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ToolResult.failure(ToolError.of(cause));
        }
    }

    private ToolResult invokeGuarded(String toolName, Map<String, Object> args) {
        try {
            ToolResult result = invoker.invoke(toolName, args);
            return result != null ? result : ToolResult.success(Map.of());
        } catch (RuntimeException e) {
            log.error("Tool invoker threw | tool={} | error={}", toolName, e.toString(), e);
            return ToolResult.failure(ToolError.of(e));
        }
    }

    private static boolean isRetryable(ToolError error) {
        return !ToolError.UNKNOWN_TOOL.equals(error.type())
                && !ToolError.INTERRUPTED.equals(error.type())
                && !ToolError.REJECTED.equals(error.type());
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
