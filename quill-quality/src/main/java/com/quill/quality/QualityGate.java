package com.quill.quality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores textual artifacts and decides whether a corrective step is due.
 * <p>
 * {@link #score(String)} never throws: the evaluator is called with a timeout, and on absence,
 * failure, timeout or a non-finite result the {@link HeuristicScorer} is used instead. If that
 * fails too the score is 0.0, which is always below the threshold.
 */
public final class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final QualityEvaluator evaluator;
    private final HeuristicScorer heuristic = new HeuristicScorer();
    private final long timeoutMs;
    private final double minQualityScore;
    private final int maxQualitySteps;
    private final ExecutorService executor;

    private QualityGate(Builder b) {
        this.evaluator = b.evaluator;
        this.timeoutMs = b.timeoutMs;
        this.minQualityScore = b.minQualityScore;
        this.maxQualitySteps = b.maxQualitySteps;
        this.executor = b.executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Score in [0, 10]; blank text scores 0.0. */
    public double score(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        if (evaluator != null) {
            try {
                double s = evaluate(text);
                if (Double.isFinite(s)) {
                    return clamp(s);
                }
                log.warn("Quality evaluator returned non-finite score; using heuristic | score={}", s);
            } catch (TimeoutException e) {
                log.warn("Quality evaluator timed out; using heuristic | timeoutMs={}", timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Quality evaluation interrupted; using heuristic");
            } catch (Exception e) {
                log.warn("Quality evaluator failed; using heuristic | error={}", e.toString());
            }
        }
        try {
            return heuristic.score(text);
        } catch (RuntimeException e) {
            log.error("Heuristic quality scoring failed; scoring 0.0 | error={}", e.toString(), e);
            return 0.0;
        }
    }

    private double evaluate(String text) throws Exception {
        if (timeoutMs <= 0 || executor == null) {
            return evaluator.score(text);
        }
        Future<Double> future = executor.submit(() -> evaluator.score(text));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw cause instanceof Exception ? (Exception) cause : e;
        }
    }

    /** True when {@code score} is below the threshold and the correction budget is not used up. */
    public boolean shouldCorrect(double score, int correctionsSoFar) {
        return score < minQualityScore && correctionsSoFar < maxQualitySteps;
    }

    public double getMinQualityScore() {
        return minQualityScore;
    }

    public int getMaxQualitySteps() {
        return maxQualitySteps;
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(10.0, score));
    }

    public static final class Builder {
        private QualityEvaluator evaluator;
        private long timeoutMs = 30_000L;
        private double minQualityScore = 8.5;
        private int maxQualitySteps = 3;
        private ExecutorService executor;

        /** Primary evaluator; null uses the heuristic only. */
        public Builder evaluator(QualityEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        /** Evaluator timeout; 0 calls the evaluator inline without a limit. */
        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder minQualityScore(double minQualityScore) {
            this.minQualityScore = minQualityScore;
            return this;
        }

        public Builder maxQualitySteps(int maxQualitySteps) {
            this.maxQualitySteps = maxQualitySteps;
            return this;
        }

        /** Executor for timed evaluator calls; when unset a daemon cached pool is created. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public QualityGate build() {
            if (timeoutMs < 0) throw new IllegalArgumentException("timeoutMs must be >= 0: " + timeoutMs);
            if (maxQualitySteps < 0) throw new IllegalArgumentException("maxQualitySteps must be >= 0: " + maxQualitySteps);
            if (evaluator != null && timeoutMs > 0 && executor == null) {
                executor = Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "quill-quality-eval");
                    t.setDaemon(true);
                    return t;
                });
            }
            return new QualityGate(this);
        }
    }
}
