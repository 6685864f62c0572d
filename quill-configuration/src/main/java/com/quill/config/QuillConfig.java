package com.quill.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration for the Quill plan-execution engine, loaded from environment variables.
 * <p>
 * Budgets: QUILL_MAX_STEPS (executed steps per run), QUILL_MAX_QUALITY_STEPS (corrective steps
 * per run), QUILL_MAX_RETRIES (extra attempts per tool call).
 * Timeouts: QUILL_TOOL_TIMEOUT_MS, QUILL_QUALITY_TIMEOUT_MS (0 = no limit).
 * Quality: QUILL_MIN_QUALITY_SCORE on a 0-10 scale.
 * Tool names: QUILL_CONVERSATION_TOOL, QUILL_CLARIFY_TOOL, QUILL_IMPROVEMENT_TOOL.
 */
public final class QuillConfig {

    private static final String ENV_MAX_STEPS = "QUILL_MAX_STEPS";
    private static final String ENV_MAX_RETRIES = "QUILL_MAX_RETRIES";
    private static final String ENV_RETRY_INITIAL_INTERVAL_MS = "QUILL_RETRY_INITIAL_INTERVAL_MS";
    private static final String ENV_RETRY_BACKOFF_COEFFICIENT = "QUILL_RETRY_BACKOFF_COEFFICIENT";
    private static final String ENV_RETRY_MAX_INTERVAL_MS = "QUILL_RETRY_MAX_INTERVAL_MS";
    private static final String ENV_TOOL_TIMEOUT_MS = "QUILL_TOOL_TIMEOUT_MS";
    private static final String ENV_QUALITY_TIMEOUT_MS = "QUILL_QUALITY_TIMEOUT_MS";
    private static final String ENV_MIN_QUALITY_SCORE = "QUILL_MIN_QUALITY_SCORE";
    private static final String ENV_MAX_QUALITY_STEPS = "QUILL_MAX_QUALITY_STEPS";
    private static final String ENV_CONVERSATION_TOOL = "QUILL_CONVERSATION_TOOL";
    private static final String ENV_CLARIFY_TOOL = "QUILL_CLARIFY_TOOL";
    private static final String ENV_IMPROVEMENT_TOOL = "QUILL_IMPROVEMENT_TOOL";
    private static final String ENV_QUALITY_PROMPT = "QUILL_QUALITY_PROMPT";
    private static final String ENV_MEMORY_KEYS = "QUILL_MEMORY_KEYS";
    private static final String ENV_SHOW_ARGS = "QUILL_SHOW_ARGS";
    private static final String ENV_RUN_LEDGER = "QUILL_RUN_LEDGER";

    public static final int DEFAULT_MAX_STEPS = 5;
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final long DEFAULT_RETRY_INITIAL_INTERVAL_MS = 0L;
    public static final double DEFAULT_RETRY_BACKOFF_COEFFICIENT = 2.0;
    public static final long DEFAULT_RETRY_MAX_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_TOOL_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_QUALITY_TIMEOUT_MS = 30_000L;
    public static final double DEFAULT_MIN_QUALITY_SCORE = 8.5;
    public static final int DEFAULT_MAX_QUALITY_STEPS = 3;
    public static final String DEFAULT_CONVERSATION_TOOL = "chat_response";
    public static final String DEFAULT_CLARIFY_TOOL = "clarify";
    public static final String DEFAULT_IMPROVEMENT_TOOL = "revise_for_clarity";
    public static final String DEFAULT_QUALITY_PROMPT = "Improve quality";
    public static final List<String> DEFAULT_MEMORY_KEYS = List.of("essay_prompt", "profile", "preferences");

    private final int maxSteps;
    private final int maxRetries;
    private final long retryInitialIntervalMs;
    private final double retryBackoffCoefficient;
    private final long maxRetryIntervalMs;
    private final long toolTimeoutMs;
    private final long qualityTimeoutMs;
    private final double minQualityScore;
    private final int maxQualitySteps;
    private final String conversationalTool;
    private final String clarificationTool;
    private final String improvementTool;
    private final String qualityImprovementPrompt;
    private final List<String> memoryKeys;
    private final boolean showResolvedArgs;
    private final boolean runLedgerEnabled;

    private QuillConfig(Builder b) {
        this.maxSteps = b.maxSteps;
        this.maxRetries = b.maxRetries;
        this.retryInitialIntervalMs = b.retryInitialIntervalMs;
        this.retryBackoffCoefficient = b.retryBackoffCoefficient;
        this.maxRetryIntervalMs = b.maxRetryIntervalMs;
        this.toolTimeoutMs = b.toolTimeoutMs;
        this.qualityTimeoutMs = b.qualityTimeoutMs;
        this.minQualityScore = b.minQualityScore;
        this.maxQualitySteps = b.maxQualitySteps;
        this.conversationalTool = b.conversationalTool;
        this.clarificationTool = b.clarificationTool;
        this.improvementTool = b.improvementTool;
        this.qualityImprovementPrompt = b.qualityImprovementPrompt;
        this.memoryKeys = Collections.unmodifiableList(new ArrayList<>(b.memoryKeys));
        this.showResolvedArgs = b.showResolvedArgs;
        this.runLedgerEnabled = b.runLedgerEnabled;
    }

    /** Maximum number of executed steps per run (QUILL_MAX_STEPS). Default 5. */
    public int getMaxSteps() {
        return maxSteps;
    }

    /** Additional attempts after a failed tool call (QUILL_MAX_RETRIES). Default 2, so 3 attempts in total. */
    public int getMaxRetries() {
        return maxRetries;
    }

    /** Wait before the first retry; 0 retries immediately. */
    public long getRetryInitialIntervalMs() {
        return retryInitialIntervalMs;
    }

    public double getRetryBackoffCoefficient() {
        return retryBackoffCoefficient;
    }

    /** Upper bound on a single backoff wait, whatever the coefficient and attempt. */
    public long getMaxRetryIntervalMs() {
        return maxRetryIntervalMs;
    }

    /** Per-attempt tool timeout in milliseconds; 0 disables the limit. */
    public long getToolTimeoutMs() {
        return toolTimeoutMs;
    }

    /** Quality evaluator timeout in milliseconds; 0 disables the limit. */
    public long getQualityTimeoutMs() {
        return qualityTimeoutMs;
    }

    /** Scores below this (0-10 scale) trigger a corrective step. Default 8.5. */
    public double getMinQualityScore() {
        return minQualityScore;
    }

    /** Maximum corrective steps the quality gate may insert per run. Default 3. */
    public int getMaxQualitySteps() {
        return maxQualitySteps;
    }

    /** Tool run when the plan is empty (conversational fallback). */
    public String getConversationalTool() {
        return conversationalTool;
    }

    /** Tool inserted once per run when arguments cannot be resolved. */
    public String getClarificationTool() {
        return clarificationTool;
    }

    /** Corrective tool used when the oracle does not name one. */
    public String getImprovementTool() {
        return improvementTool;
    }

    /** User input handed to the oracle when asking for a corrective tool. */
    public String getQualityImprovementPrompt() {
        return qualityImprovementPrompt;
    }

    /** Context keys seeded from the memory store when the snapshot lacks them. */
    public List<String> getMemoryKeys() {
        return memoryKeys;
    }

    /** Whether resolved arguments and their sources are logged at INFO (QUILL_SHOW_ARGS). */
    public boolean isShowResolvedArgs() {
        return showResolvedArgs;
    }

    /** Whether runs are reported to the run ledger (QUILL_RUN_LEDGER). Default false. */
    public boolean isRunLedgerEnabled() {
        return runLedgerEnabled;
    }

    public static QuillConfig defaults() {
        return builder().build();
    }

    public static QuillConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds the configuration from an environment-style map. Missing, blank or unparseable
     * values fall back to the defaults.
     */
    public static QuillConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> memoryKeys = parseCommaSeparated(env.get(ENV_MEMORY_KEYS));
        if (memoryKeys.isEmpty()) memoryKeys = DEFAULT_MEMORY_KEYS;

        return builder()
                .maxSteps(parseInt(env.get(ENV_MAX_STEPS), DEFAULT_MAX_STEPS))
                .maxRetries(parseInt(env.get(ENV_MAX_RETRIES), DEFAULT_MAX_RETRIES))
                .retryInitialIntervalMs(parseLong(env.get(ENV_RETRY_INITIAL_INTERVAL_MS), DEFAULT_RETRY_INITIAL_INTERVAL_MS))
                .retryBackoffCoefficient(parseDouble(env.get(ENV_RETRY_BACKOFF_COEFFICIENT), DEFAULT_RETRY_BACKOFF_COEFFICIENT))
                .maxRetryIntervalMs(parseLong(env.get(ENV_RETRY_MAX_INTERVAL_MS), DEFAULT_RETRY_MAX_INTERVAL_MS))
                .toolTimeoutMs(parseLong(env.get(ENV_TOOL_TIMEOUT_MS), DEFAULT_TOOL_TIMEOUT_MS))
                .qualityTimeoutMs(parseLong(env.get(ENV_QUALITY_TIMEOUT_MS), DEFAULT_QUALITY_TIMEOUT_MS))
                .minQualityScore(parseDouble(env.get(ENV_MIN_QUALITY_SCORE), DEFAULT_MIN_QUALITY_SCORE))
                .maxQualitySteps(parseInt(env.get(ENV_MAX_QUALITY_STEPS), DEFAULT_MAX_QUALITY_STEPS))
                .conversationalTool(getEnv(env, ENV_CONVERSATION_TOOL, DEFAULT_CONVERSATION_TOOL))
                .clarificationTool(getEnv(env, ENV_CLARIFY_TOOL, DEFAULT_CLARIFY_TOOL))
                .improvementTool(getEnv(env, ENV_IMPROVEMENT_TOOL, DEFAULT_IMPROVEMENT_TOOL))
                .qualityImprovementPrompt(getEnv(env, ENV_QUALITY_PROMPT, DEFAULT_QUALITY_PROMPT))
                .memoryKeys(memoryKeys)
                .showResolvedArgs(parseBoolean(env.get(ENV_SHOW_ARGS), false))
                .runLedgerEnabled(parseBoolean(env.get(ENV_RUN_LEDGER), false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            double d = Double.parseDouble(value.trim());
            return Double.isFinite(d) ? d : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private int maxSteps = DEFAULT_MAX_STEPS;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryInitialIntervalMs = DEFAULT_RETRY_INITIAL_INTERVAL_MS;
        private double retryBackoffCoefficient = DEFAULT_RETRY_BACKOFF_COEFFICIENT;
        private long maxRetryIntervalMs = DEFAULT_RETRY_MAX_INTERVAL_MS;
        private long toolTimeoutMs = DEFAULT_TOOL_TIMEOUT_MS;
        private long qualityTimeoutMs = DEFAULT_QUALITY_TIMEOUT_MS;
        private double minQualityScore = DEFAULT_MIN_QUALITY_SCORE;
        private int maxQualitySteps = DEFAULT_MAX_QUALITY_STEPS;
        private String conversationalTool = DEFAULT_CONVERSATION_TOOL;
        private String clarificationTool = DEFAULT_CLARIFY_TOOL;
        private String improvementTool = DEFAULT_IMPROVEMENT_TOOL;
        private String qualityImprovementPrompt = DEFAULT_QUALITY_PROMPT;
        private List<String> memoryKeys = DEFAULT_MEMORY_KEYS;
        private boolean showResolvedArgs;
        private boolean runLedgerEnabled;

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryInitialIntervalMs(long retryInitialIntervalMs) {
            this.retryInitialIntervalMs = retryInitialIntervalMs;
            return this;
        }

        public Builder retryBackoffCoefficient(double retryBackoffCoefficient) {
            this.retryBackoffCoefficient = retryBackoffCoefficient;
            return this;
        }

        public Builder maxRetryIntervalMs(long maxRetryIntervalMs) {
            this.maxRetryIntervalMs = maxRetryIntervalMs;
            return this;
        }

        public Builder toolTimeoutMs(long toolTimeoutMs) {
            this.toolTimeoutMs = toolTimeoutMs;
            return this;
        }

        public Builder qualityTimeoutMs(long qualityTimeoutMs) {
            this.qualityTimeoutMs = qualityTimeoutMs;
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

        public Builder conversationalTool(String conversationalTool) {
            this.conversationalTool = conversationalTool != null ? conversationalTool : DEFAULT_CONVERSATION_TOOL;
            return this;
        }

        public Builder clarificationTool(String clarificationTool) {
            this.clarificationTool = clarificationTool != null ? clarificationTool : DEFAULT_CLARIFY_TOOL;
            return this;
        }

        public Builder improvementTool(String improvementTool) {
            this.improvementTool = improvementTool != null ? improvementTool : DEFAULT_IMPROVEMENT_TOOL;
            return this;
        }

        public Builder qualityImprovementPrompt(String qualityImprovementPrompt) {
            this.qualityImprovementPrompt = qualityImprovementPrompt != null ? qualityImprovementPrompt : DEFAULT_QUALITY_PROMPT;
            return this;
        }

        public Builder memoryKeys(List<String> memoryKeys) {
            this.memoryKeys = memoryKeys != null ? new ArrayList<>(memoryKeys) : List.of();
            return this;
        }

        public Builder showResolvedArgs(boolean showResolvedArgs) {
            this.showResolvedArgs = showResolvedArgs;
            return this;
        }

        public Builder runLedgerEnabled(boolean runLedgerEnabled) {
            this.runLedgerEnabled = runLedgerEnabled;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a budget, timeout or score is out of range
         */
        public QuillConfig build() {
            if (maxSteps < 1) throw new IllegalArgumentException("maxSteps must be >= 1: " + maxSteps);
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
            if (maxQualitySteps < 0) throw new IllegalArgumentException("maxQualitySteps must be >= 0: " + maxQualitySteps);
            if (retryInitialIntervalMs < 0) throw new IllegalArgumentException("retryInitialIntervalMs must be >= 0: " + retryInitialIntervalMs);
            if (retryBackoffCoefficient < 1.0) throw new IllegalArgumentException("retryBackoffCoefficient must be >= 1: " + retryBackoffCoefficient);
            if (maxRetryIntervalMs < 0) throw new IllegalArgumentException("maxRetryIntervalMs must be >= 0: " + maxRetryIntervalMs);
            if (toolTimeoutMs < 0) throw new IllegalArgumentException("toolTimeoutMs must be >= 0: " + toolTimeoutMs);
            if (qualityTimeoutMs < 0) throw new IllegalArgumentException("qualityTimeoutMs must be >= 0: " + qualityTimeoutMs);
            if (minQualityScore < 0.0 || minQualityScore > 10.0) {
                throw new IllegalArgumentException("minQualityScore must be within [0, 10]: " + minQualityScore);
            }
            return new QuillConfig(this);
        }
    }
}
