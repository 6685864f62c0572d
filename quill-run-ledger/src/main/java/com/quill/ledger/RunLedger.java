package com.quill.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fail-safe facade for the run ledger. Serializes payloads to JSON and delegates to
 * {@link LedgerStore}; any exception is caught and logged, never rethrown, so execution never fails.
 */
public final class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LedgerStore store;

    public RunLedger(LedgerStore store) {
        this.store = store != null ? store : new NoOpLedgerStore();
    }

    public static RunLedger disabled() {
        return new RunLedger(new NoOpLedgerStore());
    }

    public void runStarted(String runId, String userInput, Map<String, Object> contextSnapshot, long startTimeMillis) {
        try {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("userInput", userInput);
            input.put("context", contextSnapshot != null ? contextSnapshot : Map.of());
            store.runStarted(runId, MAPPER.writeValueAsString(input), startTimeMillis);
        } catch (Throwable t) {
            log.warn("Ledger runStarted failed (runId={}); execution continues. Error: {}", runId, t.getMessage(), t);
        }
    }

    public void stepRecorded(String runId, ExecutionRecord record) {
        try {
            store.stepRecorded(runId, record.sequence(), record.toolName(),
                    record.isSuccess() ? "SUCCESS" : "FAILED", MAPPER.writeValueAsString(toMap(record)));
        } catch (Throwable t) {
            log.warn("Ledger stepRecorded failed (runId={}, seq={}); execution continues. Error: {}",
                    runId, record != null ? record.sequence() : -1, t.getMessage(), t);
        }
    }

    public void runEnded(String runId, long endTimeMillis, String state, String reason, int steps, long durationMs) {
        try {
            store.runEnded(runId, endTimeMillis, state, reason, steps, durationMs);
        } catch (Throwable t) {
            log.warn("Ledger runEnded failed (runId={}); execution continues. Error: {}", runId, t.getMessage(), t);
        }
    }

    static Map<String, Object> toMap(ExecutionRecord record) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sequence", record.sequence());
        m.put("tool", record.toolName());
        m.put("origin", record.origin().name());
        m.put("attempts", record.attempts());
        m.put("durationMs", record.duration().toMillis());
        m.put("args", record.resolvedArgs());
        if (record.isSuccess()) {
            m.put("value", record.value());
        } else {
            m.put("error", Map.of("type", record.error().type(), "message", record.error().message()));
        }
        return m;
    }
}
