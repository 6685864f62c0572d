package com.quill.ledger;

/**
 * Write-only store for run and step ledger entries. Payloads arrive as JSON strings.
 * {@link RunLedger} wraps every call so a failing store never fails a run.
 */
public interface LedgerStore {

    void runStarted(String runId, String inputJson, long startTimeMillis);

    void stepRecorded(String runId, int sequence, String toolName, String status, String recordJson);

    void runEnded(String runId, long endTimeMillis, String state, String reason, int steps);

    /** Run end with duration. */
    default void runEnded(String runId, long endTimeMillis, String state, String reason, int steps, Long durationMs) {
        runEnded(runId, endTimeMillis, state, reason, steps);
    }
}
