package com.quill.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** No-op LedgerStore used when the ledger is disabled. Logs at DEBUG so the ledger path stays visible. */
public final class NoOpLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpLedgerStore.class);

    @Override
    public void runStarted(String runId, String inputJson, long startTimeMillis) {
        log.debug("Ledger (no-op): runStarted | runId={} | persistence skipped", runId);
    }

    @Override
    public void stepRecorded(String runId, int sequence, String toolName, String status, String recordJson) {
        log.debug("Ledger (no-op): stepRecorded | runId={} | seq={} | tool={} | status={}", runId, sequence, toolName, status);
    }

    @Override
    public void runEnded(String runId, long endTimeMillis, String state, String reason, int steps) {
        log.debug("Ledger (no-op): runEnded | runId={} | state={} | reason={} | steps={}", runId, state, reason, steps);
    }
}
