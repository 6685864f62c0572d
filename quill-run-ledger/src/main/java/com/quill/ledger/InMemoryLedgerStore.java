package com.quill.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * LedgerStore that keeps entries in memory, in arrival order. Thread-safe.
 */
public final class InMemoryLedgerStore implements LedgerStore {

    /** One ledger write. {@code payload} is JSON for start and step entries, null for run end. */
    public record Entry(String runId, String kind, String toolName, String status, String payload) {
    }

    private final List<Entry> entries = new ArrayList<>();

    @Override
    public synchronized void runStarted(String runId, String inputJson, long startTimeMillis) {
        entries.add(new Entry(runId, "RUN_STARTED", null, null, inputJson));
    }

    @Override
    public synchronized void stepRecorded(String runId, int sequence, String toolName, String status, String recordJson) {
        entries.add(new Entry(runId, "STEP", toolName, status, recordJson));
    }

    @Override
    public synchronized void runEnded(String runId, long endTimeMillis, String state, String reason, int steps) {
        entries.add(new Entry(runId, "RUN_ENDED", null, state + "/" + reason, null));
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<Entry> entries(String runId) {
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.runId().equals(runId)) {
                out.add(e);
            }
        }
        return out;
    }
}
