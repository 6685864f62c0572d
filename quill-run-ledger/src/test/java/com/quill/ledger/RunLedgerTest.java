package com.quill.ledger;

import com.quill.planner.StepOrigin;
import com.quill.tools.ToolError;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunLedgerTest {

    @Test
    void writesRunAndStepEntriesAsJson() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        RunLedger ledger = new RunLedger(store);
        History history = new History();

        ledger.runStarted("run-1", "write my essay", Map.of("essay_prompt", "Why us?"), 1L);
        ledger.stepRecorded("run-1", history.appendSuccess("outline", Map.of("story", "s"), Map.of("outline", "o"),
                Duration.ofMillis(12), StepOrigin.PLANNED, 1));
        ledger.stepRecorded("run-1", history.appendFailure("draft", Map.of(), new ToolError("Timeout", "took too long"),
                Duration.ofMillis(30), StepOrigin.REPLANNED, 3));
        ledger.runEnded("run-1", 2L, "DONE", "COMPLETED", 2, 1L);

        List<InMemoryLedgerStore.Entry> entries = store.entries("run-1");
        assertEquals(4, entries.size());
        assertTrue(entries.get(0).payload().contains("\"userInput\":\"write my essay\""));
        assertEquals("SUCCESS", entries.get(1).status());
        assertTrue(entries.get(1).payload().contains("\"origin\":\"PLANNED\""));
        assertEquals("FAILED", entries.get(2).status());
        assertTrue(entries.get(2).payload().contains("\"type\":\"Timeout\""));
        assertEquals("DONE/COMPLETED", entries.get(3).status());
    }

    @Test
    void storeFailuresNeverPropagate() {
        LedgerStore failing = new LedgerStore() {
            @Override
            public void runStarted(String runId, String inputJson, long startTimeMillis) {
                throw new IllegalStateException("db down");
            }

            @Override
            public void stepRecorded(String runId, int sequence, String toolName, String status, String recordJson) {
                throw new IllegalStateException("db down");
            }

            @Override
            public void runEnded(String runId, long endTimeMillis, String state, String reason, int steps) {
                throw new IllegalStateException("db down");
            }
        };
        RunLedger ledger = new RunLedger(failing);
        ExecutionRecord record = new History().appendSuccess("a", Map.of(), "v", Duration.ZERO, StepOrigin.PLANNED, 1);

        assertDoesNotThrow(() -> {
            ledger.runStarted("r", "hi", Map.of(), 0L);
            ledger.stepRecorded("r", record);
            ledger.runEnded("r", 1L, "DONE", "COMPLETED", 1, 1L);
        });
    }

    @Test
    void unserializableValueIsLoggedNotThrown() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        ExecutionRecord record = new History().appendSuccess("a", Map.of(), new Object(), Duration.ZERO, StepOrigin.PLANNED, 1);

        assertDoesNotThrow(() -> new RunLedger(store).stepRecorded("r", record));
        assertTrue(store.entries().isEmpty());
    }
}
