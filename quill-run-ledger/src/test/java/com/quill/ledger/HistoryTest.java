package com.quill.ledger;

import com.quill.planner.StepOrigin;
import com.quill.tools.ToolError;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoryTest {

    @Test
    void append_assignsSequenceInOrder() {
        History history = new History();

        history.appendSuccess("outline", Map.of("story", "s"), Map.of("outline", "o"), Duration.ofMillis(5), StepOrigin.PLANNED, 1);
        history.appendFailure("draft", Map.of(), new ToolError("Timeout", "slow"), Duration.ofMillis(9), StepOrigin.REPLANNED, 3);

        List<ExecutionRecord> records = history.records();
        assertEquals(2, records.size());
        assertEquals(0, records.get(0).sequence());
        assertEquals(1, records.get(1).sequence());
        assertTrue(records.get(0).isSuccess());
        assertFalse(records.get(1).isSuccess());
        assertEquals(3, records.get(1).attempts());
        assertEquals(Set.of("outline", "draft"), history.toolNames());
        assertTrue(history.containsTool("draft"));
        assertFalse(history.containsTool("polish"));
    }

    @Test
    void records_isASnapshot() {
        History history = new History();
        history.appendSuccess("a", null, "x", null, null, 1);

        List<ExecutionRecord> snapshot = history.records();
        history.appendSuccess("b", null, "y", null, null, 1);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
        assertEquals(StepOrigin.PLANNED, snapshot.get(0).origin());
        assertEquals(Duration.ZERO, snapshot.get(0).duration());
    }

    @Test
    void record_rejectsValueAndError() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutionRecord(0, "a", Map.of(), "v",
                new ToolError("X", "y"), Duration.ZERO, StepOrigin.PLANNED, 1));
    }
}
