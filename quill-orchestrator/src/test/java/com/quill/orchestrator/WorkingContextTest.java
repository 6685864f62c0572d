package com.quill.orchestrator;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WorkingContextTest {

    @Test
    void snapshotWinsOverMemory() {
        MemoryStore memory = MemoryStore.of(Map.of("essay_prompt", "remembered", "profile", "remembered"));

        WorkingContext ctx = WorkingContext.seed(Map.of("essay_prompt", "current"),
                List.of("essay_prompt", "profile", "preferences"), memory);

        assertEquals("current", ctx.get("essay_prompt"));
        assertEquals("remembered", ctx.get("profile"));
        assertFalse(ctx.containsKey("preferences"));
    }

    @Test
    void failingMemoryIsSkipped() {
        MemoryStore broken = (key, defaultValue) -> {
            throw new IllegalStateException("store offline");
        };

        WorkingContext ctx = WorkingContext.seed(Map.of("a", 1), List.of("essay_prompt"), broken);

        assertEquals(Map.of("a", 1), ctx.snapshot());
    }

    @Test
    void mergeReplacesEarlierValueAndViewIsReadOnly() {
        WorkingContext ctx = WorkingContext.seed(null, List.of(), MemoryStore.empty());
        ctx.merge("draft_essay", Map.of("draft", "v1"));
        ctx.merge("draft_essay", Map.of("draft", "v2"));

        assertEquals(Map.of("draft", "v2"), ctx.get("draft_essay"));
        assertThrows(UnsupportedOperationException.class, () -> ctx.view().put("x", 1));
    }
}
