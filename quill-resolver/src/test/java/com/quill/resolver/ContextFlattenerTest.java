package com.quill.resolver;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextFlattenerTest {

    @Test
    void flatten_exposesDottedAndUnderscoredPaths() {
        Map<String, Object> flat = ContextFlattener.flatten(Map.of(
                "college_context", Map.of("school", "Stanford", "meta", Map.of("year", 2025))));

        assertEquals("Stanford", flat.get("college_context.school"));
        assertEquals("Stanford", flat.get("college_context_school"));
        assertEquals(2025, flat.get("college_context.meta.year"));
        assertEquals(2025, flat.get("college_context_meta_year"));
        assertTrue(flat.containsKey("college_context"));
    }

    @Test
    void flatten_firstEntryWinsOnCollision() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("a_b", "top");
        ctx.put("a", Map.of("b", "nested"));

        Map<String, Object> flat = ContextFlattener.flatten(ctx);

        assertEquals("top", flat.get("a_b"));
        assertEquals("nested", flat.get("a.b"));
    }

    @Test
    void flatten_skipsNullValuesAndHandlesEmptyInput() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("x", null);

        assertFalse(ContextFlattener.flatten(ctx).containsKey("x"));
        assertTrue(ContextFlattener.flatten(null).isEmpty());
    }
}
