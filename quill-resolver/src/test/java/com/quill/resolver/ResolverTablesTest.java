package com.quill.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResolverTablesTest {

    @Test
    void loadDefault_readsBundledTables() {
        ResolverTables tables = ResolverTables.loadDefault();

        assertEquals("1.1", tables.getVersion());
        assertFalse(tables.getRoles().isEmpty());
        assertEquals(650, tables.getDefaults().get("word_limit"));
        assertEquals(List.of("prompt", "question"), tables.aliasesFor("essay_prompt"));
        assertEquals("user_utterance", tables.rolesFor("user_input").get(0).name());
        assertEquals("text", tables.getUserInputFallback().get(0));
    }

    @Test
    void fromJson_parsesCustomTables() {
        ResolverTables tables = ResolverTables.fromJson("""
                {"version": "test-2",
                 "roles": [{"role": "topic", "params": ["topic"], "candidates": ["subject", "@user_input"]}],
                 "defaults": {"limit": 3},
                 "aliases": {"topic": ["theme"]}}
                """);

        assertEquals("test-2", tables.getVersion());
        assertEquals(List.of("subject", SemanticRole.USER_INPUT), tables.rolesFor("topic").get(0).candidates());
        assertEquals(3, tables.getDefaults().get("limit"));
        assertTrue(tables.aliasesFor("unknown").isEmpty());
        assertTrue(tables.getUserInputFallback().isEmpty());
    }

    @Test
    void fromJson_requiresVersion() {
        assertThrows(IllegalArgumentException.class, () -> ResolverTables.fromJson("{\"roles\": []}"));
    }
}
