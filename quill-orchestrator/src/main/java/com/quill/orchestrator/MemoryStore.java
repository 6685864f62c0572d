package com.quill.orchestrator;

import java.util.HashMap;
import java.util.Map;

/**
 * Read-only source of remembered session values (essay prompt, profile, preferences).
 * Used only to seed the working context at run start.
 */
public interface MemoryStore {

    /** Value stored under key, or defaultValue when absent. */
    Object get(String key, Object defaultValue);

    static MemoryStore empty() {
        return (key, defaultValue) -> defaultValue;
    }

    static MemoryStore of(Map<String, ?> values) {
        Map<String, Object> copy = new HashMap<>(values);
        return (key, defaultValue) -> copy.getOrDefault(key, defaultValue);
    }
}
