package com.quill.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable key/value context of one run. Starts as a copy of the caller's snapshot plus any
 * memory keys the snapshot lacks; each completed step's value is merged under the tool's name.
 * Owned by a single run; not thread-safe.
 */
public final class WorkingContext {

    private static final Logger log = LoggerFactory.getLogger(WorkingContext.class);

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Object> view = Collections.unmodifiableMap(values);

    private WorkingContext() {
    }

    /**
     * Seeds a context from the snapshot. Memory lookups that fail are logged and skipped.
     */
    public static WorkingContext seed(Map<String, ?> snapshot, List<String> memoryKeys, MemoryStore memory) {
        WorkingContext ctx = new WorkingContext();
        if (snapshot != null) {
            ctx.values.putAll(snapshot);
        }
        if (memory == null || memoryKeys == null) {
            return ctx;
        }
        for (String key : memoryKeys) {
            if (ctx.values.containsKey(key)) {
                continue;
            }
            try {
                Object remembered = memory.get(key, null);
                if (remembered != null) {
                    ctx.values.put(key, remembered);
                }
            } catch (RuntimeException e) {
                log.warn("Memory lookup failed; key not seeded | key={} | error={}", key, e.toString());
            }
        }
        return ctx;
    }

    /** Stores a step's result value under the tool's name, replacing any earlier value. */
    public void merge(String toolName, Object value) {
        values.put(toolName, value);
    }

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /** Live read-only view. */
    public Map<String, Object> view() {
        return view;
    }

    /** Detached copy. */
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(values);
    }
}
