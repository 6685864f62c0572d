package com.quill.ledger;

import com.quill.planner.StepOrigin;
import com.quill.tools.ToolError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only, ordered record of the steps of one run. Owned by a single run; not thread-safe.
 */
public final class History {

    private final List<ExecutionRecord> records = new ArrayList<>();

    /** Appends a successful step and returns its record. */
    public ExecutionRecord appendSuccess(String toolName, Map<String, Object> args, Object value,
                                         Duration duration, StepOrigin origin, int attempts) {
        ExecutionRecord record = new ExecutionRecord(records.size(), toolName, args, value, null, duration, origin, attempts);
        records.add(record);
        return record;
    }

    /** Appends a failed step and returns its record. */
    public ExecutionRecord appendFailure(String toolName, Map<String, Object> args, ToolError error,
                                         Duration duration, StepOrigin origin, int attempts) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        ExecutionRecord record = new ExecutionRecord(records.size(), toolName, args, null, error, duration, origin, attempts);
        records.add(record);
        return record;
    }

    /** Snapshot of the records in execution order. */
    public List<ExecutionRecord> records() {
        return List.copyOf(records);
    }

    /** Names of every tool with a record, in first-execution order. */
    public Set<String> toolNames() {
        Set<String> names = new LinkedHashSet<>();
        for (ExecutionRecord r : records) {
            names.add(r.toolName());
        }
        return names;
    }

    public boolean containsTool(String toolName) {
        for (ExecutionRecord r : records) {
            if (r.toolName().equals(toolName)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
