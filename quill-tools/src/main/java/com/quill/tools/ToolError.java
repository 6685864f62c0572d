package com.quill.tools;

import java.util.Objects;

/**
 * Error value produced at the tool-invocation boundary.
 *
 * @param type    short error kind (exception simple name, {@code Timeout}, {@code UnknownTool}, {@code Rejected})
 * @param message human-readable detail; never null
 */
public record ToolError(String type, String message) {

    public static final String TIMEOUT = "Timeout";
    public static final String UNKNOWN_TOOL = "UnknownTool";
    public static final String INTERRUPTED = "Interrupted";
    public static final String REJECTED = "Rejected";

    public ToolError {
        Objects.requireNonNull(type, "type");
        message = message != null ? message : "";
    }

    public static ToolError of(Throwable t) {
        Objects.requireNonNull(t, "t");
        return new ToolError(t.getClass().getSimpleName(), t.getMessage() != null ? t.getMessage() : t.toString());
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
