package com.quill.tools;

/**
 * Outcome of one tool invocation: either a value or an error, never both.
 *
 * @param value result value (usually the tool's output map); null when {@code error} is set
 * @param error error; null on success
 */
public record ToolResult(Object value, ToolError error) {

    public ToolResult {
        if (value != null && error != null) {
            throw new IllegalArgumentException("ToolResult cannot hold both a value and an error");
        }
    }

    public static ToolResult success(Object value) {
        return new ToolResult(value, null);
    }

    public static ToolResult failure(ToolError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new ToolResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
