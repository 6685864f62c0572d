package com.quill.tools;

import java.util.Map;

/**
 * Boundary through which the orchestrator calls tools. Implementations report recoverable
 * failures as a {@link ToolResult} error instead of throwing.
 */
@FunctionalInterface
public interface ToolInvoker {

    ToolResult invoke(String toolName, Map<String, Object> resolvedArgs);
}
