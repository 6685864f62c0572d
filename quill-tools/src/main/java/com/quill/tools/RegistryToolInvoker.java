package com.quill.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * {@link ToolInvoker} that resolves tools from a {@link ToolRegistry} and calls them directly.
 * An unknown tool or an exception thrown by the tool becomes a {@link ToolResult} error.
 */
public final class RegistryToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(RegistryToolInvoker.class);

    private final ToolRegistry registry;

    public RegistryToolInvoker(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public ToolResult invoke(String toolName, Map<String, Object> resolvedArgs) {
        Tool tool = registry.get(toolName);
        if (tool == null) {
            log.warn("No tool registered | tool={}", toolName);
            return ToolResult.failure(new ToolError(ToolError.UNKNOWN_TOOL, "No tool registered: " + toolName));
        }
        try {
            Map<String, Object> output = tool.execute(resolvedArgs != null ? resolvedArgs : Map.of());
            return ToolResult.success(output != null ? output : Map.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(new ToolError(ToolError.INTERRUPTED, "Tool interrupted: " + toolName));
        } catch (Exception e) {
            log.debug("Tool threw | tool={} | error={}", toolName, e.toString());
            return ToolResult.failure(ToolError.of(e));
        }
    }
}
