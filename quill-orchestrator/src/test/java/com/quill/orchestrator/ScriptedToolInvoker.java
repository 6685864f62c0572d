package com.quill.orchestrator;

import com.quill.tools.ToolError;
import com.quill.tools.ToolInvoker;
import com.quill.tools.ToolResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Test invoker: per-tool scripted behaviour, records every call. */
final class ScriptedToolInvoker implements ToolInvoker {

    record Call(String toolName, Map<String, Object> args) {
    }

    private final Map<String, Function<Map<String, Object>, ToolResult>> behaviours = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();

    ScriptedToolInvoker on(String toolName, Function<Map<String, Object>, ToolResult> behaviour) {
        behaviours.put(toolName, behaviour);
        return this;
    }

    ScriptedToolInvoker returning(String toolName, Object value) {
        return on(toolName, args -> ToolResult.success(value));
    }

    @Override
    public ToolResult invoke(String toolName, Map<String, Object> resolvedArgs) {
        synchronized (calls) {
            calls.add(new Call(toolName, new LinkedHashMap<>(resolvedArgs)));
        }
        Function<Map<String, Object>, ToolResult> behaviour = behaviours.get(toolName);
        if (behaviour == null) {
            return ToolResult.failure(new ToolError(ToolError.UNKNOWN_TOOL, "Tool not registered: " + toolName));
        }
        return behaviour.apply(resolvedArgs);
    }

    List<String> calledTools() {
        synchronized (calls) {
            List<String> names = new ArrayList<>();
            for (Call c : calls) {
                names.add(c.toolName());
            }
            return names;
        }
    }

    List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }
}
