package com.quill.tool.clarify;

import com.quill.tools.ToolCategory;
import com.quill.tools.ToolProvider;

/**
 * Provider for the built-in {@code clarify} tool, registered through ServiceLoader.
 */
public final class ClarifyToolProvider implements ToolProvider {

    public static final String TOOL_NAME = "clarify";

    private final ClarifyTool tool = new ClarifyTool();

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Asks the user for missing details or a clearer request.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.CLARIFICATION;
    }

    @Override
    public ClarifyTool getTool() {
        return tool;
    }
}
