package com.quill.tool.wordcount;

import com.quill.tools.ToolCategory;
import com.quill.tools.ToolProvider;

/**
 * Provider for the built-in {@code word_count} tool, registered through ServiceLoader.
 */
public final class WordCountToolProvider implements ToolProvider {

    public static final String TOOL_NAME = "word_count";

    private final WordCountTool tool = new WordCountTool();

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Counts words in a draft and checks them against a target length.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYSIS;
    }

    @Override
    public WordCountTool getTool() {
        return tool;
    }
}
