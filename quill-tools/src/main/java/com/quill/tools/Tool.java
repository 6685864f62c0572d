package com.quill.tools;

import java.util.Map;

/**
 * A content-generation tool: an opaque function from resolved arguments to a result map.
 * Implementations declare their parameter schema with {@link com.quill.annotations.QuillTool}
 * so the {@link ToolCatalog} can tell required parameters from optional ones.
 */
public interface Tool {

    /**
     * Runs the tool.
     *
     * @param args resolved arguments (never null; may hold names the tool does not declare)
     * @return result map (e.g. {@code draft}, {@code text}); null is treated as empty
     * @throws Exception on tool failure; the invoker converts it into a {@link ToolError}
     */
    Map<String, Object> execute(Map<String, Object> args) throws Exception;
}
