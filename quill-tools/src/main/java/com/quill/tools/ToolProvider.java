package com.quill.tools;

/**
 * Service-provider interface for a tool. Providers are discovered with
 * {@link java.util.ServiceLoader} from {@code META-INF/services/com.quill.tools.ToolProvider}
 * and collected into a {@link ToolRegistry}.
 */
public interface ToolProvider {

    /** Tool name used in plans and by the catalog (e.g. {@code word_count}). */
    String getToolName();

    /** Human-readable description (e.g. "Counts words in a draft"). */
    String getDescription();

    /** Category for grouping. */
    ToolCategory getCategory();

    /** The tool instance. Tools are expected to be stateless and shared across runs. */
    Tool getTool();

    /** Tool version (e.g. "1.0"). */
    default String getVersion() {
        return "1.0";
    }
}
