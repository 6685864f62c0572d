package com.quill.resolver;

import java.util.List;

/**
 * Thrown when required parameters of a tool cannot be filled from any source.
 * {@link #missingArguments()} lists exactly the unresolved names in declaration order.
 */
public class MissingRequiredArgumentException extends RuntimeException {

    private final String toolName;
    private final List<String> missingArguments;

    public MissingRequiredArgumentException(String toolName, List<String> missingArguments) {
        super("Missing required args for " + toolName + ": " + String.join(", ", missingArguments));
        this.toolName = toolName;
        this.missingArguments = List.copyOf(missingArguments);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> missingArguments() {
        return missingArguments;
    }
}
