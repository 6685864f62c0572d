package com.quill.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments resolved for one tool call, with the stage that supplied each one.
 *
 * @param toolName tool the arguments are for
 * @param args     resolved arguments in resolution order
 * @param sources  parameter name to source label ({@code explicit}, {@code context},
 *                 {@code context_flat}, {@code heuristic:<role>:<key>}, {@code default}, {@code alias:<alias>})
 */
public record Resolution(String toolName, Map<String, Object> args, Map<String, String> sources) {

    public Resolution {
        Objects.requireNonNull(toolName, "toolName");
        args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
        sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }
}
