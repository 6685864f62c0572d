package com.quill.tools;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Parameter schema of one tool. Immutable; both sets keep declaration order.
 *
 * @param name           tool name
 * @param requiredParams parameters that must be resolved before the tool runs
 * @param optionalParams parameters the tool can do without
 */
public record ToolSpec(String name, Set<String> requiredParams, Set<String> optionalParams) {

    public ToolSpec {
        Objects.requireNonNull(name, "name");
        requiredParams = copy(requiredParams);
        optionalParams = copy(optionalParams);
        for (String p : optionalParams) {
            if (requiredParams.contains(p)) {
                throw new IllegalArgumentException("Parameter both required and optional for tool " + name + ": " + p);
            }
        }
    }

    public static ToolSpec of(String name, Collection<String> required, Collection<String> optional) {
        return new ToolSpec(name,
                required != null ? new LinkedHashSet<>(required) : Set.of(),
                optional != null ? new LinkedHashSet<>(optional) : Set.of());
    }

    private static Set<String> copy(Set<String> params) {
        if (params == null || params.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(params));
    }
}
