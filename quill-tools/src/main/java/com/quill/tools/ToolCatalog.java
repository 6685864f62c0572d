package com.quill.tools;

import com.quill.annotations.QuillTool;
import com.quill.annotations.QuillToolParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only map from tool name to {@link ToolSpec}, built once at startup and injected into the
 * resolver and planner. Safe for concurrent reads.
 * <p>
 * Unregistered names yield empty parameter sets rather than an exception; callers that need to
 * distinguish use {@link #isRegistered(String)}.
 */
public final class ToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalog.class);

    private final Map<String, ToolSpec> specs;

    private ToolCatalog(Map<String, ToolSpec> specs) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    /**
     * Introspects the {@link QuillTool} annotation of every registered tool class. A tool without
     * the annotation is catalogued with no declared parameters.
     */
    public static ToolCatalog fromRegistry(ToolRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        Builder builder = builder();
        for (ToolProvider provider : registry.providers()) {
            String name = provider.getToolName().trim();
            Class<?> toolClass = provider.getTool().getClass();
            QuillTool annotation = toolClass.getAnnotation(QuillTool.class);
            if (annotation == null) {
                log.warn("Tool class has no @QuillTool schema; cataloguing without parameters | tool={} | class={}",
                        name, toolClass.getName());
                builder.tool(name, Set.of(), Set.of());
                continue;
            }
            if (!name.equals(annotation.name())) {
                log.warn("Provider tool name differs from @QuillTool name; using provider name | provider={} | annotation={}",
                        name, annotation.name());
            }
            builder.add(specOf(name, annotation));
        }
        ToolCatalog catalog = builder.build();
        log.debug("Tool catalog built | tools={}", catalog.toolNames());
        return catalog;
    }

    /**
     * Reads the schema declared on {@code toolClass}.
     *
     * @throws IllegalArgumentException if the class is not annotated with {@link QuillTool}
     */
    public static ToolSpec introspect(Class<?> toolClass) {
        QuillTool annotation = toolClass.getAnnotation(QuillTool.class);
        if (annotation == null) {
            throw new IllegalArgumentException("Not a @QuillTool: " + toolClass.getName());
        }
        return specOf(annotation.name(), annotation);
    }

    private static ToolSpec specOf(String name, QuillTool annotation) {
        Set<String> required = new LinkedHashSet<>();
        Set<String> optional = new LinkedHashSet<>();
        for (QuillToolParam param : annotation.parameters()) {
            if (param.required()) {
                required.add(param.name());
            } else {
                optional.add(param.name());
            }
        }
        return new ToolSpec(name, required, optional);
    }

    /** Required parameter names in declaration order; empty for an unregistered tool. */
    public Set<String> requiredArgs(String toolName) {
        ToolSpec spec = toolName != null ? specs.get(toolName) : null;
        return spec != null ? spec.requiredParams() : Collections.emptySet();
    }

    /** Optional parameter names in declaration order; empty for an unregistered tool. */
    public Set<String> optionalArgs(String toolName) {
        ToolSpec spec = toolName != null ? specs.get(toolName) : null;
        return spec != null ? spec.optionalParams() : Collections.emptySet();
    }

    public Optional<ToolSpec> spec(String toolName) {
        return Optional.ofNullable(toolName != null ? specs.get(toolName) : null);
    }

    public boolean isRegistered(String toolName) {
        return toolName != null && specs.containsKey(toolName);
    }

    public Set<String> toolNames() {
        return specs.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ToolSpec> specs = new LinkedHashMap<>();

        public Builder tool(String name, Collection<String> required, Collection<String> optional) {
            return add(ToolSpec.of(name, required, optional));
        }

        public Builder tool(Class<?> toolClass) {
            return add(introspect(toolClass));
        }

        public Builder add(ToolSpec spec) {
            Objects.requireNonNull(spec, "spec");
            if (specs.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Tool already catalogued: " + spec.name());
            }
            return this;
        }

        public ToolCatalog build() {
            return new ToolCatalog(specs);
        }
    }
}
