package com.quill.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Immutable registry of tools by name, built once from {@link ToolProvider}s and shared
 * read-only by every run. Registration order is kept.
 */
public final class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolProvider> providersByName;

    private ToolRegistry(Map<String, ToolProvider> providersByName) {
        this.providersByName = Collections.unmodifiableMap(providersByName);
    }

    /**
     * Loads all providers on the context class path via {@link ServiceLoader}.
     *
     * @throws IllegalArgumentException if two providers share a tool name
     */
    public static ToolRegistry discover() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return discover(cl != null ? cl : ToolRegistry.class.getClassLoader());
    }

    public static ToolRegistry discover(ClassLoader classLoader) {
        List<ToolProvider> providers = new ArrayList<>();
        for (ToolProvider provider : ServiceLoader.load(ToolProvider.class, classLoader)) {
            providers.add(provider);
        }
        ToolRegistry registry = of(providers);
        log.info("Discovered {} tool provider(s): {}", registry.size(), registry.toolNames());
        return registry;
    }

    /**
     * Builds a registry from the given providers.
     *
     * @throws IllegalArgumentException if a tool name is blank or registered twice
     */
    public static ToolRegistry of(Collection<? extends ToolProvider> providers) {
        Objects.requireNonNull(providers, "providers");
        Map<String, ToolProvider> byName = new LinkedHashMap<>();
        for (ToolProvider provider : providers) {
            Objects.requireNonNull(provider, "provider");
            String name = provider.getToolName() != null ? provider.getToolName().trim() : "";
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Tool name must be non-blank: " + provider.getClass().getName());
            }
            Objects.requireNonNull(provider.getTool(), "tool for " + name);
            if (byName.putIfAbsent(name, provider) != null) {
                throw new IllegalArgumentException("Tool already registered: " + name);
            }
        }
        return new ToolRegistry(byName);
    }

    public static ToolRegistry of(ToolProvider... providers) {
        return of(List.of(providers));
    }

    /** Returns the tool registered under {@code name}, or null. */
    public Tool get(String name) {
        ToolProvider provider = name != null ? providersByName.get(name) : null;
        return provider != null ? provider.getTool() : null;
    }

    /** Returns the provider registered under {@code name}, or null. */
    public ToolProvider getProvider(String name) {
        return name != null ? providersByName.get(name) : null;
    }

    public boolean contains(String name) {
        return name != null && providersByName.containsKey(name);
    }

    /** Tool names in registration order. */
    public Set<String> toolNames() {
        return providersByName.keySet();
    }

    public Collection<ToolProvider> providers() {
        return providersByName.values();
    }

    public int size() {
        return providersByName.size();
    }
}
