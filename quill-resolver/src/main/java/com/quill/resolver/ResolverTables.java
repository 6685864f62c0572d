package com.quill.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned lookup data for the {@link ArgumentResolver}: semantic roles, static defaults and
 * parameter aliases. Immutable once built.
 * <p>
 * JSON layout:
 * <pre>
 * {"version": "1.0",
 *  "roles": [{"role": "story", "params": ["story"], "candidates": ["story", "brainstorm_specific.best_idea"]}],
 *  "defaults": {"word_limit": 650},
 *  "aliases": {"essay_prompt": ["prompt", "question"]},
 *  "userInputFallback": ["text", "story"]}
 * </pre>
 * {@code userInputFallback} names the text-like parameters the user's utterance may fill as a
 * last resort.
 */
public final class ResolverTables {

    /** Classpath location of the bundled tables. */
    public static final String DEFAULT_RESOURCE = "quill/resolver-tables.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String version;
    private final List<SemanticRole> roles;
    private final Map<String, Object> defaults;
    private final Map<String, List<String>> aliases;
    private final List<String> userInputFallback;

    public ResolverTables(String version, List<SemanticRole> roles, Map<String, ?> defaults,
                          Map<String, List<String>> aliases) {
        this(version, roles, defaults, aliases, List.of());
    }

    public ResolverTables(String version, List<SemanticRole> roles, Map<String, ?> defaults,
                          Map<String, List<String>> aliases, List<String> userInputFallback) {
        this.version = Objects.requireNonNull(version, "version");
        this.roles = roles != null ? List.copyOf(roles) : List.of();
        this.defaults = defaults != null ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults)) : Map.of();
        Map<String, List<String>> aliasCopy = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((k, v) -> aliasCopy.put(k, v != null ? List.copyOf(v) : List.of()));
        }
        this.aliases = Collections.unmodifiableMap(aliasCopy);
        this.userInputFallback = userInputFallback != null ? List.copyOf(userInputFallback) : List.of();
    }

    public static ResolverTables empty() {
        return new ResolverTables("0", List.of(), Map.of(), Map.of());
    }

    /**
     * Loads {@link #DEFAULT_RESOURCE} from the class path.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static ResolverTables loadDefault() {
        try (InputStream in = ResolverTables.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Resolver tables resource not found: " + DEFAULT_RESOURCE);
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read resolver tables: " + DEFAULT_RESOURCE, e);
        }
    }

    public static ResolverTables fromJson(InputStream in) {
        try {
            return fromJson(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid resolver tables JSON", e);
        }
    }

    public static ResolverTables fromJson(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid resolver tables JSON", e);
        }
    }

    private static ResolverTables fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Resolver tables must be a JSON object");
        }
        String version = root.path("version").asText("");
        if (version.isBlank()) {
            throw new IllegalArgumentException("Resolver tables must declare a version");
        }
        List<SemanticRole> roles = new ArrayList<>();
        for (JsonNode role : root.path("roles")) {
            String name = role.path("role").asText("");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Role entry without a name: " + role);
            }
            roles.add(new SemanticRole(name, textList(role.path("params")), textList(role.path("candidates"))));
        }
        Map<String, Object> defaults = new LinkedHashMap<>();
        JsonNode defaultsNode = root.path("defaults");
        if (defaultsNode.isObject()) {
            Map<String, Object> converted = MAPPER.convertValue(defaultsNode, MAPPER.getTypeFactory()
                    .constructMapType(LinkedHashMap.class, String.class, Object.class));
            defaults.putAll(converted);
        }
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("aliases").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            aliases.put(e.getKey(), textList(e.getValue()));
        }
        return new ResolverTables(version, roles, defaults, aliases, textList(root.path("userInputFallback")));
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode n : node) {
                if (n.isTextual() && !n.asText().isBlank()) {
                    out.add(n.asText());
                }
            }
        }
        return out;
    }

    public String getVersion() {
        return version;
    }

    public List<SemanticRole> getRoles() {
        return roles;
    }

    /** Roles that list {@code param}, in table order. */
    public List<SemanticRole> rolesFor(String param) {
        List<SemanticRole> out = new ArrayList<>();
        for (SemanticRole role : roles) {
            if (role.fills(param)) {
                out.add(role);
            }
        }
        return out;
    }

    public Map<String, Object> getDefaults() {
        return defaults;
    }

    public Map<String, List<String>> getAliases() {
        return aliases;
    }

    public List<String> aliasesFor(String param) {
        return aliases.getOrDefault(param, List.of());
    }

    public List<String> getUserInputFallback() {
        return userInputFallback;
    }
}
