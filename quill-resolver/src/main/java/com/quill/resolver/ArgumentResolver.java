package com.quill.resolver;

import com.quill.tools.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fills tool parameters from layered sources. For each declared parameter the first match wins:
 * <ol>
 *   <li>explicit args (all of them pass through, declared or not)</li>
 *   <li>context key, then flattened context key</li>
 *   <li>semantic-role heuristics (non-blank values only)</li>
 *   <li>static defaults</li>
 *   <li>aliases against explicit args, context and flattened context</li>
 *   <li>the user's utterance, for the first still-missing required parameter named in the
 *       tables' user-input fallback list</li>
 * </ol>
 * A map-valued {@code profile} that did not come from explicit args is rendered with
 * {@link ProfileFormatter}.
 * Stateless and thread-safe; the same inputs always produce an equal {@link Resolution}.
 */
public final class ArgumentResolver {

    private static final Logger log = LoggerFactory.getLogger(ArgumentResolver.class);

    static final String SOURCE_EXPLICIT = "explicit";
    static final String SOURCE_CONTEXT = "context";
    static final String SOURCE_CONTEXT_FLAT = "context_flat";
    static final String SOURCE_DEFAULT = "default";
    static final String SOURCE_USER_INPUT_FALLBACK = "user_input_fallback";
    static final String PROFILE_PARAM = "profile";

    private final ToolCatalog catalog;
    private final ResolverTables tables;
    private final boolean showResolvedArgs;

    public ArgumentResolver(ToolCatalog catalog, ResolverTables tables) {
        this(catalog, tables, false);
    }

    public ArgumentResolver(ToolCatalog catalog, ResolverTables tables, boolean showResolvedArgs) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.tables = Objects.requireNonNull(tables, "tables");
        this.showResolvedArgs = showResolvedArgs;
    }

    /**
     * Resolves arguments for {@code toolName}.
     *
     * @param explicitArgs args supplied by the plan step; may be null
     * @param context      working context; may be null
     * @param userInput    the user's utterance; may be null
     * @throws MissingRequiredArgumentException if a required parameter is unresolved after every stage
     */
    public Resolution resolve(String toolName, Map<String, ?> explicitArgs, Map<String, ?> context, String userInput) {
        Objects.requireNonNull(toolName, "toolName");
        Map<String, ?> explicit = explicitArgs != null ? explicitArgs : Map.of();
        Map<String, ?> ctx = context != null ? context : Map.of();
        Map<String, Object> flat = ContextFlattener.flatten(ctx);

        Set<String> required = catalog.requiredArgs(toolName);
        Set<String> declared = new LinkedHashSet<>(required);
        declared.addAll(catalog.optionalArgs(toolName));

        Map<String, Object> resolved = new LinkedHashMap<>();
        Map<String, String> sources = new LinkedHashMap<>();

        for (Map.Entry<String, ?> e : explicit.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                resolved.put(e.getKey(), e.getValue());
                sources.put(e.getKey(), SOURCE_EXPLICIT);
            }
        }

        for (String param : declared) {
            if (resolved.containsKey(param)) continue;
            Object direct = ctx.get(param);
            if (direct != null) {
                put(resolved, sources, param, direct, SOURCE_CONTEXT);
            } else if (flat.get(param) != null) {
                put(resolved, sources, param, flat.get(param), SOURCE_CONTEXT_FLAT);
            }
        }

        for (String param : declared) {
            if (resolved.containsKey(param)) continue;
            resolveByRole(param, ctx, flat, userInput, resolved, sources);
        }

        for (String param : declared) {
            if (resolved.containsKey(param)) continue;
            Object value = tables.getDefaults().get(param);
            if (value != null) {
                put(resolved, sources, param, value, SOURCE_DEFAULT);
            }
        }

        for (String param : declared) {
            if (resolved.containsKey(param)) continue;
            resolveByAlias(param, explicit, ctx, flat, resolved, sources);
        }

        fillFromUserInput(required, userInput, resolved, sources);
        formatProfile(resolved, sources);

        List<String> missing = new ArrayList<>();
        for (String param : required) {
            if (!resolved.containsKey(param)) {
                missing.add(param);
            }
        }
        if (!missing.isEmpty()) {
            log.debug("Argument resolution failed | tool={} | missing={} | resolved={}", toolName, missing, sources);
            throw new MissingRequiredArgumentException(toolName, missing);
        }

        if (showResolvedArgs) {
            log.info("Resolved args | tool={} | args={} | sources={}", toolName, resolved, sources);
        } else if (log.isDebugEnabled()) {
            log.debug("Resolved args | tool={} | sources={}", toolName, sources);
        }
        return new Resolution(toolName, resolved, sources);
    }

    private void resolveByRole(String param, Map<String, ?> ctx, Map<String, Object> flat, String userInput,
                               Map<String, Object> resolved, Map<String, String> sources) {
        for (SemanticRole role : tables.rolesFor(param)) {
            for (String candidate : role.candidates()) {
                Object value;
                if (SemanticRole.USER_INPUT.equals(candidate)) {
                    value = userInput;
                } else {
                    value = ctx.get(candidate);
                    if (!hasContent(value)) {
                        value = flat.get(candidate);
                    }
                }
                if (hasContent(value)) {
                    put(resolved, sources, param, value, "heuristic:" + role.name() + ":" + candidate);
                    return;
                }
            }
        }
    }

    private void resolveByAlias(String param, Map<String, ?> explicit, Map<String, ?> ctx, Map<String, Object> flat,
                                Map<String, Object> resolved, Map<String, String> sources) {
        for (String alias : tables.aliasesFor(param)) {
            Object value = explicit.get(alias);
            if (value == null) value = ctx.get(alias);
            if (value == null) value = flat.get(alias);
            if (value != null) {
                put(resolved, sources, param, value, "alias:" + alias);
                return;
            }
        }
    }

    private void fillFromUserInput(Set<String> required, String userInput,
                                   Map<String, Object> resolved, Map<String, String> sources) {
        if (!hasContent(userInput)) {
            return;
        }
        for (String param : required) {
            if (!resolved.containsKey(param) && tables.getUserInputFallback().contains(param)) {
                put(resolved, sources, param, userInput, SOURCE_USER_INPUT_FALLBACK);
                return;
            }
        }
    }

    private static void formatProfile(Map<String, Object> resolved, Map<String, String> sources) {
        Object profile = resolved.get(PROFILE_PARAM);
        if (profile instanceof Map && !SOURCE_EXPLICIT.equals(sources.get(PROFILE_PARAM))) {
            resolved.put(PROFILE_PARAM, ProfileFormatter.summarize((Map<?, ?>) profile));
        }
    }

    private static void put(Map<String, Object> resolved, Map<String, String> sources,
                            String param, Object value, String source) {
        resolved.put(param, value);
        sources.put(param, source);
    }

    /** Non-null, and not a blank string, empty map or empty collection. */
    static boolean hasContent(Object value) {
        if (value == null) return false;
        if (value instanceof CharSequence) return !value.toString().isBlank();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        return true;
    }

    public ToolCatalog getCatalog() {
        return catalog;
    }

    public ResolverTables getTables() {
        return tables;
    }
}
