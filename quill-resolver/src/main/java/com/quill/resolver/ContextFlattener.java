package com.quill.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens nested context maps so nested values can be looked up by path. Every nested entry is
 * reachable under a dotted key ({@code draft.text}) and an underscored key ({@code draft_text});
 * top-level entries keep their own key. On a key collision the first entry in iteration order wins.
 */
public final class ContextFlattener {

    private static final int MAX_DEPTH = 16;

    private ContextFlattener() {
    }

    public static Map<String, Object> flatten(Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        walk(context, "", '.', flat, 0);
        walk(context, "", '_', flat, 0);
        return Collections.unmodifiableMap(flat);
    }

    private static void walk(Map<?, ?> map, String prefix, char separator, Map<String, Object> out, int depth) {
        if (depth > MAX_DEPTH) {
            return;
        }
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                continue;
            }
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + separator + e.getKey();
            out.putIfAbsent(key, e.getValue());
            if (e.getValue() instanceof Map) {
                walk((Map<?, ?>) e.getValue(), key, separator, out, depth + 1);
            }
        }
    }
}
