package com.quill.quality;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the text the quality gate should score out of a tool result: the result itself when it is
 * a string, or the first non-blank string under {@link #TEXT_KEYS} when it is a map.
 */
public final class DraftTextExtractor {

    public static final List<String> TEXT_KEYS = List.of("draft", "revised_draft", "final_draft", "text");

    private DraftTextExtractor() {
    }

    public static Optional<String> extract(Object result) {
        if (result instanceof CharSequence) {
            String s = result.toString();
            return s.isBlank() ? Optional.empty() : Optional.of(s);
        }
        if (result instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) result;
            for (String key : TEXT_KEYS) {
                Object v = map.get(key);
                if (v instanceof CharSequence && !v.toString().isBlank()) {
                    return Optional.of(v.toString());
                }
            }
        }
        return Optional.empty();
    }
}
