package com.quill.tool.wordcount;

import com.quill.annotations.QuillTool;
import com.quill.annotations.QuillToolParam;
import com.quill.tools.Tool;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts the words of a text and, when a target is given, reports whether the count is within
 * {@link #TOLERANCE} of it.
 */
@QuillTool(name = WordCountToolProvider.TOOL_NAME,
        description = "Count words in a draft and compare against a target length",
        parameters = {
                @QuillToolParam(name = "text", required = true),
                @QuillToolParam(name = "target_word_count", type = "INTEGER")
        })
public final class WordCountTool implements Tool {

    static final double TOLERANCE = 0.10;

    @Override
    public Map<String, Object> execute(Map<String, Object> args) {
        Object text = args.get("text");
        int count = countWords(text != null ? text.toString() : "");
        Integer target = parseTarget(args.get("target_word_count"));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("word_count", count);
        if (target != null) {
            out.put("target_word_count", target);
            out.put("within_target", Math.abs(count - target) <= target * TOLERANCE);
            out.put("delta", count - target);
        }
        return out;
    }

    static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    /**
     * @throws IllegalArgumentException if the target is not a positive whole number
     */
    static Integer parseTarget(Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        int target;
        if (value instanceof Number) {
            target = ((Number) value).intValue();
        } else {
            try {
                target = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("target_word_count is not a number: " + value, e);
            }
        }
        if (target <= 0) {
            throw new IllegalArgumentException("target_word_count must be positive: " + target);
        }
        return target;
    }
}
