package com.quill.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.quill.planner.PlannerContract.FIELD_ACTION;
import static com.quill.planner.PlannerContract.FIELD_CONFIDENCE;
import static com.quill.planner.PlannerContract.FIELD_REASONING;
import static com.quill.planner.PlannerContract.FIELD_SEQUENCE;
import static com.quill.planner.PlannerContract.FIELD_TOOL_ARGS;
import static com.quill.planner.PlannerContract.FIELD_TOOL_NAME;

/**
 * Parses oracle output text into a {@link Decision}. Handles the usual model-output quirks:
 * Markdown code fences, prose around the object, and a JSON string that wraps the object.
 * Never throws; anything unreadable becomes {@link DecisionKind#UNPARSEABLE} with the reason.
 */
public final class JsonDecisionParser {

    private static final Logger log = LoggerFactory.getLogger(JsonDecisionParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int MAX_LOG = 600;

    public Decision parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Decision.unparseable("empty oracle output");
        }
        String trimmed = stripCodeFence(rawText.trim());
        JsonNode root = parseObject(trimmed);
        if (root == null) {
            if (log.isWarnEnabled()) {
                String snippet = trimmed.length() > MAX_LOG
                        ? trimmed.substring(0, MAX_LOG) + "...[truncated length=" + trimmed.length() + "]" : trimmed;
                log.warn("Oracle output is not a JSON object | raw snippet=[{}]", snippet);
            }
            return Decision.unparseable("oracle output is not a JSON object");
        }
        return toDecision(root);
    }

    private Decision toDecision(JsonNode root) {
        String toolName = textOrNull(root.get(FIELD_TOOL_NAME));
        List<String> sequence = new ArrayList<>();
        JsonNode seqNode = root.get(FIELD_SEQUENCE);
        if (seqNode != null && seqNode.isArray()) {
            for (JsonNode n : seqNode) {
                String t = textOrNull(n);
                if (t != null) sequence.add(t);
            }
        }
        Map<String, Object> args = Map.of();
        JsonNode argsNode = root.get(FIELD_TOOL_ARGS);
        if (argsNode != null && argsNode.isObject()) {
            args = MAPPER.convertValue(argsNode, MAP_TYPE);
        }
        String reasoning = textOrNull(root.get(FIELD_REASONING));
        double confidence = Decision.DEFAULT_CONFIDENCE;
        JsonNode confNode = root.get(FIELD_CONFIDENCE);
        if (confNode != null && confNode.isNumber()) {
            confidence = confNode.asDouble();
        } else if (confNode != null && confNode.isTextual()) {
            try {
                confidence = Double.parseDouble(confNode.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric confidence: {}", confNode.asText());
            }
        }

        DecisionKind kind = kindOf(textOrNull(root.get(FIELD_ACTION)), toolName, sequence);
        if (kind == null) {
            return Decision.unparseable("unknown action: " + root.get(FIELD_ACTION));
        }
        return new Decision(kind, toolName, sequence, args, reasoning, confidence);
    }

    /** Maps the action string (or, when absent, the populated fields) to a kind; null if unknown. */
    static DecisionKind kindOf(String action, String toolName, List<String> sequence) {
        if (action == null) {
            if (!sequence.isEmpty()) return DecisionKind.RUN_SEQUENCE;
            if (toolName != null) return DecisionKind.EXECUTE_ONE;
            return DecisionKind.CONVERSATIONAL_FALLBACK;
        }
        switch (action.trim().toLowerCase(Locale.ROOT)) {
            case PlannerContract.ACTION_TOOL_EXECUTION:
            case "execute_one":
                return DecisionKind.EXECUTE_ONE;
            case PlannerContract.ACTION_TOOL_SEQUENCE:
            case "run_sequence":
                return DecisionKind.RUN_SEQUENCE;
            case PlannerContract.ACTION_CONVERSATION:
            case "conversational_fallback":
                return DecisionKind.CONVERSATIONAL_FALLBACK;
            default:
                return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        String s = node.asText();
        return s == null || s.isBlank() || "null".equals(s) ? null : s.trim();
    }

    /** Returns the fenced body of a Markdown code block, or the input unchanged. */
    static String stripCodeFence(String text) {
        int open = text.indexOf("```");
        if (open < 0) return text;
        int bodyStart = text.indexOf('\n', open);
        if (bodyStart < 0) return text;
        int close = text.indexOf("```", bodyStart);
        if (close < 0) return text.substring(bodyStart + 1).trim();
        return text.substring(bodyStart + 1, close).trim();
    }

    /** Parses an object directly, through one level of string wrapping, or by extracting the first balanced object. */
    private JsonNode parseObject(String text) {
        JsonNode node = readTree(text);
        if (node != null && node.isTextual()) {
            node = readTree(node.asText().trim());
        }
        if (node != null && node.isObject()) {
            return node;
        }
        String inner = extractFirstObject(text);
        if (inner == null) return null;
        node = readTree(inner);
        return node != null && node.isObject() ? node : null;
    }

    private static JsonNode readTree(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Decision JSON parse failed: {}", e.getOriginalMessage());
            return null;
        }
    }

    /** Bracket-depth scan for the first complete {@code {...}} span, skipping braces inside strings. */
    static String extractFirstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) return null;
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escape) {
                escape = false;
                continue;
            }
            if (inString) {
                if (c == '\\') escape = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}
