package com.quill.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reasoning decision: which tool or tools to run next, with shared arguments.
 *
 * @param kind       decision kind
 * @param toolName   tool for {@link DecisionKind#EXECUTE_ONE}; may be null
 * @param sequence   ordered tools for {@link DecisionKind#RUN_SEQUENCE}; never null
 * @param args       arguments shared by every resulting step; never null
 * @param rationale  short reasoning text (for {@link DecisionKind#UNPARSEABLE}, the parse failure)
 * @param confidence confidence clamped to [0, 1]
 */
public record Decision(DecisionKind kind, String toolName, List<String> sequence, Map<String, Object> args,
                       String rationale, double confidence) {

    public static final double DEFAULT_CONFIDENCE = 0.8;

    public Decision {
        Objects.requireNonNull(kind, "kind");
        sequence = sequence != null ? Collections.unmodifiableList(new ArrayList<>(sequence)) : List.of();
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
        rationale = rationale != null ? rationale : "";
        confidence = clamp(confidence);
    }

    public static Decision executeOne(String toolName, Map<String, Object> args) {
        return new Decision(DecisionKind.EXECUTE_ONE, toolName, List.of(), args, "", DEFAULT_CONFIDENCE);
    }

    public static Decision runSequence(List<String> tools, Map<String, Object> args) {
        return new Decision(DecisionKind.RUN_SEQUENCE, null, tools, args, "", DEFAULT_CONFIDENCE);
    }

    public static Decision conversational(String rationale) {
        return new Decision(DecisionKind.CONVERSATIONAL_FALLBACK, null, List.of(), Map.of(), rationale, DEFAULT_CONFIDENCE);
    }

    public static Decision unparseable(String reason) {
        return new Decision(DecisionKind.UNPARSEABLE, null, List.of(), Map.of(), reason, 0.0);
    }

    /** Non-blank tool names this decision proposes, in order. Empty for fallback and unparseable kinds. */
    public List<String> proposedTools() {
        List<String> out = new ArrayList<>();
        if (kind == DecisionKind.EXECUTE_ONE) {
            if (toolName != null && !toolName.isBlank()) out.add(toolName.trim());
        } else if (kind == DecisionKind.RUN_SEQUENCE) {
            for (String t : sequence) {
                if (t != null && !t.isBlank()) out.add(t.trim());
            }
        }
        return out;
    }

    static double clamp(double confidence) {
        if (Double.isNaN(confidence)) return 0.0;
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
