package com.quill.planner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One proposed tool invocation.
 *
 * @param toolName     tool to run
 * @param suppliedArgs explicit arguments for the resolver; never null
 * @param rationale    why the step was proposed
 * @param confidence   clamped to [0, 1]
 * @param origin       why the step is in the plan
 */
public record PlanStep(String toolName, Map<String, Object> suppliedArgs, String rationale, double confidence,
                       StepOrigin origin) {

    public PlanStep {
        Objects.requireNonNull(toolName, "toolName");
        suppliedArgs = suppliedArgs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(suppliedArgs)) : Map.of();
        rationale = rationale != null ? rationale : "";
        confidence = Decision.clamp(confidence);
        origin = origin != null ? origin : StepOrigin.PLANNED;
    }

    public static PlanStep of(String toolName, Map<String, Object> suppliedArgs, StepOrigin origin) {
        return new PlanStep(toolName, suppliedArgs, "", 1.0, origin);
    }
}
