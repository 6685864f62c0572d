package com.quill.planner;

/**
 * Why a {@link PlanStep} is in the plan.
 */
public enum StepOrigin {
    PLANNED,
    CONVERSATIONAL_FALLBACK,
    CLARIFICATION,
    QUALITY_CORRECTION,
    REPLANNED
}
