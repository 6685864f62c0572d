package com.quill.orchestrator;

/** Why a run stopped. */
public enum TerminationReason {
    /** Queue drained and the oracle proposed nothing new. */
    COMPLETED,
    /** Executed-step count reached the configured maximum. */
    STEP_BUDGET,
    /** Oracle re-proposed a tool that already ran. */
    DUPLICATE_TOOL,
    /** Required arguments were still missing after one clarification. */
    MISSING_ARGUMENTS,
    /** Caller deadline passed between steps. */
    DEADLINE
}
