package com.quill.orchestrator;

/**
 * Lifecycle of one run. PENDING and RUNNING are transient; a finished run is DONE or ABORTED.
 */
public enum RunState {
    PENDING,
    RUNNING,
    AWAITING_REPLAN,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
