package com.quill.planner;

/**
 * Kind of a re-planning {@link Decision}.
 */
public enum DecisionKind {

    /** Run one named tool. */
    EXECUTE_ONE,

    /** Run an ordered list of tools. */
    RUN_SEQUENCE,

    /** No tool fits; answer conversationally. */
    CONVERSATIONAL_FALLBACK,

    /** The oracle's output could not be read; treated as "no further work". */
    UNPARSEABLE
}
