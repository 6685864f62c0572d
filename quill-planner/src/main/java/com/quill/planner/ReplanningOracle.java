package com.quill.planner;

import java.util.Map;

/**
 * Decision-making collaborator consulted after each executed step.
 */
@FunctionalInterface
public interface ReplanningOracle {

    /**
     * Proposes what to do next.
     *
     * @param userInput      the user's utterance (or a fixed prompt such as "Improve quality")
     * @param workingContext read-only view of the run's working context
     * @return the next decision; callers treat exceptions and {@link DecisionKind#UNPARSEABLE} as "no further work"
     */
    Decision decideNext(String userInput, Map<String, Object> workingContext) throws Exception;
}
