package com.quill.quality;

/**
 * External quality-scoring collaborator (e.g. a scoring model).
 */
@FunctionalInterface
public interface QualityEvaluator {

    /**
     * @return score on a 0-10 scale; out-of-range values are clamped by the gate
     * @throws Exception on failure; the gate falls back to {@link HeuristicScorer}
     */
    double score(String text) throws Exception;
}
