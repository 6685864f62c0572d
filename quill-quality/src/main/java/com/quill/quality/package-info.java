/**
 * Quality gate: scores draft text with an external {@link com.quill.quality.QualityEvaluator}
 * or the local {@link com.quill.quality.HeuristicScorer}, and decides when a corrective step is due.
 */
package com.quill.quality;
