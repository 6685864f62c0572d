package com.quill.planner;

import com.quill.tools.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Decision} into an ordered list of {@link PlanStep}s. Never throws: fallback,
 * unparseable and null decisions yield an empty plan, which the orchestrator runs as one
 * conversational step.
 */
public final class PlanTranslator {

    private static final Logger log = LoggerFactory.getLogger(PlanTranslator.class);

    private final ToolCatalog catalog;

    /** Translator that keeps every proposed tool name. */
    public PlanTranslator() {
        this(null);
    }

    /** Translator that drops tool names unknown to {@code catalog}; null keeps every name. */
    public PlanTranslator(ToolCatalog catalog) {
        this.catalog = catalog;
    }

    public List<PlanStep> translate(Decision decision) {
        return translate(decision, StepOrigin.PLANNED);
    }

    public List<PlanStep> translate(Decision decision, StepOrigin origin) {
        List<PlanStep> steps = new ArrayList<>();
        if (decision == null) {
            return steps;
        }
        for (String tool : decision.proposedTools()) {
            if (catalog != null && !catalog.isRegistered(tool)) {
                log.warn("Dropping unknown tool from plan | tool={} | kind={}", tool, decision.kind());
                continue;
            }
            steps.add(new PlanStep(tool, decision.args(), decision.rationale(), decision.confidence(), origin));
        }
        log.debug("Translated decision | kind={} | steps={}", decision.kind(), steps.size());
        return steps;
    }
}
