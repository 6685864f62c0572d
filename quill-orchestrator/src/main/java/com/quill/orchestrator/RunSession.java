package com.quill.orchestrator;

import com.quill.config.QuillConfig;
import com.quill.ledger.ExecutionRecord;
import com.quill.ledger.History;
import com.quill.planner.Decision;
import com.quill.planner.DecisionKind;
import com.quill.planner.PlanStep;
import com.quill.planner.ReplanningOracle;
import com.quill.planner.StepOrigin;
import com.quill.quality.DraftTextExtractor;
import com.quill.resolver.MissingRequiredArgumentException;
import com.quill.resolver.Resolution;
import com.quill.tools.ToolError;
import com.quill.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of a single run: plan queue, history, working context and counters.
 * Created per {@link Orchestrator#run} call and used from one thread.
 */
final class RunSession {

    private static final Logger log = LoggerFactory.getLogger(RunSession.class);

    static final String ERROR_MISSING_ARGUMENT = "MissingRequiredArgument";
    static final String QUALITY_SCORE_KEY = "quality_score";
    static final String TARGET_QUALITY_ARG = "target_quality";

    private final Orchestrator orchestrator;
    private final QuillConfig config;
    private final String runId;
    private final String userInput;
    private final WorkingContext ctx;
    private final Instant deadline;

    private final Deque<PlanStep> queue = new ArrayDeque<>();
    private final History history = new History();
    private int executed;
    private int corrections;
    private boolean clarificationInserted;
    private long startMillis;

    RunSession(Orchestrator orchestrator, String runId, String userInput, WorkingContext ctx, Instant deadline) {
        this.orchestrator = orchestrator;
        this.config = orchestrator.config();
        this.runId = runId;
        this.userInput = userInput != null ? userInput : "";
        this.ctx = ctx;
        this.deadline = deadline;
    }

    RunResult execute(Decision planHint) {
        startMillis = orchestrator.clock().millis();
        orchestrator.ledger().runStarted(runId, userInput, ctx.snapshot(), startMillis);

        List<PlanStep> initial = orchestrator.translator().translate(planHint, StepOrigin.PLANNED);
        if (initial.isEmpty()) {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("prompt", userInput);
            initial = List.of(new PlanStep(config.getConversationalTool(), args,
                    "no tools planned", 1.0, StepOrigin.CONVERSATIONAL_FALLBACK));
            log.info("Empty plan; falling back to conversational tool | runId={} | tool={}",
                    runId, config.getConversationalTool());
        }
        queue.addAll(initial);
        log.info("Run started | runId={} | plannedSteps={} | maxSteps={}", runId, initial.size(), config.getMaxSteps());

        while (true) {
            if (executed > 0 && deadlinePassed()) {
                return finish(RunState.ABORTED, TerminationReason.DEADLINE);
            }
            PlanStep step = queue.pollFirst();
            if (step == null) {
                return finish(RunState.DONE, TerminationReason.COMPLETED);
            }
            Resolution resolution;
            try {
                resolution = orchestrator.resolver().resolve(step.toolName(), step.suppliedArgs(), ctx.view(), userInput);
            } catch (MissingRequiredArgumentException e) {
                if (!clarificationInserted) {
                    insertClarification(step, e);
                    continue;
                }
                log.warn("Required args still missing after clarification; aborting | runId={} | tool={} | missing={}",
                        runId, step.toolName(), e.missingArguments());
                ExecutionRecord record = history.appendFailure(step.toolName(), step.suppliedArgs(),
                        new ToolError(ERROR_MISSING_ARGUMENT, e.getMessage()), Duration.ZERO, step.origin(), 0);
                orchestrator.ledger().stepRecorded(runId, record);
                orchestrator.metrics().stepExecuted(step.toolName(), "missing_args");
                return finish(RunState.ABORTED, TerminationReason.MISSING_ARGUMENTS);
            }

            StepOutcome outcome = orchestrator.stepExecutor().execute(step.toolName(), resolution.args());
            ExecutionRecord record = append(step, resolution, outcome);

            if (record.isSuccess() && isGated(step)) {
                applyQualityGate(record);
            }

            if (executed >= config.getMaxSteps()) {
                log.info("Step budget reached | runId={} | executed={} | maxSteps={}", runId, executed, config.getMaxSteps());
                return finish(RunState.DONE, TerminationReason.STEP_BUDGET);
            }

            List<PlanStep> proposals = replan();
            Optional<String> repeated = proposals.stream()
                    .map(PlanStep::toolName)
                    .filter(history::containsTool)
                    .findFirst();
            if (repeated.isPresent()) {
                log.info("Oracle re-proposed an executed tool; stopping | runId={} | tool={}", runId, repeated.get());
                return finish(RunState.DONE, TerminationReason.DUPLICATE_TOOL);
            }
            enqueueProposals(proposals);
        }
    }

    private void insertClarification(PlanStep failed, MissingRequiredArgumentException e) {
        clarificationInserted = true;
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("question", e.getMessage().replace("Missing required args for", "I need these details for"));
        args.put("user_input", userInput);
        args.put("missing", new ArrayList<>(e.missingArguments()));
        queue.addFirst(failed);
        queue.addFirst(new PlanStep(config.getClarificationTool(), args,
                "missing required arguments for " + failed.toolName(), 1.0, StepOrigin.CLARIFICATION));
        orchestrator.metrics().clarification();
        log.info("Inserted clarification step | runId={} | tool={} | missing={}",
                runId, failed.toolName(), e.missingArguments());
    }

    private ExecutionRecord append(PlanStep step, Resolution resolution, StepOutcome outcome) {
        ToolResult result = outcome.result();
        ExecutionRecord record;
        if (result.isSuccess()) {
            record = history.appendSuccess(step.toolName(), resolution.args(), result.value(),
                    outcome.duration(), step.origin(), outcome.attempts());
            ctx.merge(step.toolName(), result.value());
        } else {
            record = history.appendFailure(step.toolName(), resolution.args(), result.error(),
                    outcome.duration(), step.origin(), outcome.attempts());
            ctx.merge(step.toolName(), null);
        }
        executed++;
        orchestrator.ledger().stepRecorded(runId, record);
        orchestrator.metrics().stepExecuted(step.toolName(), record.isSuccess() ? "success" : "error");
        log.info("Step executed | runId={} | seq={} | tool={} | origin={} | success={} | attempts={} | durationMs={}",
                runId, record.sequence(), step.toolName(), step.origin(), record.isSuccess(),
                outcome.attempts(), outcome.duration().toMillis());
        if (!record.isSuccess()) {
            log.warn("Step failed after retries; continuing | runId={} | tool={} | error={}",
                    runId, step.toolName(), record.error());
        }
        return record;
    }

    /** Clarification and conversational steps are never scored, however they were queued. */
    private boolean isGated(PlanStep step) {
        if (step.origin() == StepOrigin.CLARIFICATION || step.origin() == StepOrigin.CONVERSATIONAL_FALLBACK) {
            return false;
        }
        return !step.toolName().equals(config.getClarificationTool())
                && !step.toolName().equals(config.getConversationalTool());
    }

    private void applyQualityGate(ExecutionRecord record) {
        Optional<String> text = DraftTextExtractor.extract(record.value());
        if (text.isEmpty()) {
            return;
        }
        double score = orchestrator.qualityGate().score(text.get());
        ctx.put(QUALITY_SCORE_KEY, score);
        if (!orchestrator.qualityGate().shouldCorrect(score, corrections)) {
            log.debug("Quality accepted | runId={} | tool={} | score={}", runId, record.toolName(), score);
            return;
        }
        corrections++;
        String tool = improvementTool();
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TARGET_QUALITY_ARG, orchestrator.qualityGate().getMinQualityScore());
        queue.addLast(new PlanStep(tool, args, "quality " + score + " below threshold", 1.0,
                StepOrigin.QUALITY_CORRECTION));
        orchestrator.metrics().qualityCorrection();
        log.info("Quality below threshold; queued correction | runId={} | tool={} | score={} | min={} | correction={}",
                runId, tool, score, orchestrator.qualityGate().getMinQualityScore(), corrections);
    }

    private String improvementTool() {
        Decision decision = consultOracle(config.getQualityImprovementPrompt());
        if (decision != null) {
            List<String> proposed = decision.proposedTools();
            if (!proposed.isEmpty() && orchestrator.catalog().isRegistered(proposed.get(0))) {
                return proposed.get(0);
            }
        }
        return config.getImprovementTool();
    }

    private List<PlanStep> replan() {
        Decision decision = consultOracle(userInput);
        if (decision == null) {
            return List.of();
        }
        return orchestrator.translator().translate(decision, StepOrigin.REPLANNED);
    }

    /** Null when there is no oracle, it failed, or its answer was unparseable. */
    private Decision consultOracle(String input) {
        ReplanningOracle oracle = orchestrator.oracle();
        if (oracle == null) {
            return null;
        }
        try {
            Decision decision = oracle.decideNext(input, ctx.view());
            if (decision == null || decision.kind() == DecisionKind.UNPARSEABLE) {
                log.warn("Oracle returned no usable decision; treating as no further work | runId={} | rationale={}",
                        runId, decision != null ? decision.rationale() : null);
                return null;
            }
            return decision;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Oracle call interrupted; treating as no further work | runId={}", runId);
            return null;
        } catch (Exception e) {
            log.warn("Oracle failed; treating as no further work | runId={} | error={}", runId, e.toString());
            return null;
        }
    }

    private void enqueueProposals(List<PlanStep> proposals) {
        Set<String> queued = new HashSet<>();
        for (PlanStep s : queue) {
            queued.add(s.toolName());
        }
        for (PlanStep s : proposals) {
            if (queued.add(s.toolName())) {
                queue.addLast(s);
            }
        }
    }

    private boolean deadlinePassed() {
        if (deadline == null) {
            return false;
        }
        Instant now = orchestrator.clock().instant();
        if (now.isBefore(deadline)) {
            return false;
        }
        log.warn("Deadline passed; aborting | runId={} | deadline={} | executed={}", runId, deadline, executed);
        return true;
    }

    private RunResult finish(RunState terminal, TerminationReason reason) {
        long endMillis = orchestrator.clock().millis();
        orchestrator.ledger().runEnded(runId, endMillis, terminal.name(), reason.name(), history.size(),
                endMillis - startMillis);
        orchestrator.metrics().runEnded(terminal, reason);
        log.info("Run finished | runId={} | state={} | reason={} | steps={} | corrections={}",
                runId, terminal, reason, history.size(), corrections);
        return new RunResult(runId, history.records(), terminal, reason, ctx.snapshot());
    }
}
