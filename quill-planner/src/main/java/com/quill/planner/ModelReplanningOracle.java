package com.quill.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ReplanningOracle} backed by a text-completion {@link OracleModel}: fills the prompt
 * template, calls the model and parses its reply with {@link JsonDecisionParser}.
 * Model exceptions propagate to the caller.
 */
public final class ModelReplanningOracle implements ReplanningOracle {

    private static final Logger log = LoggerFactory.getLogger(ModelReplanningOracle.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern PLACEHOLDER = Pattern.compile(
            Pattern.quote(PlannerContract.TOOLS_PLACEHOLDER)
                    + "|" + Pattern.quote(PlannerContract.CONTEXT_PLACEHOLDER)
                    + "|" + Pattern.quote(PlannerContract.USER_INPUT_PLACEHOLDER));

    private final OracleModel model;
    private final String promptTemplate;
    private final List<String> toolNames;
    private final JsonDecisionParser parser = new JsonDecisionParser();

    public ModelReplanningOracle(OracleModel model, Collection<String> toolNames) {
        this(model, PlannerContract.DEFAULT_PROMPT_TEMPLATE, toolNames);
    }

    public ModelReplanningOracle(OracleModel model, String promptTemplate, Collection<String> toolNames) {
        this.model = Objects.requireNonNull(model, "model");
        this.promptTemplate = Objects.requireNonNull(promptTemplate, "promptTemplate");
        this.toolNames = toolNames != null ? List.copyOf(toolNames) : List.of();
    }

    @Override
    public Decision decideNext(String userInput, Map<String, Object> workingContext) throws Exception {
        String prompt = buildPrompt(userInput, workingContext);
        String raw = model.complete(prompt);
        Decision decision = parser.parse(raw);
        log.debug("Oracle decision | kind={} | tools={} | confidence={}",
                decision.kind(), decision.proposedTools(), decision.confidence());
        return decision;
    }

    /** Placeholders are substituted in one pass over the template; substituted values are never rescanned. */
    String buildPrompt(String userInput, Map<String, Object> workingContext) throws Exception {
        Map<String, String> values = Map.of(
                PlannerContract.TOOLS_PLACEHOLDER, String.join(", ", toolNames),
                PlannerContract.CONTEXT_PLACEHOLDER,
                MAPPER.writeValueAsString(workingContext != null ? workingContext : Map.of()),
                PlannerContract.USER_INPUT_PLACEHOLDER, userInput != null ? userInput : "");
        Matcher m = PLACEHOLDER.matcher(promptTemplate);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(values.get(m.group())));
        }
        m.appendTail(out);
        return out.toString();
    }
}
