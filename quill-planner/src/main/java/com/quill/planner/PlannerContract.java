package com.quill.planner;

/**
 * Decision JSON field names, action values and prompt placeholders shared by
 * {@link JsonDecisionParser} and {@link ModelReplanningOracle}.
 */
public final class PlannerContract {

    private PlannerContract() {
    }

    public static final String FIELD_ACTION = "action";
    public static final String FIELD_TOOL_NAME = "tool_name";
    public static final String FIELD_SEQUENCE = "sequence";
    public static final String FIELD_TOOL_ARGS = "tool_args";
    public static final String FIELD_REASONING = "reasoning";
    public static final String FIELD_CONFIDENCE = "confidence";

    public static final String ACTION_TOOL_EXECUTION = "tool_execution";
    public static final String ACTION_TOOL_SEQUENCE = "tool_sequence";
    public static final String ACTION_CONVERSATION = "conversation";

    /** Replaced with the user's utterance. */
    public static final String USER_INPUT_PLACEHOLDER = "{{userInput}}";

    /** Replaced with the working context as JSON. */
    public static final String CONTEXT_PLACEHOLDER = "{{context}}";

    /** Replaced with the comma-separated tool names. */
    public static final String TOOLS_PLACEHOLDER = "{{tools}}";

    public static final String DEFAULT_PROMPT_TEMPLATE = ""
            + "Decide the next step for a writing assistant. Prefer a tool when one fits the request.\n"
            + "Reply with one JSON object and nothing else:\n"
            + "{\"action\": \"tool_execution\" | \"tool_sequence\" | \"conversation\",\n"
            + " \"tool_name\": \"<tool or null>\",\n"
            + " \"sequence\": [\"<tool>\", ...],\n"
            + " \"tool_args\": {},\n"
            + " \"reasoning\": \"<at most 40 words>\",\n"
            + " \"confidence\": <0.0-1.0>}\n"
            + "Do not propose a tool that already has output in the context unless asked to redo it.\n"
            + "Available tools: " + TOOLS_PLACEHOLDER + "\n"
            + "Context: " + CONTEXT_PLACEHOLDER + "\n"
            + "User message: " + USER_INPUT_PLACEHOLDER + "\n";
}
