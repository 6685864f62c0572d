package com.quill.tool.clarify;

import com.quill.annotations.QuillTool;
import com.quill.annotations.QuillToolParam;
import com.quill.tools.Tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks the user for missing details. Uses the supplied question when there is one; otherwise
 * builds questions from the missing parameter names, or falls back to generic questions for an
 * empty or very short request.
 */
@QuillTool(name = ClarifyToolProvider.TOOL_NAME,
        description = "Ask clarifying questions when a request is ambiguous or details are missing",
        parameters = {
                @QuillToolParam(name = "user_input", required = true),
                @QuillToolParam(name = "question"),
                @QuillToolParam(name = "missing", type = "LIST"),
                @QuillToolParam(name = "context")
        })
public final class ClarifyTool implements Tool {

    static final String KEY_USER_INPUT = "user_input";
    static final String KEY_QUESTION = "question";
    static final String KEY_MISSING = "missing";
    static final String KEY_QUESTIONS = "clarifying_questions";
    static final String KEY_RESPONSE = "response";

    static final List<String> GENERIC_QUESTIONS = List.of(
            "What specific part of your essay would you like help with?",
            "Are you looking to brainstorm ideas, improve structure, or polish a draft?");

    static final List<String> GENERAL_QUESTIONS = List.of(
            "Could you provide more details about what you're trying to accomplish?",
            "Is there a particular essay prompt or goal you're working toward?");

    @Override
    public Map<String, Object> execute(Map<String, Object> args) {
        String userInput = text(args.get(KEY_USER_INPUT));
        String question = text(args.get(KEY_QUESTION));
        List<String> missing = names(args.get(KEY_MISSING));

        List<String> questions = new ArrayList<>();
        if (!question.isEmpty()) {
            questions.add(question);
        } else if (!missing.isEmpty()) {
            for (String name : missing) {
                questions.add("Could you tell me your " + name.replace('_', ' ') + "?");
            }
        } else if (isVague(userInput)) {
            questions.addAll(GENERIC_QUESTIONS);
        } else {
            questions.addAll(GENERAL_QUESTIONS);
        }
        return Map.of(
                KEY_QUESTIONS, List.copyOf(questions),
                KEY_MISSING, missing,
                KEY_RESPONSE, String.join("\n", questions));
    }

    /** Empty input, or a short help request such as "help me". */
    static boolean isVague(String userInput) {
        if (userInput.isEmpty()) return true;
        String lower = userInput.toLowerCase(Locale.ROOT);
        boolean asksForHelp = lower.contains("help") || lower.contains("what") || lower.contains("how");
        return asksForHelp && userInput.split("\\s+").length < 5;
    }

    private static String text(Object value) {
        return value != null ? value.toString().trim() : "";
    }

    private static List<String> names(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object o : (Collection<?>) value) {
                if (o != null && !o.toString().isBlank()) out.add(o.toString().trim());
            }
        } else if (value != null && !value.toString().isBlank()) {
            for (String s : value.toString().split(",")) {
                if (!s.isBlank()) out.add(s.trim());
            }
        }
        return List.copyOf(out);
    }
}
