package com.quill.resolver;

import com.quill.tools.ToolCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentResolverTest {

    private static final ToolCatalog CATALOG = ToolCatalog.builder()
            .tool("X", List.of("a", "b"), List.of())
            .tool("Y", List.of("c"), List.of())
            .tool("multi", List.of("p", "q", "r"), List.of())
            .tool("draft_essay", List.of("outline", "essay_prompt"), List.of("word_limit", "tone"))
            .tool("word_count", List.of("text"), List.of("target_word_count"))
            .tool("clarify", List.of("user_input"), List.of("question"))
            .tool("brainstorm", List.of("essay_prompt", "profile"), List.of())
            .tool("outline", List.of("story", "prompt", "word_count"), List.of())
            .tool("expand_outline_section", List.of("outline"), List.of("section_name"))
            .tool("story_themes", List.of("story"), List.of())
            .tool("analyze", List.of("text", "story"), List.of())
            .build();

    private final ArgumentResolver resolver = new ArgumentResolver(CATALOG, ResolverTables.loadDefault());

    @Test
    void explicitThenContext() {
        Resolution r = resolver.resolve("X", Map.of("a", "v1"), Map.of("b", "v2"), "");

        assertEquals(Map.of("a", "v1", "b", "v2"), r.args());
        assertEquals("explicit", r.sources().get("a"));
        assertEquals("context", r.sources().get("b"));
    }

    @Test
    void missingRequiredNamesExactlyTheMissingParameter() {
        MissingRequiredArgumentException e = assertThrows(MissingRequiredArgumentException.class,
                () -> resolver.resolve("Y", Map.of(), Map.of("unrelated", 1), "hello"));

        assertEquals(List.of("c"), e.missingArguments());
        assertEquals("Y", e.getToolName());
        assertEquals("Missing required args for Y: c", e.getMessage());
    }

    @Test
    void missingArgumentsListedInDeclarationOrder() {
        MissingRequiredArgumentException e = assertThrows(MissingRequiredArgumentException.class,
                () -> resolver.resolve("multi", Map.of("q", "x"), Map.of(), null));

        assertEquals(List.of("p", "r"), e.missingArguments());
    }

    @Test
    void undeclaredExplicitArgsPassThrough() {
        Resolution r = resolver.resolve("X", Map.of("a", 1, "b", 2, "extra", true), Map.of(), "");

        assertEquals(true, r.args().get("extra"));
    }

    @Test
    void explicitArgsWinOverContext() {
        Resolution r = resolver.resolve("X", Map.of("a", "explicit", "b", "e"), Map.of("a", "ctx"), "");

        assertEquals("explicit", r.args().get("a"));
    }

    @Test
    void flattenedContextFillsNestedParameter() {
        Resolution r = resolver.resolve("X", Map.of("a", 1),
                Map.of("session", Map.of("b", "nested")), "");

        assertEquals("nested", r.args().get("b"));
        assertEquals("context_flat", r.sources().get("b"));
    }

    @Test
    void roleHeuristicReadsDraftFromPriorStepOutput() {
        Map<String, Object> ctx = Map.of("draft", Map.of("draft", "Once upon a time"));

        Resolution r = resolver.resolve("word_count", Map.of(), ctx, "count my words");

        assertEquals("Once upon a time", r.args().get("text"));
        assertEquals("heuristic:draft_text:draft.draft", r.sources().get("text"));
    }

    @Test
    void roleHeuristicSkipsBlankCandidates() {
        Map<String, Object> ctx = Map.of(
                "revise_for_clarity", Map.of("revised_draft", "   "),
                "draft", Map.of("draft", "real text"));

        Resolution r = resolver.resolve("word_count", Map.of(), ctx, "");

        assertEquals("real text", r.args().get("text"));
    }

    @Test
    void userInputFillsUtteranceRole() {
        Resolution r = resolver.resolve("clarify", Map.of(), Map.of(), "help me");

        assertEquals("help me", r.args().get("user_input"));
        assertEquals("heuristic:user_utterance:@user_input", r.sources().get("user_input"));
        assertFalse(r.args().containsKey("question"));
    }

    @Test
    void blankUserInputDoesNotCountForUtteranceRole() {
        assertThrows(MissingRequiredArgumentException.class,
                () -> resolver.resolve("clarify", Map.of(), Map.of(), "  "));
    }

    @Test
    void defaultsFillOptionalParameters() {
        Map<String, Object> ctx = Map.of("outline", Map.of("hook", "h"), "essay_prompt", "Why us?");

        Resolution r = resolver.resolve("draft_essay", Map.of(), ctx, "");

        assertEquals(650, r.args().get("word_limit"));
        assertEquals("neutral", r.args().get("tone"));
        assertEquals("default", r.sources().get("tone"));
    }

    @Test
    void aliasesRecoverRequiredParameters() {
        Resolution r = resolver.resolve("brainstorm", Map.of("prompt", "Describe a challenge"),
                Map.of("student_profile", "Robotics captain"), "");

        assertEquals("Describe a challenge", r.args().get("essay_prompt"));
        assertEquals("alias:prompt", r.sources().get("essay_prompt"));
        assertEquals("Robotics captain", r.args().get("profile"));
        assertEquals("heuristic:profile:student_profile", r.sources().get("profile"));
    }

    @Test
    void outlineFillsStoryPromptAndWordCount() {
        Map<String, Object> ctx = Map.of(
                "brainstorm_specific", Map.of("best_idea", "robotics"),
                "essay_prompt", "P");

        Resolution r = resolver.resolve("outline", Map.of(), ctx, "");

        assertEquals("robotics", r.args().get("story"));
        assertEquals("P", r.args().get("prompt"));
        assertEquals("heuristic:essay_prompt:essay_prompt", r.sources().get("prompt"));
        assertEquals(650, r.args().get("word_count"));
        assertEquals("default", r.sources().get("word_count"));
    }

    @Test
    void preferredWordCountBeatsDefault() {
        Map<String, Object> ctx = Map.of(
                "story", "robotics",
                "essay_prompt", "P",
                "preferences", Map.of("preferred_word_count", 500));

        Resolution r = resolver.resolve("outline", Map.of(), ctx, "");

        assertEquals(500, r.args().get("word_count"));
    }

    @Test
    void missingProfileGetsPlaceholder() {
        Resolution r = resolver.resolve("brainstorm", Map.of(), Map.of("essay_prompt", "P"), "");

        assertEquals("New applicant; profile pending.", r.args().get("profile"));
        assertEquals("default", r.sources().get("profile"));
    }

    @Test
    void structuredProfileFromContextIsSummarized() {
        Map<String, Object> profile = Map.of(
                "user_info", Map.of("name", "Ana", "intended_major", "Biology"),
                "core_values", List.of(Map.of("value", "curiosity")));

        Resolution r = resolver.resolve("brainstorm", Map.of(), Map.of("essay_prompt", "P", "profile", profile), "");

        assertEquals("Ana: Biology-focused student. Core values: curiosity.", r.args().get("profile"));
    }

    @Test
    void explicitStructuredProfilePassesThrough() {
        Map<String, Object> profile = Map.of("user_info", Map.of("name", "Ana"));

        Resolution r = resolver.resolve("brainstorm", Map.of("profile", profile), Map.of("essay_prompt", "P"), "");

        assertEquals(profile, r.args().get("profile"));
    }

    @Test
    void sectionNameDefaultsToHook() {
        Resolution r = resolver.resolve("expand_outline_section", Map.of("outline", "o"), Map.of(), "");

        assertEquals("hook", r.args().get("section_name"));
    }

    @Test
    void userInputFillsMissingTextLikeParameter() {
        Resolution r = resolver.resolve("story_themes", Map.of(), Map.of(), "the summer I rebuilt a bike");

        assertEquals("the summer I rebuilt a bike", r.args().get("story"));
        assertEquals("user_input_fallback", r.sources().get("story"));
    }

    @Test
    void userInputFillsOnlyOneTextLikeParameter() {
        MissingRequiredArgumentException e = assertThrows(MissingRequiredArgumentException.class,
                () -> resolver.resolve("analyze", Map.of(), Map.of(), "some words"));

        assertEquals(List.of("story"), e.missingArguments());
    }

    @Test
    void contextWinsOverUserInputForTextLikeParameter() {
        Resolution r = resolver.resolve("story_themes", Map.of(), Map.of("story", "from context"), "typed");

        assertEquals("from context", r.args().get("story"));
    }

    @Test
    void resolutionIsDeterministic() {
        Map<String, Object> ctx = Map.of("draft", Map.of("draft", "text"), "preferences", Map.of("preferred_word_count", 500));

        Resolution first = resolver.resolve("word_count", Map.of(), ctx, "hi");
        Resolution second = resolver.resolve("word_count", Map.of(), ctx, "hi");

        assertEquals(first, second);
        assertEquals(500, first.args().get("target_word_count"));
    }

    @Test
    void supersetOfRequiredAlwaysResolves() {
        Resolution r = resolver.resolve("multi", Map.of("p", 1, "q", 2, "r", 3), null, null);

        assertTrue(r.args().keySet().containsAll(CATALOG.requiredArgs("multi")));
    }

    @Test
    void unknownToolResolvesExplicitArgsOnly() {
        Resolution r = resolver.resolve("not_catalogued", Map.of("k", "v"), Map.of("other", 1), "");

        assertEquals(Map.of("k", "v"), r.args());
    }
}
