package com.quill.planner;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonDecisionParserTest {

    private final JsonDecisionParser parser = new JsonDecisionParser();

    @Test
    void parse_toolExecution() {
        Decision d = parser.parse("""
                {"action": "tool_execution", "tool_name": "outline", "tool_args": {"word_count": 500},
                 "reasoning": "user wants an outline", "confidence": 0.9}
                """);

        assertEquals(DecisionKind.EXECUTE_ONE, d.kind());
        assertEquals("outline", d.toolName());
        assertEquals(Map.of("word_count", 500), d.args());
        assertEquals("user wants an outline", d.rationale());
        assertEquals(0.9, d.confidence());
    }

    @Test
    void parse_sequenceInsideCodeFenceWithProse() {
        Decision d = parser.parse("Here is my plan:\n```json\n"
                + "{\"action\": \"tool_sequence\", \"sequence\": [\"brainstorm\", \"outline\"], \"tool_name\": null}\n"
                + "```\nHope that helps!");

        assertEquals(DecisionKind.RUN_SEQUENCE, d.kind());
        assertEquals(List.of("brainstorm", "outline"), d.proposedTools());
    }

    @Test
    void parse_objectSurroundedByProse() {
        Decision d = parser.parse("Sure! {\"action\": \"execute_one\", \"tool_name\": \"draft\", "
                + "\"reasoning\": \"has {braces} inside\"} Let me know.");

        assertEquals(DecisionKind.EXECUTE_ONE, d.kind());
        assertEquals("draft", d.toolName());
        assertEquals("has {braces} inside", d.rationale());
    }

    @Test
    void parse_objectWrappedInJsonString() {
        Decision d = parser.parse("\"{\\\"action\\\": \\\"conversation\\\", \\\"reasoning\\\": \\\"just chatting\\\"}\"");

        assertEquals(DecisionKind.CONVERSATIONAL_FALLBACK, d.kind());
        assertEquals("just chatting", d.rationale());
    }

    @Test
    void parse_missingActionInfersKindFromFields() {
        assertEquals(DecisionKind.RUN_SEQUENCE, parser.parse("{\"sequence\": [\"a\", \"b\"]}").kind());
        assertEquals(DecisionKind.EXECUTE_ONE, parser.parse("{\"tool_name\": \"a\"}").kind());
        assertEquals(DecisionKind.CONVERSATIONAL_FALLBACK, parser.parse("{}").kind());
    }

    @Test
    void parse_defaultsConfidenceAndClampsOutOfRange() {
        assertEquals(Decision.DEFAULT_CONFIDENCE, parser.parse("{\"action\": \"tool_execution\", \"tool_name\": \"a\"}").confidence());
        assertEquals(1.0, parser.parse("{\"action\": \"tool_execution\", \"tool_name\": \"a\", \"confidence\": 7}").confidence());
        assertEquals(0.4, parser.parse("{\"action\": \"tool_execution\", \"tool_name\": \"a\", \"confidence\": \"0.4\"}").confidence());
    }

    @Test
    void parse_garbageIsUnparseable() {
        Decision d = parser.parse("I think you should write an outline first.");

        assertEquals(DecisionKind.UNPARSEABLE, d.kind());
        assertFalse(d.rationale().isEmpty());
        assertTrue(d.proposedTools().isEmpty());
    }

    @Test
    void parse_unknownActionIsUnparseable() {
        assertEquals(DecisionKind.UNPARSEABLE, parser.parse("{\"action\": \"dance\", \"tool_name\": \"x\"}").kind());
    }

    @Test
    void parse_emptyAndTruncatedInputAreUnparseable() {
        assertEquals(DecisionKind.UNPARSEABLE, parser.parse(null).kind());
        assertEquals(DecisionKind.UNPARSEABLE, parser.parse("   ").kind());
        assertEquals(DecisionKind.UNPARSEABLE, parser.parse("{\"action\": \"tool_execution\", \"tool_na").kind());
        assertEquals(DecisionKind.UNPARSEABLE, parser.parse("[1, 2, 3]").kind());
    }
}
