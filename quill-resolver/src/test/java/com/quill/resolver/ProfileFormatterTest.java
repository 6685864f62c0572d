package com.quill.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProfileFormatterTest {

    @Test
    void summarize_fullProfile() {
        Map<String, Object> profile = Map.of(
                "user_info", Map.of("name", "Sam", "intended_major", "Engineering"),
                "academic_profile", Map.of("activities", List.of(
                        Map.of("role", "Captain", "name", "Robotics Club", "impact", "Led the team to regionals"),
                        Map.of("role", "Tutor", "name", "Math Lab"),
                        Map.of("name", "no role, skipped"))),
                "defining_moments", List.of(
                        Map.of("title", "Moving abroad", "themes", List.of("resilience", "identity", "family"))),
                "core_values", List.of(Map.of("value", "grit"), Map.of("value", "kindness"), Map.of("value", "third")));

        assertEquals("Sam: Engineering-focused student. "
                        + "Activities: Captain of Robotics Club (Led the team to regionals...), Tutor of Math Lab. "
                        + "Key experiences: Moving abroad (themes: resilience, identity). "
                        + "Core values: grit, kindness.",
                ProfileFormatter.summarize(profile));
    }

    @Test
    void summarize_emptyProfileFallsBackToStudent() {
        assertEquals("Student.", ProfileFormatter.summarize(Map.of()));
    }

    @Test
    void summarize_truncatesLongImpact() {
        String impact = "x".repeat(80);
        Map<String, Object> profile = Map.of(
                "user_info", Map.of("name", "Lee"),
                "academic_profile", Map.of("activities", List.of(Map.of("role", "Founder", "name", "Club", "impact", impact))));

        assertEquals("Lee. Activities: Founder of Club (" + "x".repeat(50) + "...).", ProfileFormatter.summarize(profile));
    }
}
