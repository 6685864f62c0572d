package com.quill.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a structured applicant profile (as kept in memory) into the one-line summary tools
 * expect: name and intended major, up to three activities, up to three defining moments with
 * two themes each, and up to two core values.
 */
public final class ProfileFormatter {

    private static final int MAX_IMPACT_CHARS = 50;

    private ProfileFormatter() {
    }

    public static String summarize(Map<?, ?> profile) {
        List<String> parts = new ArrayList<>();

        Map<?, ?> userInfo = map(profile.get("user_info"));
        String name = text(userInfo.get("name"));
        String major = text(userInfo.get("intended_major"));
        if (name.isEmpty()) {
            name = "Student";
        }
        parts.add(major.isEmpty() ? name : name + ": " + major + "-focused student");

        List<String> activities = new ArrayList<>();
        for (Object o : first(map(profile.get("academic_profile")).get("activities"), 3)) {
            Map<?, ?> activity = map(o);
            String role = text(activity.get("role"));
            String activityName = text(activity.get("name"));
            String impact = text(activity.get("impact"));
            if (role.isEmpty() || activityName.isEmpty()) {
                continue;
            }
            if (impact.isEmpty()) {
                activities.add(role + " of " + activityName);
            } else {
                String shortImpact = impact.length() > MAX_IMPACT_CHARS ? impact.substring(0, MAX_IMPACT_CHARS) : impact;
                activities.add(role + " of " + activityName + " (" + shortImpact + "...)");
            }
        }
        if (!activities.isEmpty()) {
            parts.add("Activities: " + String.join(", ", activities));
        }

        List<String> moments = new ArrayList<>();
        for (Object o : first(profile.get("defining_moments"), 3)) {
            Map<?, ?> moment = map(o);
            String title = text(moment.get("title"));
            List<String> themes = new ArrayList<>();
            for (Object t : first(moment.get("themes"), 2)) {
                themes.add(text(t));
            }
            if (!title.isEmpty() && !themes.isEmpty()) {
                moments.add(title + " (themes: " + String.join(", ", themes) + ")");
            }
        }
        if (!moments.isEmpty()) {
            parts.add("Key experiences: " + String.join("; ", moments));
        }

        List<String> values = new ArrayList<>();
        for (Object o : first(profile.get("core_values"), 2)) {
            String value = text(map(o).get("value"));
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        if (!values.isEmpty()) {
            parts.add("Core values: " + String.join(", ", values));
        }

        return String.join(". ", parts) + ".";
    }

    private static Map<?, ?> map(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }

    private static List<?> first(Object value, int n) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<?> list = (List<?>) value;
        return list.subList(0, Math.min(n, list.size()));
    }

    private static String text(Object value) {
        return value != null ? value.toString() : "";
    }
}
