package com.quill.resolver;

import java.util.List;
import java.util.Objects;

/**
 * One row of the role table: the parameters that play a role and the ordered context keys that
 * can fill them. {@link #USER_INPUT} stands for the user's utterance.
 *
 * @param name       role name (e.g. "story")
 * @param params     parameter names this role fills
 * @param candidates context keys tried in order (direct, dotted or underscored)
 */
public record SemanticRole(String name, List<String> params, List<String> candidates) {

    public static final String USER_INPUT = "@user_input";

    public SemanticRole {
        Objects.requireNonNull(name, "name");
        params = params != null ? List.copyOf(params) : List.of();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public boolean fills(String param) {
        return params.contains(param);
    }
}
