package io.flowrules.core.rule;

import io.flowrules.core.model.QuestionState;

/**
 * Visibility directive kinds and their state transitions. {@link #SKIP} is
 * terminal: once a question is hidden no other kind changes it.
 */
public enum DirectiveKind {
    SKIP("skip"),
    OPTIONAL("optional"),
    REQUIRE("require"),
    SHOW("show");

    private final String keyword;

    DirectiveKind(String keyword) {
        this.keyword = keyword;
    }

    /** The directive prefix, e.g. {@code skip} in {@code skip_if(...)}. */
    public String keyword() {
        return keyword;
    }

    /** Applies this directive to a matched question. */
    public QuestionState apply(QuestionState state) {
        if (this == SKIP) {
            return QuestionState.SKIPPED;
        }
        if (!state.visible()) {
            return state;
        }
        return switch (this) {
            case OPTIONAL -> new QuestionState(true, false);
            case REQUIRE -> new QuestionState(true, true);
            default -> state;
        };
    }

    static DirectiveKind fromKeyword(String keyword) {
        for (DirectiveKind kind : values()) {
            if (kind.keyword.equalsIgnoreCase(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown directive kind: " + keyword);
    }
}
