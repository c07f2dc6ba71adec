package io.flowrules.core.model;

/** Consumer-facing collapse of a {@link QuestionState}. */
public enum VisibilityState {
    SHOW("show"),
    OPTIONAL("optional"),
    SKIP("skip");

    private final String wireName;

    VisibilityState(String wireName) {
        this.wireName = wireName;
    }

    /** Lowercase name used in JSON output. */
    public String wireName() {
        return wireName;
    }

    /** Severity rank: a state may only move toward {@link #SKIP}. */
    public int rank() {
        return ordinal();
    }
}
