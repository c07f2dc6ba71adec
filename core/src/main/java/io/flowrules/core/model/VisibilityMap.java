package io.flowrules.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of a visibility evaluation: one {@link QuestionState} per question,
 * in flow order. Questions unknown to the map are reported as visible with
 * their declared requiredness by callers.
 */
public final class VisibilityMap {

    private final Map<String, QuestionState> states;

    public VisibilityMap(Map<String, QuestionState> states) {
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    /** The fail-open mapping: every question visible with its declared requiredness. */
    public static VisibilityMap defaults(List<Question> questions) {
        Map<String, QuestionState> states = new LinkedHashMap<>();
        for (Question question : questions) {
            states.put(question.qid(), QuestionState.initial(question));
        }
        return new VisibilityMap(states);
    }

    /** The state for {@code qid}, or {@code null} if the qid is not in the flow. */
    public QuestionState get(String qid) {
        return states.get(qid);
    }

    /** The collapsed state for {@code qid}; unknown qids report {@link VisibilityState#SHOW}. */
    public VisibilityState stateOf(String qid) {
        QuestionState state = states.get(qid);
        return state != null ? state.state() : VisibilityState.SHOW;
    }

    public boolean isSkipped(String qid) {
        return stateOf(qid) == VisibilityState.SKIP;
    }

    public Map<String, QuestionState> asMap() {
        return states;
    }

    public int size() {
        return states.size();
    }

    /**
     * Renders {@code qid -> {"state": ..., "required": ...}} with keys sorted,
     * matching the dry-run output format.
     */
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        new TreeMap<>(states).forEach((qid, state) -> {
            ObjectNode entry = root.putObject(qid);
            entry.put("required", state.required());
            entry.put("state", state.state().wireName());
        });
        return root;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VisibilityMap other)) return false;
        return states.equals(other.states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return "VisibilityMap" + states;
    }
}
