package io.flowrules.core.testkit;

import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionType;

/** Shorthand factories for test questions. */
public final class TestQuestions {

    private TestQuestions() {}

    /** A required short-text question whose order equals its position label. */
    public static Question plain(String qid, String order) {
        return Question.builder(qid).order(order).label(qid).build();
    }

    public static Question withVisibility(String qid, String order, String visibilityRules) {
        return Question.builder(qid).order(order).label(qid).visibilityRules(visibilityRules).build();
    }

    public static Question withNav(String qid, String order, String navRules) {
        return Question.builder(qid).order(order).label(qid).navRules(navRules).build();
    }

    public static Question withRules(String qid, String order, String label, String rules) {
        return Question.builder(qid).order(order).label(label).rules(rules).build();
    }

    public static Question select(String qid, String order, boolean required) {
        return Question.builder(qid)
                .order(order)
                .label(qid)
                .type(QuestionType.SINGLE_SELECT)
                .required(required)
                .build();
    }
}
