package io.flowrules.core.engine.strict;

import io.flowrules.core.model.AnswerBag;
import java.util.Objects;

/**
 * Inputs for evaluating one directive expression.
 *
 * @param answers    answers collected so far
 * @param currentQid question whose own answer {@code value} refers to, or
 *                   {@code null} outside navigation
 * @param ownerQid   question that owns the directive, for error reporting
 * @param directive  raw directive text, for error reporting
 */
public record EvalContext(AnswerBag answers, String currentQid, String ownerQid, String directive) {

    public EvalContext {
        Objects.requireNonNull(answers, "answers must not be null");
    }

    /** Context for a visibility directive, where {@code value} is always empty. */
    public static EvalContext visibility(AnswerBag answers, String ownerQid, String directive) {
        return new EvalContext(answers, null, ownerQid, directive);
    }

    /** Context for a navigation directive owned by {@code qid}. */
    public static EvalContext navigation(AnswerBag answers, String qid, String directive) {
        return new EvalContext(answers, qid, qid, directive);
    }
}
