package io.flowrules.core.engine;

import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.AnswerValue;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionState;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.model.VisibilityState;
import java.util.ArrayList;
import java.util.List;

/** Finds required questions that are still unanswered. */
public final class RequiredAnswers {

    private RequiredAnswers() {}

    /**
     * Questions that are not skipped, are required, and have no answer.
     * Requiredness comes from {@code visibility} when it has an entry for the
     * question, else from the declared flag.
     */
    public static List<Question> missing(List<Question> questions, VisibilityMap visibility, AnswerBag answers) {
        List<Question> missing = new ArrayList<>();
        for (Question question : questions) {
            QuestionState state = visibility.get(question.qid());
            boolean required;
            if (state == null) {
                required = question.required();
            } else if (state.state() == VisibilityState.SKIP) {
                continue;
            } else {
                required = state.required();
            }
            if (required && !hasAnswer(question, answers.get(question.qid()))) {
                missing.add(question);
            }
        }
        return missing;
    }

    /**
     * Select questions need a non-blank {@code value} (or a non-blank element
     * of a nested answer); other questions need non-blank text or any
     * structured answer at all.
     */
    static boolean hasAnswer(Question question, AnswerValue answer) {
        if (question.type().isSelect()) {
            return hasSelection(answer);
        }
        if (answer instanceof AnswerValue.Scalar scalar) {
            return !scalar.text().isBlank();
        }
        return !answer.isEmpty();
    }

    private static boolean hasSelection(AnswerValue answer) {
        if (answer instanceof AnswerValue.Selection selection) {
            if (selection.value() instanceof AnswerValue.Scalar value && !value.text().isBlank()) {
                return true;
            }
            AnswerValue values = selection.values();
            return values != null && hasSelection(values);
        }
        if (answer instanceof AnswerValue.Nested nested) {
            for (AnswerValue item : nested.items()) {
                if (hasSelection(item)) {
                    return true;
                }
            }
            return false;
        }
        if (answer instanceof AnswerValue.Scalar scalar) {
            return !scalar.text().isBlank();
        }
        return false;
    }
}
