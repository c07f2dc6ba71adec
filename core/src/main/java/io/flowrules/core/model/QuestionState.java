package io.flowrules.core.model;

/**
 * Resolved visibility of one question.
 *
 * @param visible  {@code false} once the question is skipped
 * @param required whether an answer is mandatory; always {@code false} when
 *                 skipped
 */
public record QuestionState(boolean visible, boolean required) {

    public static final QuestionState SKIPPED = new QuestionState(false, false);

    /** Starting state: visible with the declared requiredness. */
    public static QuestionState initial(Question question) {
        return new QuestionState(true, question.required());
    }

    /** {@code skip} if hidden, {@code optional} if not required, else {@code show}. */
    public VisibilityState state() {
        if (!visible) {
            return VisibilityState.SKIP;
        }
        return required ? VisibilityState.SHOW : VisibilityState.OPTIONAL;
    }

    /** Short label for log lines: {@code skip}, {@code required} or {@code optional}. */
    public String humanized() {
        if (!visible) {
            return "skip";
        }
        return required ? "required" : "optional";
    }
}
