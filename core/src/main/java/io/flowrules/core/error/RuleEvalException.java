package io.flowrules.core.error;

/**
 * Thrown when a parsed expression fails at runtime, e.g. {@code int()} applied
 * to an empty answer. The failing directive is treated as not matched.
 */
public final class RuleEvalException extends RuleException {

    private static final long serialVersionUID = 1L;

    private final String directive;

    public RuleEvalException(String message, String qid, String directive) {
        super(message, qid, Phase.EVALUATION);
        this.directive = directive;
    }

    public RuleEvalException(String message, Throwable cause, String qid, String directive) {
        super(message, cause, qid, Phase.EVALUATION);
        this.directive = directive;
    }

    /** The raw directive text that failed, or {@code null} when evaluated outside a directive. */
    public String directive() {
        return directive;
    }
}
