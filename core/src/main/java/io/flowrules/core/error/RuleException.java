package io.flowrules.core.error;

/**
 * Abstract base for all flow-rules exceptions. Never thrown directly; use
 * {@link RuleParseException}, {@link RuleEvalException} or
 * {@link FlowLoadException}.
 *
 * <p>
 * Engine entry points catch these internally and degrade to a safe default,
 * so a rule exception never reaches the host that invoked the engine.
 */
public abstract class RuleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        PARSE,
        EVALUATION
    }

    private final String qid;
    private final Phase phase;

    protected RuleException(String message, String qid, Phase phase) {
        super(message);
        this.qid = qid;
        this.phase = phase;
    }

    protected RuleException(String message, Throwable cause, String qid, Phase phase) {
        super(message, cause);
        this.qid = qid;
        this.phase = phase;
    }

    /** The question that owns the offending rule, or {@code null} if not yet identified. */
    public String qid() {
        return qid;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
