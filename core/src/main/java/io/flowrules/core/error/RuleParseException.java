package io.flowrules.core.error;

/**
 * Thrown when directive text is malformed: unknown directive kind, unmatched
 * brackets, {@code in} without a list, missing {@code goto_if} target. Carries
 * the raw clause text so sheet editors can locate the offending cell.
 */
public final class RuleParseException extends RuleException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public RuleParseException(String message, String qid, String source) {
        super(message, qid, Phase.PARSE);
        this.source = source;
    }

    public RuleParseException(String message, Throwable cause, String qid, String source) {
        super(message, cause, qid, Phase.PARSE);
        this.source = source;
    }

    /** The raw rule text being parsed, or {@code null} when unknown. */
    public String source() {
        return source;
    }
}
