package io.flowrules.core.error;

/** Thrown when a flow catalog file is missing, unreadable or has an invalid structure. */
public final class FlowLoadException extends RuleException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public FlowLoadException(String message, String source) {
        super(message, null, Phase.LOAD);
        this.source = source;
    }

    public FlowLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
