package io.flowrules.core.rule;

import java.util.Objects;

/**
 * One parsed {@code <kind>_if(...)} clause.
 *
 * @param kind       transition applied when the expression is truthy
 * @param expression condition
 * @param raw        clause text as written, for logs
 * @param target     qid the directive applies to, or {@code null} for the
 *                   owning question
 */
public record VisibilityDirective(DirectiveKind kind, Expression expression, String raw, String target) {

    public VisibilityDirective {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }

    /** The question this directive changes. */
    public String subject(String ownerQid) {
        return target != null ? target : ownerQid;
    }
}
