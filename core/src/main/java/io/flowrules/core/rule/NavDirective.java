package io.flowrules.core.rule;

import java.util.Objects;

/**
 * One parsed {@code goto_if(expr, target=qid)} clause.
 *
 * @param target     qid to jump to when the expression is truthy
 * @param expression condition; may reference {@code value}
 * @param raw        clause text as written, for logs
 */
public record NavDirective(String target, Expression expression, String raw) {

    public NavDirective {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }
}
