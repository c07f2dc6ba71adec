package io.flowrules.core.rule;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression AST. The node set is closed: evaluators and walkers
 * handle exactly these six variants.
 */
public sealed interface Expression {

    /** A text, numeric or boolean literal. Numbers keep their source spelling as text. */
    record Literal(RuleValue value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * A reference to another question's answer by qid, or the pseudo-name
     * {@code value} (navigation only) for the owning question's own answer.
     */
    record Identifier(String name) implements Expression {
        public static final String SELF = "value";

        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        public boolean isSelf() {
            return SELF.equalsIgnoreCase(name);
        }
    }

    record ListLiteral(List<Expression> items) implements Expression {
        public ListLiteral {
            items = List.copyOf(items);
        }
    }

    /** Logical negation, the only unary operator. */
    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record FunctionCall(String name, List<Expression> args) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }
    }
}
