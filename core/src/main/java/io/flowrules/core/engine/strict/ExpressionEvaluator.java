package io.flowrules.core.engine.strict;

import io.flowrules.core.error.RuleEvalException;
import io.flowrules.core.model.AnswerTokens;
import io.flowrules.core.model.AnswerValue;
import io.flowrules.core.rule.BinaryOperator;
import io.flowrules.core.rule.Expression;
import io.flowrules.core.rule.RuleValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Evaluates expression ASTs against an answer bag.
 *
 * <ul>
 * <li>identifiers yield the list of answer tokens (empty when unanswered)</li>
 * <li>{@code =} holds if any left/right token pair matches; {@code !=} holds
 * if no pair matches. Tokens that both look numeric compare with a relative
 * tolerance, anything else compares as exact text</li>
 * <li>ordering operators need a numeric first token on the right and hold if
 * any numeric left token satisfies them; non-numeric left tokens are
 * skipped</li>
 * <li>{@code in} is exact text membership, no numeric coercion</li>
 * <li>{@code int(x)} truncates the first token of {@code x}</li>
 * </ul>
 *
 * <p>
 * Both operands of {@code and}/{@code or} are evaluated before combining, so
 * an evaluation error on either side fails the whole directive.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ExpressionEvaluator {

    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    /** Decimal float syntax accepted by {@code int()}: sign, fraction, exponent, digit underscores. */
    private static final Pattern FLOAT_LITERAL = Pattern.compile(
            "^[+-]?(\\d+(_\\d+)*(\\.(\\d+(_\\d+)*)?)?|\\.\\d+(_\\d+)*)([eE][+-]?\\d+(_\\d+)*)?$");

    private static final double LONG_LIMIT = 0x1p63;

    private static final double REL_TOLERANCE = 1e-9;

    private ExpressionEvaluator() {}

    /**
     * Evaluates {@code expression}.
     *
     * @throws RuleEvalException if {@code int()} has nothing to convert, gets
     *                           the wrong argument count, or an unknown
     *                           function is called
     */
    public static RuleValue evaluate(Expression expression, EvalContext context) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Identifier identifier) {
            return RuleValue.ListValue.ofTexts(tokens(identifier, context));
        }
        if (expression instanceof Expression.ListLiteral list) {
            List<RuleValue> items = new ArrayList<>();
            for (Expression item : list.items()) {
                items.add(evaluate(item, context));
            }
            return new RuleValue.ListValue(items);
        }
        if (expression instanceof Expression.Not not) {
            return RuleValue.of(!evaluate(not.operand(), context).truthy());
        }
        if (expression instanceof Expression.Binary binary) {
            RuleValue left = evaluate(binary.left(), context);
            RuleValue right = evaluate(binary.right(), context);
            return RuleValue.of(applyBinary(binary.operator(), left, right));
        }
        if (expression instanceof Expression.FunctionCall call) {
            return callFunction(call, context);
        }
        throw new RuleEvalException(
                "unsupported expression node: " + expression.getClass().getSimpleName(),
                context.ownerQid(),
                context.directive());
    }

    /** Convenience for {@code evaluate(expression, context).truthy()}. */
    public static boolean test(Expression expression, EvalContext context) {
        return evaluate(expression, context).truthy();
    }

    private static List<String> tokens(Expression.Identifier identifier, EvalContext context) {
        AnswerValue answer;
        if (identifier.isSelf()) {
            if (context.currentQid() == null) {
                return List.of();
            }
            answer = context.answers().get(context.currentQid());
        } else {
            answer = context.answers().lookup(identifier.name());
        }
        return AnswerTokens.extract(answer);
    }

    private static RuleValue callFunction(Expression.FunctionCall call, EvalContext context) {
        if (!call.name().toLowerCase(Locale.ROOT).equals("int")) {
            throw new RuleEvalException(
                    "unsupported function: " + call.name(), context.ownerQid(), context.directive());
        }
        if (call.args().size() != 1) {
            throw new RuleEvalException(
                    "int() expects a single argument", context.ownerQid(), context.directive());
        }
        List<String> scalars = evaluate(call.args().get(0), context).scalars();
        if (scalars.isEmpty()) {
            throw new RuleEvalException("int() missing value", context.ownerQid(), context.directive());
        }
        String token = scalars.get(0);
        if (!FLOAT_LITERAL.matcher(token).matches()) {
            throw new RuleEvalException(
                    "int() cannot convert '" + token + "'", context.ownerQid(), context.directive());
        }
        double value = Double.parseDouble(token.replace("_", ""));
        if (Double.isInfinite(value) || Math.abs(value) >= LONG_LIMIT) {
            throw new RuleEvalException(
                    "int() value out of range: '" + token + "'", context.ownerQid(), context.directive());
        }
        return new RuleValue.Int((long) value);
    }

    static boolean applyBinary(BinaryOperator operator, RuleValue left, RuleValue right) {
        return switch (operator) {
            case AND -> left.truthy() && right.truthy();
            case OR -> left.truthy() || right.truthy();
            case IN -> membership(left.scalars(), right.scalars());
            case EQ, NE -> equality(operator == BinaryOperator.NE, left.scalars(), right.scalars());
            case LT, LE, GT, GE -> ordering(operator, left.scalars(), right.scalars());
        };
    }

    private static boolean equality(boolean negate, List<String> left, List<String> right) {
        if (left.isEmpty()) {
            // unanswered left side: '=' only matches an empty right side
            return right.isEmpty() ? !negate : negate;
        }
        if (right.isEmpty()) {
            return negate;
        }
        for (String candidate : left) {
            for (String target : right) {
                if (tokensEqual(candidate, target)) {
                    return !negate;
                }
            }
        }
        return negate;
    }

    private static boolean ordering(BinaryOperator operator, List<String> left, List<String> right) {
        if (right.isEmpty() || !looksNumeric(right.get(0))) {
            return false;
        }
        double bound = Double.parseDouble(right.get(0));
        for (String candidate : left) {
            if (!looksNumeric(candidate)) {
                continue;
            }
            double value = Double.parseDouble(candidate);
            if (compare(operator, value, bound)) {
                return true;
            }
        }
        return false;
    }

    private static boolean compare(BinaryOperator operator, double value, double bound) {
        return switch (operator) {
            case LT -> value < bound;
            case LE -> value <= bound;
            case GT -> value > bound;
            case GE -> value >= bound;
            default -> throw new IllegalArgumentException("not an ordering operator: " + operator);
        };
    }

    private static boolean membership(List<String> left, List<String> right) {
        if (right.isEmpty()) {
            return false;
        }
        for (String candidate : left) {
            if (right.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    static boolean tokensEqual(String left, String right) {
        if (looksNumeric(left) && looksNumeric(right)) {
            return isClose(Double.parseDouble(left), Double.parseDouble(right));
        }
        return left.equals(right);
    }

    static boolean looksNumeric(String token) {
        return token != null && NUMERIC.matcher(token.strip()).matches();
    }

    private static boolean isClose(double a, double b) {
        if (a == b) {
            return true;
        }
        return Math.abs(a - b) <= REL_TOLERANCE * Math.max(Math.abs(a), Math.abs(b));
    }
}
