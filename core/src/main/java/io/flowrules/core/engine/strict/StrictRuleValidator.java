package io.flowrules.core.engine.strict;

import io.flowrules.core.error.RuleParseException;
import io.flowrules.core.model.Question;
import io.flowrules.core.rule.DirectiveParser;
import io.flowrules.core.rule.Expression;
import io.flowrules.core.rule.NavDirective;
import io.flowrules.core.rule.VisibilityDirective;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static checks over the strict rule cells of a flow: parse errors, unknown
 * identifiers, unsupported functions, {@code value} outside navigation and
 * unknown navigation targets. Issues are formatted {@code "<qid>: <message>"}.
 */
final class StrictRuleValidator {

    private StrictRuleValidator() {}

    static List<String> validate(List<Question> questions) {
        List<String> issues = new ArrayList<>();
        Set<String> known = new HashSet<>();
        for (Question question : questions) {
            known.add(question.qid());
        }

        for (Question question : questions) {
            String qid = question.qid();
            if (!question.visibilityRules().isBlank()) {
                try {
                    for (VisibilityDirective directive : DirectiveParser.parseVisibility(question.visibilityRules(), qid)) {
                        if (directive.target() != null && !known.contains(directive.target())) {
                            issues.add(qid + ": visibility target '" + directive.target() + "' is unknown");
                        }
                        checkExpression(qid, directive.expression(), known, false, issues);
                    }
                } catch (RuleParseException e) {
                    issues.add(qid + ": " + e.getMessage());
                }
            }
            if (question.navRules().isBlank()) {
                continue;
            }
            try {
                for (NavDirective directive : DirectiveParser.parseNavigation(question.navRules(), qid)) {
                    if (!known.contains(directive.target())) {
                        issues.add(qid + ": navigation target '" + directive.target() + "' is unknown");
                    }
                    checkExpression(qid, directive.expression(), known, true, issues);
                }
            } catch (RuleParseException e) {
                issues.add(qid + ": " + e.getMessage());
            }
        }
        return issues;
    }

    private static void checkExpression(
            String owner, Expression expression, Set<String> known, boolean allowValue, List<String> issues) {
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expression);
        while (!stack.isEmpty()) {
            Expression node = stack.pop();
            if (node instanceof Expression.Identifier identifier) {
                String name = identifier.name();
                String lowered = name.toLowerCase(Locale.ROOT);
                if (identifier.isSelf()) {
                    if (!allowValue) {
                        issues.add(owner + ": 'value' is not valid in visibility rules");
                    }
                } else if (!lowered.equals("true") && !lowered.equals("false") && !known.contains(name)) {
                    issues.add(owner + ": unknown identifier '" + name + "'");
                }
            } else if (node instanceof Expression.ListLiteral list) {
                list.items().forEach(stack::push);
            } else if (node instanceof Expression.Not not) {
                stack.push(not.operand());
            } else if (node instanceof Expression.Binary binary) {
                stack.push(binary.right());
                stack.push(binary.left());
            } else if (node instanceof Expression.FunctionCall call) {
                if (!call.name().toLowerCase(Locale.ROOT).equals("int")) {
                    issues.add(owner + ": unsupported function '" + call.name() + "'");
                }
                for (int i = call.args().size() - 1; i >= 0; i--) {
                    stack.push(call.args().get(i));
                }
            }
        }
    }
}
