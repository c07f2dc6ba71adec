package io.flowrules.core.engine.strict;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.error.RuleEvalException;
import io.flowrules.core.error.RuleParseException;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.rule.NavDirective;
import io.flowrules.core.spi.RuleEventListener.GuardReason;
import io.flowrules.core.spi.RuleEventListener.Reason;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Bounded walk over {@code goto_if} edges. From the current question the first
 * directive whose expression holds picks the next question; the walk keeps
 * following the target's own directives up to {@link #MAX_HOPS} jumps.
 *
 * <p>
 * Revisiting a question aborts with no override (cycle), as does exhausting
 * the hop budget (depth). Unknown targets are reported and skipped.
 */
public final class NavigationResolver {

    /** Maximum number of chained jumps per resolution. */
    public static final int MAX_HOPS = 10;

    private final DirectiveCache cache;
    private final RuleEvents events;

    public NavigationResolver(DirectiveCache cache, RuleEvents events) {
        this.cache = cache;
        this.events = events;
    }

    public OptionalInt resolve(int currentIndex, List<Question> questions, AnswerBag answers) {
        if (currentIndex < 0 || currentIndex >= questions.size()) {
            return OptionalInt.empty();
        }
        Map<String, Integer> indexByQid = new HashMap<>();
        for (int i = 0; i < questions.size(); i++) {
            indexByQid.put(questions.get(i).qid(), i);
        }

        Set<String> visited = new HashSet<>();
        OptionalInt next = OptionalInt.empty();
        int index = currentIndex;
        int hops = 0;
        while (hops < MAX_HOPS) {
            Question question = questions.get(index);
            List<NavDirective> directives;
            try {
                directives = cache.navigation(question.navRules(), question.qid());
            } catch (RuleParseException e) {
                events.ruleError(question.qid(), question.navRules(), Reason.PARSE, e.getMessage());
                break;
            }
            Integer target = firstMatch(question, directives, indexByQid, questions, answers);
            if (target == null) {
                break;
            }
            if (visited.contains(questions.get(target).qid())) {
                events.navGuard(visited.size() + 1, GuardReason.CYCLE);
                return OptionalInt.empty();
            }
            visited.add(question.qid());
            next = OptionalInt.of(target);
            index = target;
            hops++;
        }
        if (hops >= MAX_HOPS) {
            events.navGuard(hops, GuardReason.DEPTH);
            return OptionalInt.empty();
        }
        return next;
    }

    private Integer firstMatch(
            Question question,
            List<NavDirective> directives,
            Map<String, Integer> indexByQid,
            List<Question> questions,
            AnswerBag answers) {
        for (NavDirective directive : directives) {
            EvalContext context = EvalContext.navigation(answers, question.qid(), directive.raw());
            boolean matched;
            try {
                matched = ExpressionEvaluator.test(directive.expression(), context);
            } catch (RuleEvalException e) {
                events.ruleError(question.qid(), directive.raw(), Reason.EVAL, e.getMessage());
                continue;
            }
            if (!matched) {
                continue;
            }
            Integer target = indexByQid.get(directive.target());
            if (target == null) {
                events.ruleError(
                        question.qid(), directive.raw(), Reason.RESOLVE, "unknown target " + directive.target());
                continue;
            }
            events.navigation(question.qid(), questions.get(target).qid(), directive.raw());
            return target;
        }
        return null;
    }
}
