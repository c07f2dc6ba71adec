package io.flowrules.core.engine.strict;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.error.RuleEvalException;
import io.flowrules.core.error.RuleParseException;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionState;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.rule.VisibilityDirective;
import io.flowrules.core.spi.RuleEventListener.Reason;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-point visibility resolution. Every question starts visible with its
 * declared requiredness; passes over all questions and all their directives
 * repeat until a pass changes nothing, or {@link #MAX_PASSES} is reached.
 *
 * <p>
 * A question whose rule cell fails to parse keeps its initial state. A
 * directive that fails to evaluate is treated as not matched.
 */
public final class VisibilityResolver {

    /** Upper bound on resolution passes; guarantees termination for cyclic rules. */
    public static final int MAX_PASSES = 5;

    private final DirectiveCache cache;
    private final RuleEvents events;

    public VisibilityResolver(DirectiveCache cache, RuleEvents events) {
        this.cache = cache;
        this.events = events;
    }

    public VisibilityMap resolve(List<Question> questions, AnswerBag answers) {
        Map<String, QuestionState> states = new LinkedHashMap<>();
        for (Question question : questions) {
            states.put(question.qid(), QuestionState.initial(question));
        }
        Map<String, List<VisibilityDirective>> directivesByQid = parseAll(questions, states);

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean changed = false;
            for (Question question : questions) {
                for (VisibilityDirective directive : directivesByQid.get(question.qid())) {
                    EvalContext context = EvalContext.visibility(answers, question.qid(), directive.raw());
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
                    String subject = directive.subject(question.qid());
                    QuestionState current = states.get(subject);
                    QuestionState next = directive.kind().apply(current);
                    if (!next.equals(current)) {
                        states.put(subject, next);
                        changed = true;
                        events.stateFlip(subject, current, next, directive.raw());
                    }
                }
            }
            if (!changed) {
                break;
            }
        }
        return new VisibilityMap(states);
    }

    private Map<String, List<VisibilityDirective>> parseAll(
            List<Question> questions, Map<String, QuestionState> states) {
        Map<String, List<VisibilityDirective>> result = new LinkedHashMap<>();
        for (Question question : questions) {
            List<VisibilityDirective> usable = new ArrayList<>();
            try {
                for (VisibilityDirective directive : cache.visibility(question.visibilityRules(), question.qid())) {
                    if (directive.target() != null && !states.containsKey(directive.target())) {
                        events.ruleError(
                                question.qid(),
                                directive.raw(),
                                Reason.RESOLVE,
                                "unknown target " + directive.target());
                        continue;
                    }
                    usable.add(directive);
                }
            } catch (RuleParseException e) {
                events.ruleError(question.qid(), question.visibilityRules(), Reason.PARSE, e.getMessage());
                usable.clear();
            }
            result.put(question.qid(), usable);
        }
        return result;
    }
}
