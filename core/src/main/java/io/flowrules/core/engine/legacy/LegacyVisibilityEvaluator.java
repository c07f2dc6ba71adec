package io.flowrules.core.engine.legacy;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionState;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.model.VisibilityState;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Single-pass legacy visibility. For each question with a {@code rules} cell,
 * every {@code if <condition> skip|make ...} clause fires when its condition
 * holds and applies its action to the resolved targets. Skip always wins;
 * optional never downgrades a skip.
 *
 * <p>
 * A condition naming a known question followed by an operator
 * ({@code role in [tank, heal]}) is checked against that question's answer.
 * Any other condition is free text matched against the owning question's own
 * answer variants.
 */
final class LegacyVisibilityEvaluator {

    private final RuleEvents events;

    LegacyVisibilityEvaluator(RuleEvents events) {
        this.events = events;
    }

    VisibilityMap evaluate(List<Question> questions, AnswerBag answers) {
        Map<String, VisibilityState> states = new LinkedHashMap<>();
        for (Question question : questions) {
            states.put(question.qid(), VisibilityState.SHOW);
        }
        Map<String, Set<String>> tokensByQid = LegacyTokens.byQid(answers);
        if (!tokensByQid.isEmpty()) {
            LegacyTargetResolver resolver = new LegacyTargetResolver(questions);
            for (Question question : questions) {
                if (question.rules().isBlank()) {
                    continue;
                }
                Set<String> ownTokens = tokensByQid.get(question.qid());
                if (ownTokens == null) {
                    ownTokens = tokensByQid.get(question.qid().toLowerCase(Locale.ROOT));
                }
                for (LegacyClauses.VisibilityClause clause : LegacyClauses.parseVisibility(question.rules())) {
                    if (!conditionHolds(clause.condition(), ownTokens, resolver, answers)) {
                        continue;
                    }
                    for (String qid : resolver.resolve(clause.targets())) {
                        apply(states, qid, clause, questions);
                    }
                }
            }
        }
        return toVisibilityMap(questions, states);
    }

    private static boolean conditionHolds(
            String condition, Set<String> ownTokens, LegacyTargetResolver resolver, AnswerBag answers) {
        Matcher matcher = LegacyClauses.QID_CONDITION.matcher(condition);
        if (matcher.matches()) {
            String qid = resolver.qidFor(matcher.group("qid"));
            if (qid != null) {
                List<String> candidates = LegacyTokens.candidates(answers.lookup(qid));
                return !candidates.isEmpty()
                        && LegacyConditions.satisfied(matcher.group("op"), candidates, matcher.group("rhs"));
            }
        }
        if (ownTokens == null || ownTokens.isEmpty()) {
            return false;
        }
        for (String variant : LegacyTokens.variants(condition)) {
            if (ownTokens.contains(variant)) {
                return true;
            }
        }
        return false;
    }

    private void apply(
            Map<String, VisibilityState> states,
            String qid,
            LegacyClauses.VisibilityClause clause,
            List<Question> questions) {
        VisibilityState current = states.get(qid);
        if (current == null) {
            return;
        }
        VisibilityState next = current;
        if (clause.action() == LegacyClauses.Action.SKIP) {
            next = VisibilityState.SKIP;
        } else if (current.rank() < VisibilityState.OPTIONAL.rank()) {
            next = VisibilityState.OPTIONAL;
        }
        if (next != current) {
            states.put(qid, next);
            Question question = find(questions, qid);
            events.stateFlip(qid, toState(question, current), toState(question, next), clause.condition());
        }
    }

    private static VisibilityMap toVisibilityMap(List<Question> questions, Map<String, VisibilityState> states) {
        Map<String, QuestionState> resolved = new LinkedHashMap<>();
        for (Question question : questions) {
            resolved.put(question.qid(), toState(question, states.get(question.qid())));
        }
        return new VisibilityMap(resolved);
    }

    private static QuestionState toState(Question question, VisibilityState state) {
        return switch (state) {
            case SKIP -> QuestionState.SKIPPED;
            case OPTIONAL -> new QuestionState(true, false);
            default -> QuestionState.initial(question);
        };
    }

    private static Question find(List<Question> questions, String qid) {
        for (Question question : questions) {
            if (question.qid().equals(qid)) {
                return question;
            }
        }
        throw new IllegalStateException("unknown qid " + qid);
    }
}
