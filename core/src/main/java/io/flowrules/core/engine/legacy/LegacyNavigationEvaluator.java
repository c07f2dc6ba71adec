package io.flowrules.core.engine.legacy;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.AnswerValue;
import io.flowrules.core.model.Question;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;

/**
 * Legacy jumps from the current question's {@code rules} cell. Clauses are
 * tried in order; the first that yields a resolvable order wins. There is no
 * chaining: the jump target's own clauses are not followed.
 */
final class LegacyNavigationEvaluator {

    private final RuleEvents events;

    LegacyNavigationEvaluator(RuleEvents events) {
        this.events = events;
    }

    OptionalInt nextIndex(int currentIndex, List<Question> questions, AnswerBag answers) {
        if (currentIndex < 0 || currentIndex >= questions.size()) {
            return OptionalInt.empty();
        }
        Question question = questions.get(currentIndex);
        for (String clause : LegacyClauses.split(question.rules())) {
            String lowered = clause.toLowerCase(Locale.ROOT);
            if (lowered.startsWith("skip ") && LegacyClauses.RANGE_SKIP.matcher(lowered).matches()) {
                continue;
            }

            Matcher gotoMatch = LegacyClauses.GOTO.matcher(clause);
            if (gotoMatch.matches()) {
                OptionalInt jump = jump(question, questions, gotoMatch.group("goto"), clause);
                if (jump.isPresent()) {
                    return jump;
                }
                continue;
            }

            Matcher matcher = LegacyClauses.CONDITIONAL.matcher(clause);
            if (!matcher.matches()) {
                continue;
            }
            AnswerValue value = answers.lookup(matcher.group("qid"));
            if (value.isEmpty()) {
                continue;
            }
            List<String> candidates = LegacyTokens.candidates(value);
            if (candidates.isEmpty()) {
                continue;
            }
            String target = LegacyConditions.satisfied(matcher.group("op"), candidates, matcher.group("rhs"))
                    ? matcher.group("goto")
                    : matcher.group("gotoElse");
            OptionalInt jump = jump(question, questions, target, clause);
            if (jump.isPresent()) {
                return jump;
            }
        }
        return OptionalInt.empty();
    }

    private OptionalInt jump(Question from, List<Question> questions, String target, String clause) {
        int index = indexForOrder(questions, target);
        if (index < 0) {
            return OptionalInt.empty();
        }
        events.navigation(from.qid(), questions.get(index).qid(), clause);
        return OptionalInt.of(index);
    }

    /** First question whose order or qid equals {@code token}, case-insensitively; {@code -1} if none. */
    static int indexForOrder(List<Question> questions, String token) {
        if (token == null || token.isBlank()) {
            return -1;
        }
        String needle = token.strip().toLowerCase(Locale.ROOT);
        for (int i = 0; i < questions.size(); i++) {
            Question question = questions.get(i);
            if (question.order().strip().toLowerCase(Locale.ROOT).equals(needle)
                    || question.qid().strip().toLowerCase(Locale.ROOT).equals(needle)) {
                return i;
            }
        }
        return -1;
    }
}
