package io.flowrules.core.engine.legacy;

import io.flowrules.core.model.Question;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/** Static checks over legacy {@code rules} cells. */
final class LegacyRuleValidator {

    private LegacyRuleValidator() {}

    static List<String> validate(List<Question> questions) {
        List<String> issues = new ArrayList<>();
        if (questions.isEmpty()) {
            return issues;
        }
        LegacyTargetResolver resolver = new LegacyTargetResolver(questions);

        for (Question question : questions) {
            String rules = question.rules().strip();
            if (rules.isEmpty()) {
                continue;
            }
            List<LegacyClauses.VisibilityClause> parsed = LegacyClauses.parseVisibility(rules);
            boolean sawValidClause = !parsed.isEmpty();

            for (LegacyClauses.VisibilityClause clause : parsed) {
                List<String> unresolved = new ArrayList<>();
                Set<String> seen = new HashSet<>();
                for (String target : clause.targets()) {
                    if (!resolver.resolve(List.of(target)).isEmpty() || resolver.hasOrderPrefix(target)) {
                        continue;
                    }
                    if (seen.add(target.strip().toLowerCase(Locale.ROOT))) {
                        unresolved.add(target.strip());
                    }
                }
                if (!unresolved.isEmpty()) {
                    issues.add(question.qid() + ": unknown rule target(s): " + String.join(", ", unresolved));
                }
            }

            for (String clause : LegacyClauses.split(rules)) {
                if (LegacyClauses.RANGE_SKIP.matcher(LegacyTokens.collapse(clause)).matches()) {
                    sawValidClause = true;
                    continue;
                }
                Matcher conditional = LegacyClauses.CONDITIONAL.matcher(clause);
                if (conditional.matches()) {
                    sawValidClause = true;
                    String referenced = conditional.group("qid");
                    if (!resolver.hasQid(referenced)) {
                        issues.add(question.qid() + ": rule references unknown question '" + referenced + "'");
                    }
                    checkOrder(question, conditional.group("goto"), resolver, issues);
                    checkOrder(question, conditional.group("gotoElse"), resolver, issues);
                    continue;
                }
                Matcher gotoMatch = LegacyClauses.GOTO.matcher(clause);
                if (gotoMatch.matches()) {
                    sawValidClause = true;
                    checkOrder(question, gotoMatch.group("goto"), resolver, issues);
                }
            }

            if (!sawValidClause) {
                issues.add(question.qid() + ": no valid rule clauses parsed");
            }
        }
        return issues;
    }

    private static void checkOrder(Question question, String target, LegacyTargetResolver resolver, List<String> issues) {
        if (target != null && !resolver.hasOrder(target)) {
            issues.add(question.qid() + ": rule references unknown order '" + target + "'");
        }
    }
}
