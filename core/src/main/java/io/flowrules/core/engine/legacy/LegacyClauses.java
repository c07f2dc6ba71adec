package io.flowrules.core.engine.legacy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The legacy {@code rules} cell grammar. A cell holds clauses separated by
 * newlines or semicolons:
 *
 * <ul>
 * <li>{@code if <condition> skip <targets>}</li>
 * <li>{@code if <condition> make <targets> optional}</li>
 * <li>{@code if <qid> <op> <rhs> [goto <order>] [else goto <order>]}</li>
 * <li>{@code goto <order>}</li>
 * <li>{@code skip order>=X and order<Y}, recognized and ignored</li>
 * </ul>
 */
final class LegacyClauses {

    static final Pattern VISIBILITY =
            Pattern.compile("^if\\s+(?<cond>.+?)\\s+(?<verb>skip|make)\\s+(?<rest>.+)$");

    static final Pattern CONDITIONAL = Pattern.compile(
            "^if\\s+(?<qid>[A-Za-z0-9_]+)\\s+(?<op>in|=|!=|<=|>=|<|>)\\s+(?<rhs>.+?)"
                    + "(?:\\s+goto\\s+(?<goto>[A-Za-z0-9_]+))?"
                    + "(?:\\s+else\\s+goto\\s+(?<gotoElse>[A-Za-z0-9_]+))?$",
            Pattern.CASE_INSENSITIVE);

    static final Pattern RANGE_SKIP =
            Pattern.compile("^skip\\s+order>=(?<lo>[0-9]+)\\s+and\\s+order<(?<hi>[0-9]+)$", Pattern.CASE_INSENSITIVE);

    static final Pattern GOTO = Pattern.compile("^goto\\s+(?<goto>[0-9]+[A-Za-z]?)$", Pattern.CASE_INSENSITIVE);

    /** A condition on another question's answer, inside a visibility clause. */
    static final Pattern QID_CONDITION =
            Pattern.compile("^(?<qid>[a-z0-9_]+)\\s+(?<op>in|=|!=|<=|>=|<|>)\\s+(?<rhs>.+)$");

    private static final Pattern SEPARATOR = Pattern.compile("[\\n;]+");

    private static final String OPTIONAL_SUFFIX = " optional";

    private LegacyClauses() {}

    /** Visibility action of a legacy clause. */
    enum Action {
        SKIP,
        OPTIONAL
    }

    /**
     * A parsed {@code if ... skip|make ...} clause. Text is lowercased and
     * whitespace-collapsed.
     */
    record VisibilityClause(String condition, Action action, List<String> targets) {}

    /** Splits a cell into trimmed, non-empty clauses. */
    static List<String> split(String rules) {
        List<String> clauses = new ArrayList<>();
        if (rules == null) {
            return clauses;
        }
        for (String piece : SEPARATOR.split(rules)) {
            String clause = piece.strip();
            if (!clause.isEmpty()) {
                clauses.add(clause);
            }
        }
        return clauses;
    }

    /** Parses every visibility clause of a cell; other clauses are ignored. */
    static List<VisibilityClause> parseVisibility(String rules) {
        List<VisibilityClause> parsed = new ArrayList<>();
        for (String raw : split(rules)) {
            String clause = LegacyTokens.collapse(raw);
            if (clause.isEmpty()) {
                continue;
            }
            Matcher matcher = VISIBILITY.matcher(clause);
            if (!matcher.matches()) {
                continue;
            }
            String condition = matcher.group("cond").strip();
            String rest = matcher.group("rest").strip();
            Action action = Action.SKIP;
            if (matcher.group("verb").equals("make")) {
                if (rest.endsWith(OPTIONAL_SUFFIX)) {
                    rest = rest.substring(0, rest.length() - OPTIONAL_SUFFIX.length()).strip();
                }
                action = Action.OPTIONAL;
            }
            List<String> targets = splitTargets(rest);
            if (!condition.isEmpty() && !targets.isEmpty()) {
                parsed.add(new VisibilityClause(condition, action, targets));
            }
        }
        return parsed;
    }

    /** Splits a target list on {@code " and "}, {@code &} and commas. */
    static List<String> splitTargets(String text) {
        String cleaned = text.replace(" and ", ",").replace("&", ",");
        List<String> targets = new ArrayList<>();
        for (String token : cleaned.split(",")) {
            String trimmed = token.strip();
            if (!trimmed.isEmpty()) {
                targets.add(trimmed);
            }
        }
        return targets;
    }

    /** Accepts {@code [A, B]} or {@code A,B}. */
    static List<String> parseRhsList(String text) {
        String cleaned = text == null ? "" : text.strip();
        if (cleaned.startsWith("[") && cleaned.endsWith("]")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        List<String> items = new ArrayList<>();
        for (String token : cleaned.split(",")) {
            String trimmed = token.strip();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }
}
