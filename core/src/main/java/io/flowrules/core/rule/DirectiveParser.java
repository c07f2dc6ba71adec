package io.flowrules.core.rule;

import io.flowrules.core.error.RuleParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts directives from a rule cell. The cell is split into clauses on
 * newlines and semicolons that sit outside string literals; blank clauses
 * are ignored.
 *
 * <ul>
 * <li>visibility: {@code skip_if(expr)}, {@code optional_if(expr)},
 * {@code require_if(expr)}, {@code show_if(expr)}, each with an optional
 * {@code , target=<qid>}</li>
 * <li>navigation: {@code goto_if(expr, target=<qid>)}</li>
 * </ul>
 *
 * <p>
 * Any clause that does not match its grammar fails the whole cell with a
 * {@link RuleParseException}.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class DirectiveParser {

    private static final Pattern VISIBILITY_PATTERN =
            Pattern.compile("^(?<kind>skip|optional|require|show)_if\\((?<body>.+)\\)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAV_PATTERN = Pattern.compile("^goto_if\\((?<body>.+)\\)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TARGET_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");

    private DirectiveParser() {}

    /**
     * Parses a {@code visibility_rules} cell.
     *
     * @param text cell text; {@code null} or blank yields no directives
     * @param qid  owning question
     * @throws RuleParseException if any clause is malformed
     */
    public static List<VisibilityDirective> parseVisibility(String text, String qid) {
        List<VisibilityDirective> directives = new ArrayList<>();
        for (String clause : splitClauses(text)) {
            Matcher matcher = VISIBILITY_PATTERN.matcher(clause);
            if (!matcher.matches()) {
                throw new RuleParseException("unsupported visibility directive: " + clause, qid, clause);
            }
            DirectiveKind kind = DirectiveKind.fromKeyword(matcher.group("kind"));
            Arguments args = splitArguments(matcher.group("body").strip(), qid, clause);
            Expression expression = ExpressionParser.parse(args.expression(), qid);
            directives.add(new VisibilityDirective(kind, expression, clause, args.target()));
        }
        return directives;
    }

    /**
     * Parses a {@code nav_rules} cell.
     *
     * @param text cell text; {@code null} or blank yields no directives
     * @param qid  owning question
     * @throws RuleParseException if any clause is malformed or lacks a target
     */
    public static List<NavDirective> parseNavigation(String text, String qid) {
        List<NavDirective> directives = new ArrayList<>();
        for (String clause : splitClauses(text)) {
            Matcher matcher = NAV_PATTERN.matcher(clause);
            if (!matcher.matches()) {
                throw new RuleParseException("unsupported navigation directive: " + clause, qid, clause);
            }
            Arguments args = splitArguments(matcher.group("body").strip(), qid, clause);
            if (args.target() == null) {
                throw new RuleParseException("goto_if directive missing target", qid, clause);
            }
            Expression expression = ExpressionParser.parse(args.expression(), qid);
            directives.add(new NavDirective(args.target(), expression, clause));
        }
        return directives;
    }

    /** Splits on newlines and semicolons outside quotes; trims and drops blank clauses. */
    static List<String> splitClauses(String text) {
        List<String> clauses = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return clauses;
        }
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                current.append(ch);
                if (ch == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
                current.append(ch);
            } else if (ch == '\n' || ch == '\r' || ch == ';') {
                addClause(clauses, current);
            } else {
                current.append(ch);
            }
        }
        addClause(clauses, current);
        return clauses;
    }

    private static void addClause(List<String> clauses, StringBuilder current) {
        String clause = current.toString().strip();
        if (!clause.isEmpty()) {
            clauses.add(clause);
        }
        current.setLength(0);
    }

    /** Expression text plus optional {@code target=} argument. */
    record Arguments(String expression, String target) {}

    /** Splits a directive body on top-level commas (outside brackets and quotes). */
    static Arguments splitArguments(String body, String qid, String clause) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (quote != 0) {
                current.append(ch);
                if (ch == '\\' && i + 1 < body.length()) {
                    current.append(body.charAt(++i));
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '(' || ch == '[') {
                depth++;
            } else if (ch == ')' || ch == ']') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ',' && depth == 0) {
                parts.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        parts.add(current.toString().strip());

        String target = null;
        for (String fragment : parts.subList(1, parts.size())) {
            int eq = fragment.indexOf('=');
            String key = eq < 0 ? fragment : fragment.substring(0, eq).strip();
            if (eq < 0 || !key.toLowerCase(Locale.ROOT).equals("target")) {
                throw new RuleParseException("unexpected directive argument: " + fragment, qid, clause);
            }
            target = parseTarget(fragment.substring(eq + 1), qid, clause);
        }
        return new Arguments(parts.get(0), target);
    }

    private static String parseTarget(String fragment, String qid, String clause) {
        String text = fragment.strip();
        if (text.length() >= 2
                && (text.startsWith("\"") || text.startsWith("'"))
                && (text.endsWith("\"") || text.endsWith("'"))) {
            text = text.substring(1, text.length() - 1);
        }
        if (!TARGET_PATTERN.matcher(text).matches()) {
            throw new RuleParseException("invalid target: " + fragment.strip(), qid, clause);
        }
        return text;
    }
}
