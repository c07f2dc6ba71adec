package io.flowrules.core.engine.legacy;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Evaluates {@code <op> <rhs>} against an answer's candidate tokens. Text
 * operators compare case-insensitively; numeric operators skip candidates
 * that do not parse. Any failure evaluates to {@code false}.
 */
final class LegacyConditions {

    private LegacyConditions() {}

    static boolean satisfied(String op, List<String> candidates, String rhs) {
        String operator = op.toLowerCase(Locale.ROOT);
        if (operator.equals("in")) {
            Set<String> options = new HashSet<>();
            for (String option : LegacyClauses.parseRhsList(rhs)) {
                options.add(option.toLowerCase(Locale.ROOT));
            }
            for (String candidate : candidates) {
                if (options.contains(candidate.strip().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
            return false;
        }

        String expected = rhs.strip().toLowerCase(Locale.ROOT);
        if (operator.equals("=")) {
            return candidates.stream().anyMatch(c -> c.strip().toLowerCase(Locale.ROOT).equals(expected));
        }
        if (operator.equals("!=")) {
            return candidates.stream().noneMatch(c -> c.strip().toLowerCase(Locale.ROOT).equals(expected));
        }

        Double bound = parseNumber(rhs);
        if (bound == null) {
            return false;
        }
        for (String candidate : candidates) {
            Double value = parseNumber(candidate);
            if (value == null) {
                continue;
            }
            if (compare(operator, value, bound)) {
                return true;
            }
        }
        return false;
    }

    private static boolean compare(String operator, double value, double bound) {
        return switch (operator) {
            case "<" -> value < bound;
            case "<=" -> value <= bound;
            case ">" -> value > bound;
            case ">=" -> value >= bound;
            default -> false;
        };
    }

    /** Decimal or exponent notation; {@code null} when unparseable. */
    static Double parseNumber(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty() || !Character.isDigit(trimmed.charAt(trimmed.length() - 1))
                && trimmed.charAt(trimmed.length() - 1) != '.') {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
