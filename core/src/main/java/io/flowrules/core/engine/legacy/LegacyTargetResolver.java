package io.flowrules.core.engine.legacy;

import io.flowrules.core.model.Question;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves legacy clause targets to qids. A target is tried, in order, as an
 * order prefix wildcard ({@code 12*}), an exact order, a qid, a normalized
 * label and finally a fuzzy label match (suffix or containment).
 */
final class LegacyTargetResolver {

    private static final Pattern LABEL_SANITIZE = Pattern.compile("[^a-z0-9 ]+");

    private final Map<String, List<String>> orderMap = new LinkedHashMap<>();
    private final Map<String, String> qidLookup = new LinkedHashMap<>();
    private final Map<String, String> labelLookup = new LinkedHashMap<>();

    LegacyTargetResolver(List<Question> questions) {
        for (Question question : questions) {
            String orderKey = question.order().strip().toLowerCase(Locale.ROOT);
            if (!orderKey.isEmpty()) {
                orderMap.computeIfAbsent(orderKey, k -> new ArrayList<>()).add(question.qid());
            }
            qidLookup.put(question.qid().toLowerCase(Locale.ROOT), question.qid());
            if (!question.label().isEmpty()) {
                labelLookup.put(normaliseLabel(question.label()), question.qid());
            }
        }
    }

    /** All qids matched by {@code targets}; unmatched targets contribute nothing. */
    Set<String> resolve(List<String> targets) {
        Set<String> resolved = new LinkedHashSet<>();
        for (String target : targets) {
            resolveOne(target, resolved);
        }
        return resolved;
    }

    private void resolveOne(String target, Set<String> resolved) {
        String normalized = normaliseTarget(target);
        if (normalized.isEmpty()) {
            return;
        }
        if (normalized.endsWith("*")) {
            String base = normalized.substring(0, normalized.length() - 1);
            orderMap.forEach((orderKey, qids) -> {
                if (orderKey.startsWith(base)) {
                    resolved.addAll(qids);
                }
            });
            return;
        }
        List<String> byOrder = orderMap.get(normalized);
        if (byOrder != null) {
            resolved.addAll(byOrder);
            return;
        }
        String qid = qidLookup.get(normalized);
        if (qid != null) {
            resolved.add(qid);
            return;
        }
        String labelKey = normaliseLabel(normalized);
        String direct = labelLookup.get(labelKey);
        if (direct != null) {
            resolved.add(direct);
            return;
        }
        if (labelKey.isEmpty()) {
            return;
        }
        labelLookup.forEach((key, candidate) -> {
            if (key.isEmpty()) {
                return;
            }
            if (key.equals(labelKey)
                    || key.endsWith(labelKey)
                    || labelKey.endsWith(key)
                    || key.contains(labelKey)) {
                resolved.add(candidate);
            }
        });
    }

    /** {@code true} when some question is keyed by the lowercased order token. */
    boolean hasOrder(String order) {
        return orderMap.containsKey(order.strip().toLowerCase(Locale.ROOT));
    }

    boolean hasQid(String qid) {
        return qidLookup.containsKey(qid.toLowerCase(Locale.ROOT));
    }

    /** Canonical qid for a case-insensitive reference, or {@code null}. */
    String qidFor(String reference) {
        return qidLookup.get(reference.toLowerCase(Locale.ROOT));
    }

    /** {@code true} when a wildcard target's prefix matches some order key. */
    boolean hasOrderPrefix(String target) {
        String normalized = normaliseTarget(target);
        if (!normalized.endsWith("*")) {
            return false;
        }
        String base = normalized.substring(0, normalized.length() - 1);
        return orderMap.keySet().stream().anyMatch(order -> order.startsWith(base));
    }

    static String normaliseTarget(String target) {
        String normalized = target.strip().toLowerCase(Locale.ROOT);
        int end = normalized.length();
        while (end > 0 && normalized.charAt(end - 1) == '.') {
            end--;
        }
        return normalized.substring(0, end);
    }

    static String normaliseLabel(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return LABEL_SANITIZE.matcher(LegacyTokens.collapse(value)).replaceAll("");
    }
}
