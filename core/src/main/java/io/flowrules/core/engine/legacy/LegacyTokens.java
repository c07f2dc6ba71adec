package io.flowrules.core.engine.legacy;

import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.AnswerValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Answer normalization for the legacy engine. Unlike the strict engine's
 * extraction, free-text matching reads every field of a structured answer and
 * compares lowercased, whitespace-collapsed variants.
 */
final class LegacyTokens {

    private LegacyTokens() {}

    /**
     * Lowercased, whitespace-collapsed text plus its hyphen-to-space and
     * underscore-to-space variants. Blank input yields nothing.
     */
    static Set<String> variants(String value) {
        Set<String> variants = new LinkedHashSet<>();
        String text = collapse(value);
        if (text.isEmpty()) {
            return variants;
        }
        variants.add(text);
        variants.add(text.replace('-', ' '));
        variants.add(text.replace('_', ' '));
        variants.removeIf(String::isEmpty);
        return variants;
    }

    /** Token variants for every non-empty answer, keyed by qid and by lowercased qid. */
    static Map<String, Set<String>> byQid(AnswerBag answers) {
        Map<String, Set<String>> tokens = new LinkedHashMap<>();
        for (Map.Entry<String, AnswerValue> entry : answers.entries()) {
            Set<String> collected = collect(entry.getValue());
            if (collected.isEmpty()) {
                continue;
            }
            tokens.put(entry.getKey(), collected);
            tokens.putIfAbsent(entry.getKey().toLowerCase(Locale.ROOT), collected);
        }
        return tokens;
    }

    /** Variants of every scalar anywhere inside {@code answer}. */
    static Set<String> collect(AnswerValue answer) {
        Set<String> tokens = new LinkedHashSet<>();
        if (answer instanceof AnswerValue.Scalar scalar) {
            tokens.addAll(variants(scalar.text()));
        } else if (answer instanceof AnswerValue.Selection selection) {
            for (AnswerValue nested : selection.fields().values()) {
                tokens.addAll(collect(nested));
            }
        } else if (answer instanceof AnswerValue.Nested nested) {
            for (AnswerValue item : nested.items()) {
                tokens.addAll(collect(item));
            }
        }
        return tokens;
    }

    /**
     * Comparison candidates for conditional clauses: for a selection its
     * {@code label}, then its {@code value}, then each {@code values} element.
     */
    static List<String> candidates(AnswerValue answer) {
        List<String> tokens = new ArrayList<>();
        if (answer instanceof AnswerValue.Scalar scalar) {
            addTrimmed(scalar.text(), tokens);
        } else if (answer instanceof AnswerValue.Selection selection) {
            if (selection.label() instanceof AnswerValue.Scalar label) {
                addTrimmed(label.text(), tokens);
            }
            tokens.addAll(candidates(selection.value()));
            if (selection.values() instanceof AnswerValue.Nested nested) {
                for (AnswerValue item : nested.items()) {
                    tokens.addAll(candidates(item));
                }
            }
        } else if (answer instanceof AnswerValue.Nested nested) {
            for (AnswerValue item : nested.items()) {
                tokens.addAll(candidates(item));
            }
        }
        return tokens;
    }

    /** Trimmed, lowercased, internal whitespace runs collapsed to one space. */
    static String collapse(String value) {
        if (value == null) {
            return "";
        }
        return String.join(" ", value.strip().toLowerCase(Locale.ROOT).split("\\s+")).strip();
    }

    private static void addTrimmed(String text, List<String> out) {
        String trimmed = text.strip();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }
}
