package io.flowrules.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An answer as produced by the question UI. All variants are known at compile
 * time; rule engines reduce them to string tokens through a single extraction
 * function ({@link AnswerTokens} for the strict engine).
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface AnswerValue {

    /** Returns {@code true} for the {@link Empty} variant. */
    default boolean isEmpty() {
        return this instanceof Empty;
    }

    /** Shared empty answer. */
    AnswerValue EMPTY = new Empty();

    // ── Variants ──

    /** No answer. */
    record Empty() implements AnswerValue {}

    /** Free text, a number typed as text, or a boolean rendered as text. */
    record Scalar(String text) implements AnswerValue {
        public Scalar {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * A structured select answer: {@code {value, label}} for single-select or
     * {@code {values: [...]}} for multi-select. Other keys are kept so the
     * legacy engine, which reads every field, sees them.
     */
    record Selection(Map<String, AnswerValue> fields) implements AnswerValue {
        public Selection {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public AnswerValue field(String name) {
            AnswerValue value = fields.get(name);
            return value != null ? value : EMPTY;
        }

        public AnswerValue value() {
            return field("value");
        }

        public AnswerValue label() {
            return field("label");
        }

        /** The {@code values} field, or {@code null} when absent. */
        public AnswerValue values() {
            return fields.get("values");
        }
    }

    /** An ordered collection of answers, possibly nested. */
    record Nested(List<AnswerValue> items) implements AnswerValue {
        public Nested {
            items = List.copyOf(items);
        }
    }

    // ── Factories ──

    static AnswerValue text(String text) {
        return text == null ? EMPTY : new Scalar(text);
    }

    static AnswerValue choice(String value, String label) {
        Map<String, AnswerValue> fields = new LinkedHashMap<>();
        fields.put("value", text(value));
        fields.put("label", text(label));
        return new Selection(fields);
    }

    static AnswerValue choices(String... values) {
        List<AnswerValue> items = new ArrayList<>();
        for (String value : values) {
            items.add(text(value));
        }
        return new Selection(Map.of("values", new Nested(items)));
    }

    static AnswerValue list(AnswerValue... items) {
        return new Nested(List.of(items));
    }

    /**
     * Converts an arbitrary Java value: {@code null}, {@link String},
     * {@link Number}, {@link Boolean}, {@link Map} or {@link Iterable}.
     * Already-converted {@link AnswerValue}s pass through.
     */
    static AnswerValue of(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof AnswerValue answer) {
            return answer;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, AnswerValue> fields = new LinkedHashMap<>();
            map.forEach((key, value) -> fields.put(String.valueOf(key), of(value)));
            return new Selection(fields);
        }
        if (raw instanceof Iterable<?> iterable) {
            List<AnswerValue> items = new ArrayList<>();
            iterable.forEach(item -> items.add(of(item)));
            return new Nested(items);
        }
        if (raw instanceof Boolean flag) {
            return new Scalar(booleanText(flag));
        }
        return new Scalar(String.valueOf(raw));
    }

    /** Converts a Jackson tree node. {@code null}, JSON null and missing nodes map to {@link #EMPTY}. */
    static AnswerValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (node.isObject()) {
            Map<String, AnswerValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), fromJson(entry.getValue()));
            }
            return new Selection(fields);
        }
        if (node.isArray()) {
            List<AnswerValue> items = new ArrayList<>();
            node.forEach(item -> items.add(fromJson(item)));
            return new Nested(items);
        }
        if (node.isBoolean()) {
            return new Scalar(booleanText(node.booleanValue()));
        }
        return new Scalar(node.asText());
    }

    /** Booleans are stored as {@code True} / {@code False}, the spelling rule literals compare against. */
    private static String booleanText(boolean flag) {
        return flag ? "True" : "False";
    }
}
