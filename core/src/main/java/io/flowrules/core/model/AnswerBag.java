package io.flowrules.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collected answers keyed by {@code qid}. Immutable; every engine call reads a
 * snapshot and never writes back.
 */
public final class AnswerBag {

    private static final AnswerBag EMPTY = new AnswerBag(Map.of());

    private final Map<String, AnswerValue> answers;

    private AnswerBag(Map<String, AnswerValue> answers) {
        this.answers = Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }

    public static AnswerBag empty() {
        return EMPTY;
    }

    /**
     * Creates a bag from plain Java values, converted with
     * {@link AnswerValue#of(Object)}.
     */
    public static AnswerBag of(Map<String, ?> raw) {
        Map<String, AnswerValue> converted = new LinkedHashMap<>();
        raw.forEach((qid, value) -> converted.put(qid, AnswerValue.of(value)));
        return new AnswerBag(converted);
    }

    /** Shorthand for a single text answer. */
    public static AnswerBag of(String qid, String text) {
        return new AnswerBag(Map.of(qid, AnswerValue.text(text)));
    }

    /**
     * Creates a bag from a JSON object.
     *
     * @throws IllegalArgumentException if {@code node} is not a JSON object
     */
    public static AnswerBag fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Answers payload must be a JSON object");
        }
        Map<String, AnswerValue> converted = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            converted.put(entry.getKey(), AnswerValue.fromJson(entry.getValue()));
        }
        return new AnswerBag(converted);
    }

    /** Returns a copy with one answer added or replaced. */
    public AnswerBag with(String qid, AnswerValue value) {
        Map<String, AnswerValue> copy = new LinkedHashMap<>(answers);
        copy.put(qid, value);
        return new AnswerBag(copy);
    }

    /** The answer stored under exactly {@code qid}, or {@link AnswerValue#EMPTY}. */
    public AnswerValue get(String qid) {
        AnswerValue value = answers.get(qid);
        return value != null ? value : AnswerValue.EMPTY;
    }

    /**
     * The answer for {@code qid}, falling back to the lowercased key when the
     * exact key holds nothing.
     */
    public AnswerValue lookup(String qid) {
        AnswerValue value = get(qid);
        if (value.isEmpty()) {
            value = get(qid.toLowerCase(Locale.ROOT));
        }
        return value;
    }

    public boolean isEmpty() {
        return answers.isEmpty();
    }

    public Set<Map.Entry<String, AnswerValue>> entries() {
        return answers.entrySet();
    }

    public Map<String, AnswerValue> asMap() {
        return answers;
    }

    @Override
    public String toString() {
        return "AnswerBag" + answers;
    }
}
