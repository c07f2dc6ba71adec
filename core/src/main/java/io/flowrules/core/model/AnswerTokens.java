package io.flowrules.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces an {@link AnswerValue} to the ordered list of string tokens the
 * strict rule language compares against. This is the only place that knows
 * about answer shapes.
 */
public final class AnswerTokens {

    private AnswerTokens() {}

    /**
     * Extracts tokens: a scalar yields its trimmed text (nothing when blank);
     * a selection yields its {@code value}, then {@code label}, then the
     * tokens of each {@code values} element; a nested collection yields the
     * tokens of each item in order.
     */
    public static List<String> extract(AnswerValue answer) {
        List<String> tokens = new ArrayList<>();
        collect(answer, tokens);
        return tokens;
    }

    private static void collect(AnswerValue answer, List<String> out) {
        if (answer instanceof AnswerValue.Scalar scalar) {
            addTrimmed(scalar.text(), out);
        } else if (answer instanceof AnswerValue.Selection selection) {
            // only textual value/label count
            if (selection.value() instanceof AnswerValue.Scalar value) {
                addTrimmed(value.text(), out);
            }
            if (selection.label() instanceof AnswerValue.Scalar label) {
                addTrimmed(label.text(), out);
            }
            if (selection.values() instanceof AnswerValue.Nested nested) {
                for (AnswerValue item : nested.items()) {
                    collect(item, out);
                }
            }
        } else if (answer instanceof AnswerValue.Nested nested) {
            for (AnswerValue item : nested.items()) {
                collect(item, out);
            }
        }
    }

    private static void addTrimmed(String text, List<String> out) {
        String trimmed = text.strip();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }
}
