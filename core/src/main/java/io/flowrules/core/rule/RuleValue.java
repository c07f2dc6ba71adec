package io.flowrules.core.rule;

import java.util.List;
import java.util.Objects;

/**
 * Runtime value of the directive language: literal text, booleans, the integer
 * produced by {@code int()}, and lists (an identifier evaluates to the list of
 * its answer tokens).
 */
public sealed interface RuleValue {

    /** Truthiness: empty list or blank text is false, non-empty is true, booleans pass through. */
    boolean truthy();

    /** Flattens this value into trimmed, non-blank scalar strings. */
    List<String> scalars();

    RuleValue TRUE = new Bool(true);
    RuleValue FALSE = new Bool(false);

    static RuleValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /** Text literal, including numeric literals which keep their source spelling. */
    record Text(String value) implements RuleValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean truthy() {
            return !value.isBlank();
        }

        @Override
        public List<String> scalars() {
            String trimmed = value.strip();
            return trimmed.isEmpty() ? List.of() : List.of(trimmed);
        }
    }

    /** Boolean literal. Compares as the text {@code True} or {@code False}. */
    record Bool(boolean value) implements RuleValue {
        @Override
        public boolean truthy() {
            return value;
        }

        @Override
        public List<String> scalars() {
            return List.of(value ? "True" : "False");
        }
    }

    record Int(long value) implements RuleValue {
        @Override
        public boolean truthy() {
            return value != 0;
        }

        @Override
        public List<String> scalars() {
            return List.of(Long.toString(value));
        }
    }

    record ListValue(List<RuleValue> items) implements RuleValue {
        public ListValue {
            items = List.copyOf(items);
        }

        /** A list of text values, as produced by answer-token extraction. */
        public static ListValue ofTexts(List<String> texts) {
            return new ListValue(texts.stream().<RuleValue>map(Text::new).toList());
        }

        @Override
        public boolean truthy() {
            for (RuleValue item : items) {
                if (item.truthy()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public List<String> scalars() {
            return items.stream().flatMap(item -> item.scalars().stream()).toList();
        }
    }
}
