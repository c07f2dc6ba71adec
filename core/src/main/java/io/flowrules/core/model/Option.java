package io.flowrules.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Selectable option with a canonical token value.
 *
 * @param label display text
 * @param value canonical token: lowercase words joined by {@code -}
 */
public record Option(String label, String value) {

    public Option {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /** Builds an option from display text, deriving the canonical value. */
    public static Option canonical(String label) {
        String display = label.trim();
        String token = String.join("-", display.toLowerCase(Locale.ROOT).split("\\s+"));
        return new Option(display, token);
    }
}
