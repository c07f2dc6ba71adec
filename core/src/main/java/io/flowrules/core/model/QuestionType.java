package io.flowrules.core.model;

import java.util.Locale;

/** Answer kinds a question can collect. */
public enum QuestionType {
    SHORT("short"),
    PARAGRAPH("paragraph"),
    NUMBER("number"),
    BOOL("bool"),
    SINGLE_SELECT("single-select"),
    MULTI_SELECT("multi-select"),
    /** A catalog type this library does not model; the row is kept and treated as free text. */
    OTHER("other");

    private final String sheetName;

    QuestionType(String sheetName) {
        this.sheetName = sheetName;
    }

    /** The name used for this type in flow catalogs. */
    public String sheetName() {
        return sheetName;
    }

    /** Returns {@code true} for single- and multi-select questions. */
    public boolean isSelect() {
        return this == SINGLE_SELECT || this == MULTI_SELECT;
    }

    /**
     * Resolves a catalog type cell. {@code multi-select-3} style suffixes are
     * accepted here; the caller extracts the max count separately.
     *
     * @throws IllegalArgumentException if the cell is blank or names no known type
     */
    public static QuestionType fromSheet(String raw) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Question type is required");
        }
        if (text.startsWith("multi-select")) {
            return MULTI_SELECT;
        }
        return switch (text) {
            case "short", "short-text", "text" -> SHORT;
            case "paragraph", "long" -> PARAGRAPH;
            case "number", "numeric" -> NUMBER;
            case "bool", "boolean" -> BOOL;
            case "single-select", "select" -> SINGLE_SELECT;
            default -> throw new IllegalArgumentException("Unknown question type: '" + raw + "'");
        };
    }
}
