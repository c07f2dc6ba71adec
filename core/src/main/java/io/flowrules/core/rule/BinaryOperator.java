package io.flowrules.core.rule;

/** Binary operators, grouped by precedence level. */
public enum BinaryOperator {
    OR("or"),
    AND("and"),
    IN("in"),
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    /** Maps a comparison token to its operator, or {@code null} if the token is not a comparison. */
    static BinaryOperator comparison(TokenType type) {
        return switch (type) {
            case EQ -> EQ;
            case NE -> NE;
            case LT -> LT;
            case LE -> LE;
            case GT -> GT;
            case GE -> GE;
            default -> null;
        };
    }
}
