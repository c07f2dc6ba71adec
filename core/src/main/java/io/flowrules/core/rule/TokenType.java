package io.flowrules.core.rule;

/** Lexical token kinds of the directive expression language. */
public enum TokenType {
    NUMBER,
    STRING,
    NAME,
    AND,
    OR,
    NOT,
    IN,
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(",");

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** The literal symbol for punctuation and operators, {@code null} otherwise. */
    public String symbol() {
        return symbol;
    }

    /** Resolves an operator or punctuation symbol. */
    static TokenType forSymbol(String symbol) {
        for (TokenType type : values()) {
            if (symbol.equals(type.symbol)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown symbol: " + symbol);
    }
}
