package io.flowrules.core.rule;

import io.flowrules.core.error.RuleParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for directive expressions.
 *
 * <p>
 * Precedence, lowest to highest: {@code or}, {@code and}, {@code not},
 * comparison ({@code = != < <= > >= in}), primary. The right operand of
 * {@code in} must be a list literal. Inside a list literal a bare name is
 * read as text, so {@code role in [tank, heal]} compares against the strings
 * {@code tank} and {@code heal}.
 *
 * <p>
 * Input is bounded: more than {@link #MAX_TOKENS} tokens or more than
 * {@link #MAX_DEPTH} levels of nesting (parentheses, lists, call arguments,
 * {@code not} chains) is a parse error rather than a stack overflow.
 *
 * <p>
 * Not thread-safe: one instance per parse. Use {@link #parse(String, String)}.
 */
public final class ExpressionParser {

    /** Maximum nesting of sub-expressions. */
    public static final int MAX_DEPTH = 64;

    /** Maximum number of tokens in one expression. */
    public static final int MAX_TOKENS = 2048;

    private final List<Token> tokens;
    private final String source;
    private final String qid;
    private int index;
    private int depth;

    private ExpressionParser(List<Token> tokens, String source, String qid) {
        this.tokens = tokens;
        this.source = source;
        this.qid = qid;
    }

    /**
     * Parses a complete expression; trailing tokens are an error.
     *
     * @param text expression source
     * @param qid  owning question, for error reporting
     * @throws RuleParseException if the text is not a valid expression
     */
    public static Expression parse(String text, String qid) {
        List<Token> tokens = Tokenizer.tokenize(text, qid);
        if (tokens.size() > MAX_TOKENS) {
            throw new RuleParseException(
                    "expression exceeds " + MAX_TOKENS + " tokens (" + tokens.size() + ")", qid, text);
        }
        ExpressionParser parser = new ExpressionParser(tokens, text, qid);
        Expression expression = parser.parseOr();
        if (parser.peek() != null) {
            throw parser.error("unexpected trailing tokens starting at '" + parser.peek().text() + "'");
        }
        return expression;
    }

    private Expression parseOr() {
        enter();
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            left = new Expression.Binary(BinaryOperator.OR, left, parseAnd());
        }
        depth--;
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (match(TokenType.AND)) {
            left = new Expression.Binary(BinaryOperator.AND, left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            enter();
            Expression operand = parseNot();
            depth--;
            return new Expression.Not(operand);
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseTerm();
        while (true) {
            Token token = peek();
            if (token == null) {
                return left;
            }
            if (token.type() == TokenType.IN) {
                advance();
                Token next = peek();
                if (next == null || next.type() != TokenType.LBRACKET) {
                    throw error("'in' requires a list literal on the right");
                }
                left = new Expression.Binary(BinaryOperator.IN, left, parseList());
                continue;
            }
            BinaryOperator operator = BinaryOperator.comparison(token.type());
            if (operator == null) {
                return left;
            }
            advance();
            left = new Expression.Binary(operator, left, parseTerm());
        }
    }

    private Expression.ListLiteral parseList() {
        expect(TokenType.LBRACKET);
        List<Expression> items = new ArrayList<>();
        if (match(TokenType.RBRACKET)) {
            return new Expression.ListLiteral(items);
        }
        while (true) {
            Expression element = parseOr();
            if (element instanceof Expression.Identifier identifier) {
                element = new Expression.Literal(new RuleValue.Text(identifier.name()));
            }
            items.add(element);
            if (match(TokenType.COMMA)) {
                continue;
            }
            expect(TokenType.RBRACKET);
            return new Expression.ListLiteral(items);
        }
    }

    private Expression parseTerm() {
        Token token = peek();
        if (token == null) {
            throw error("unexpected end of expression");
        }
        return switch (token.type()) {
            case LPAREN -> {
                advance();
                Expression inner = parseOr();
                expect(TokenType.RPAREN);
                yield inner;
            }
            case LBRACKET -> parseList();
            case NUMBER -> {
                advance();
                yield new Expression.Literal(new RuleValue.Text(token.text()));
            }
            case STRING -> {
                advance();
                yield new Expression.Literal(new RuleValue.Text(unquote(token.text())));
            }
            case NAME -> {
                advance();
                yield parseName(token.text());
            }
            default -> throw error("unexpected token: " + token.text());
        };
    }

    private Expression parseName(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        if (lowered.equals("true") || lowered.equals("false")) {
            return new Expression.Literal(RuleValue.of(lowered.equals("true")));
        }
        if (!match(TokenType.LPAREN)) {
            return new Expression.Identifier(name);
        }
        List<Expression> args = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return new Expression.FunctionCall(name, args);
        }
        while (true) {
            args.add(parseOr());
            if (match(TokenType.COMMA)) {
                continue;
            }
            expect(TokenType.RPAREN);
            return new Expression.FunctionCall(name, args);
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("expression nested deeper than " + MAX_DEPTH + " levels");
        }
    }

    // --- Token stream ---

    private Token peek() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private Token advance() {
        Token token = peek();
        if (token != null) {
            index++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        Token token = peek();
        if (token != null && token.type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        Token token = advance();
        if (token == null || token.type() != type) {
            String expected = type.symbol() != null ? "'" + type.symbol() + "'" : type.name();
            String found = token == null ? "end of expression" : "'" + token.text() + "'";
            throw error("expected " + expected + " but found " + found);
        }
        return token;
    }

    private RuleParseException error(String message) {
        return new RuleParseException(message, qid, source);
    }

    /** Strips matching quotes and resolves backslash escapes. */
    static String unquote(String text) {
        if (text.length() < 2) {
            return text;
        }
        char quote = text.charAt(0);
        if ((quote != '"' && quote != '\'') || text.charAt(text.length() - 1) != quote) {
            return text;
        }
        String body = text.substring(1, text.length() - 1);
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                out.append(ch);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                default -> out.append(escaped);
            }
        }
        return out.toString();
    }
}
