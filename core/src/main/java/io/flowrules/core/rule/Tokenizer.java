package io.flowrules.core.rule;

import io.flowrules.core.error.RuleParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns expression text into a flat token list. Whitespace is insignificant;
 * {@code and}, {@code or}, {@code not} and {@code in} are case-insensitive
 * keywords when they appear as bare names.
 *
 * <p>
 * Unlike a skip-on-mismatch regex scan, any character that starts no token
 * (including the opening quote of an unterminated string) is rejected with a
 * {@link RuleParseException}.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class Tokenizer {

    private static final Pattern TOKEN = Pattern.compile("\\s*(?:"
            + "(?<number>-?\\d+(?:\\.\\d+)?)"
            + "|(?<string>'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\")"
            + "|(?<op><=|>=|!=|=|<|>|\\(|\\)|\\[|\\]|,)"
            + "|(?<name>[A-Za-z_][A-Za-z0-9_]*)"
            + ")");

    private static final Pattern TRAILING_BLANK = Pattern.compile("\\s*");

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not", "in");

    private Tokenizer() {}

    /**
     * Scans {@code text} into tokens.
     *
     * @param text expression source
     * @param qid  owning question, for error reporting
     * @throws RuleParseException on an unterminated string or unrecognised character
     */
    public static List<Token> tokenize(String text, String qid) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        int position = 0;
        while (position < text.length()) {
            matcher.region(position, text.length());
            if (!matcher.lookingAt() || matcher.end() == position) {
                if (TRAILING_BLANK.matcher(text.substring(position)).matches()) {
                    break;
                }
                throw unexpected(text, position, qid);
            }
            tokens.add(toToken(matcher));
            position = matcher.end();
        }
        return tokens;
    }

    private static Token toToken(Matcher matcher) {
        if (matcher.group("number") != null) {
            return new Token(TokenType.NUMBER, matcher.group("number"), matcher.start("number"));
        }
        if (matcher.group("string") != null) {
            return new Token(TokenType.STRING, matcher.group("string"), matcher.start("string"));
        }
        if (matcher.group("op") != null) {
            String symbol = matcher.group("op");
            return new Token(TokenType.forSymbol(symbol), symbol, matcher.start("op"));
        }
        String name = matcher.group("name");
        String lowered = name.toLowerCase(Locale.ROOT);
        if (KEYWORDS.contains(lowered)) {
            return new Token(TokenType.valueOf(lowered.toUpperCase(Locale.ROOT)), lowered, matcher.start("name"));
        }
        return new Token(TokenType.NAME, name, matcher.start("name"));
    }

    private static RuleParseException unexpected(String text, int position, String qid) {
        int offset = position;
        while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
            offset++;
        }
        char ch = text.charAt(offset);
        if (ch == '"' || ch == '\'') {
            return new RuleParseException("unterminated string literal at position " + offset, qid, text);
        }
        return new RuleParseException(
                String.format("unexpected character '%s' at position %d", ch, offset), qid, text);
    }
}
