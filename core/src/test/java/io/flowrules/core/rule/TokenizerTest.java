package io.flowrules.core.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowrules.core.error.RuleParseException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Tokenizer")
class TokenizerTest {

    private static List<TokenType> types(String text) {
        return Tokenizer.tokenize(text, "q1").stream().map(Token::type).toList();
    }

    @Test
    void scansComparisonWithStringLiteral() {
        List<Token> tokens = Tokenizer.tokenize("q1 = \"Tank\"", "q1");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.NAME, TokenType.EQ, TokenType.STRING);
        assertThat(tokens.get(2).text()).isEqualTo("\"Tank\"");
        assertThat(tokens.get(2).position()).isEqualTo(5);
    }

    @Test
    void keywordsAreCaseInsensitive() {
        assertThat(types("a AND b Or NOT c iN [1]"))
                .containsExactly(
                        TokenType.NAME,
                        TokenType.AND,
                        TokenType.NAME,
                        TokenType.OR,
                        TokenType.NOT,
                        TokenType.NAME,
                        TokenType.IN,
                        TokenType.LBRACKET,
                        TokenType.NUMBER,
                        TokenType.RBRACKET);
    }

    @Test
    void keywordPrefixInsideNameIsStillAName() {
        assertThat(types("order = 1")).containsExactly(TokenType.NAME, TokenType.EQ, TokenType.NUMBER);
        assertThat(types("android")).containsExactly(TokenType.NAME);
    }

    @ParameterizedTest
    @CsvSource({"<=,LE", ">=,GE", "!=,NE", "<,LT", ">,GT", "=,EQ"})
    void scansOperators(String symbol, TokenType expected) {
        assertThat(types("a " + symbol + " 1")).containsExactly(TokenType.NAME, expected, TokenType.NUMBER);
    }

    @Test
    void negativeAndDecimalNumbersAreSingleTokens() {
        List<Token> tokens = Tokenizer.tokenize("power >= -1.5", "q1");

        assertThat(tokens.get(2).type()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(2).text()).isEqualTo("-1.5");
    }

    @Test
    void whitespaceOnlyYieldsNoTokens() {
        assertThat(Tokenizer.tokenize("   \t ", "q1")).isEmpty();
    }

    @Test
    void unterminatedStringIsRejected() {
        assertThatThrownBy(() -> Tokenizer.tokenize("q1 = \"Tank", "q1"))
                .isInstanceOf(RuleParseException.class)
                .hasMessage("unterminated string literal at position 5");
    }

    @Test
    void unrecognizedCharacterIsRejected() {
        assertThatThrownBy(() -> Tokenizer.tokenize("q1 # 2", "q7"))
                .isInstanceOf(RuleParseException.class)
                .hasMessage("unexpected character '#' at position 3")
                .satisfies(e -> assertThat(((RuleParseException) e).qid()).isEqualTo("q7"));
    }
}
