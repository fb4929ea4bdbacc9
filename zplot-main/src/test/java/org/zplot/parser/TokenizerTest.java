package org.zplot.parser;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.zplot.ExpressionLexException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.zplot.parser.TokenKind.COMMA;
import static org.zplot.parser.TokenKind.IDENTIFIER;
import static org.zplot.parser.TokenKind.LEFT_PAREN;
import static org.zplot.parser.TokenKind.NUMBER;
import static org.zplot.parser.TokenKind.OPERATOR;
import static org.zplot.parser.TokenKind.RIGHT_PAREN;

class TokenizerTest {

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }

    @Test
    void tokenize_mixedExpression() {
        List<Token> tokens = Tokenizer.tokenize("pow(z, 2.5) - sin_1*3");
        assertThat(texts(tokens)).containsExactly("pow", "(", "z", ",", "2.5", ")", "-", "sin_1", "*", "3");
        assertThat(kinds(tokens)).containsExactly(
            IDENTIFIER, LEFT_PAREN, IDENTIFIER, COMMA, NUMBER, RIGHT_PAREN, OPERATOR, IDENTIFIER, OPERATOR, NUMBER);
    }

    @Test
    void tokenize_allOperators() {
        assertThat(texts(Tokenizer.tokenize("+-*/^"))).containsExactly("+", "-", "*", "/", "^");
        assertThat(kinds(Tokenizer.tokenize("+-*/^"))).containsOnly(OPERATOR);
    }

    @Test
    void numbers_haveNoSignAndNoExponent() {
        assertThat(texts(Tokenizer.tokenize("-12"))).containsExactly("-", "12");
        assertThat(texts(Tokenizer.tokenize("3."))).containsExactly("3.");
        // "1e5" is the number 1 followed by the identifier e5
        assertThat(kinds(Tokenizer.tokenize("1e5"))).containsExactly(NUMBER, IDENTIFIER);
    }

    @Test
    void numberFollowedByIdentifier_areSeparateTokens() {
        assertThat(texts(Tokenizer.tokenize("2z"))).containsExactly("2", "z");
    }

    @Test
    void whitespace_isRemovedBeforeScanning() {
        assertThat(texts(Tokenizer.tokenize(" si n ( z )\t"))).containsExactly("sin", "(", "z", ")");
        assertThat(texts(Tokenizer.tokenize("1 2"))).containsExactly("12");
    }

    @Test
    void unknownIdentifiers_areStillTokens() {
        assertThat(kinds(Tokenizer.tokenize("w"))).containsExactly(IDENTIFIER);
    }

    @Test
    void positions_pointIntoOriginalInput() {
        List<Token> tokens = Tokenizer.tokenize("  z +  10");
        assertThat(tokens).extracting(Token::position).containsExactly(2, 4, 7);
    }

    @Test
    void emptyInput_isRejected() {
        assertThatThrownBy(() -> Tokenizer.tokenize(""))
            .isInstanceOf(ExpressionLexException.class)
            .satisfies(e -> assertThat(((ExpressionLexException) e).getReason())
                .isEqualTo(ExpressionLexException.Reason.EMPTY_INPUT));
        assertThatThrownBy(() -> Tokenizer.tokenize("  \t\n"))
            .isInstanceOf(ExpressionLexException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> Tokenizer.tokenize(null))
            .isInstanceOf(ExpressionLexException.class);
    }

    @Test
    void invalidCharacter_isRejectedWithPosition() {
        assertThatThrownBy(() -> Tokenizer.tokenize("2 $ 3"))
            .isInstanceOf(ExpressionLexException.class)
            .hasMessageContaining("'$'")
            .satisfies(e -> {
                ExpressionLexException le = (ExpressionLexException) e;
                assertThat(le.getReason()).isEqualTo(ExpressionLexException.Reason.INVALID_CHARACTER);
                assertThat(le.getPosition()).isEqualTo(2);
                assertThat(le.getExpression()).isEqualTo("2 $ 3");
            });
    }

    @Test
    void strayDecimalPoint_isInvalid() {
        assertThatThrownBy(() -> Tokenizer.tokenize(".5"))
            .isInstanceOf(ExpressionLexException.class);
        assertThatThrownBy(() -> Tokenizer.tokenize("1.2.3"))
            .isInstanceOf(ExpressionLexException.class)
            .satisfies(e -> assertThat(((ExpressionLexException) e).getPosition()).isEqualTo(3));
    }

    @Test
    void nonAsciiLetters_areInvalid() {
        assertThatThrownBy(() -> Tokenizer.tokenize("2*π"))
            .isInstanceOf(ExpressionLexException.class);
    }
}
