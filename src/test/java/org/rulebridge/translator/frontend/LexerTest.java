package org.rulebridge.translator.frontend;

import org.rulebridge.translator.frontend.lexer.Lexer;
import org.rulebridge.translator.frontend.lexer.Token;
import org.rulebridge.translator.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the statement {@link Lexer}.
 * These tests verify that statement text is converted into the expected token stream.
 */
public class LexerTest {

    /**
     * Verifies the tokenization of a typical rule block body.
     */
    @Test
    @Tag("unit")
    void tokenizesRuleBlockBody() {
        // Arrange
        Lexer lexer = new Lexer("{ WIDTH METAL1 <= 0.5 }", 7);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.OPERATOR, TokenType.NUMBER, TokenType.RIGHT_BRACE, TokenType.END_OF_STATEMENT);
        assertThat(tokens.get(3)).extracting(Token::type, Token::text).containsExactly(TokenType.OPERATOR, "<=");
        assertThat(tokens.get(4)).extracting(Token::text, Token::line).containsExactly("0.5", 7);
    }

    @Test
    @Tag("unit")
    void loneEqualsIsAnAssignmentToken() {
        List<Token> tokens = new Lexer("A = AND B C", 1).scanTokens();

        assertThat(tokens.get(1)).extracting(Token::type, Token::text).containsExactly(TokenType.EQUALS, "=");
    }

    @Test
    @Tag("unit")
    void doubleEqualsIsAnOperator() {
        List<Token> tokens = new Lexer("WIDTH M1 == 1", 1).scanTokens();

        assertThat(tokens.get(2)).extracting(Token::type, Token::text).containsExactly(TokenType.OPERATOR, "==");
    }

    /**
     * A literal such as {@code 1.2.3} is delimited as a single NUMBER token; rejecting it is left to the parser.
     */
    @Test
    @Tag("unit")
    void malformedNumberIsOneToken() {
        List<Token> tokens = new Lexer("1.2.3 .5", 1).scanTokens();

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.NUMBER, "1.2.3"),
                tuple(TokenType.NUMBER, ".5"),
                tuple(TokenType.END_OF_STATEMENT, ""));
    }

    @Test
    @Tag("unit")
    void digitLedWordIsAnIdentifier() {
        List<Token> tokens = new Lexer("ENC 2VIA 1M > 0.05", 1).scanTokens();

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "ENC"),
                tuple(TokenType.IDENTIFIER, "2VIA"),
                tuple(TokenType.IDENTIFIER, "1M"),
                tuple(TokenType.OPERATOR, ">"),
                tuple(TokenType.NUMBER, "0.05"),
                tuple(TokenType.END_OF_STATEMENT, ""));
    }

    @Test
    @Tag("unit")
    void tracksLinesAcrossNewlines() {
        List<Token> tokens = new Lexer("{\n  ENC VIA1 METAL1 > 0.1\n}", 3).scanTokens();

        assertThat(tokens).filteredOn(t -> t.isKeyword("ENC")).singleElement()
                .extracting(Token::line, Token::column).containsExactly(4, 3);
    }

    @Test
    @Tag("unit")
    void unknownCharactersBecomeOtherTokens() {
        List<Token> tokens = new Lexer("M1.W", 1).scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.OTHER, TokenType.IDENTIFIER, TokenType.END_OF_STATEMENT);
    }
}
