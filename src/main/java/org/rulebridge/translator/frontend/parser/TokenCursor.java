package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.frontend.lexer.Token;
import org.rulebridge.translator.frontend.lexer.TokenType;

import java.util.List;

/**
 * A read position over the tokens of one statement. The statement parsers are
 * written as small recursive-descent routines on top of it.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int current;

    /**
     * @param tokens The statement tokens, terminated by {@link TokenType#END_OF_STATEMENT}.
     * @param start The index of the first token to read.
     */
    public TokenCursor(List<Token> tokens, int start) {
        this.tokens = tokens;
        this.current = start;
    }

    public TokenCursor(List<Token> tokens) {
        this(tokens, 0);
    }

    public boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the next token if it is the given keyword.
     * @param keyword The exact keyword spelling.
     * @return {@code true} if the keyword was consumed.
     */
    public boolean matchKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_STATEMENT;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token previous() {
        return tokens.get(current - 1);
    }
}
