package org.rulebridge.translator.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the text of a single logical statement into tokens.
 * <p>
 * The lexer never fails: characters outside the small statement grammar become
 * {@link TokenType#OTHER} tokens and it is up to the parsers to reject them.
 * Numeric literals are only delimited here; their value is parsed by the consumer.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line;
    private int column = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The statement text, possibly spanning several lines.
     * @param firstLine The deck line number of the first character.
     */
    public Lexer(String source, int firstLine) {
        this.source = source;
        this.line = firstLine;
    }

    /**
     * Performs the tokenization of the entire statement.
     * @return The recognized tokens, terminated by {@link TokenType#END_OF_STATEMENT}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_STATEMENT, "", line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '<', '>', '=', '!': operator(); break;
            case ' ', '\r', '\t': break;
            case '\n':
                line++;
                column = 1;
                break;
            default:
                if (isDigit(c)) {
                    digitLed();
                } else if (c == '.' && isDigit(peek())) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    addToken(TokenType.OTHER);
                }
                break;
        }
    }

    private void operator() {
        while (isOperatorChar(peek())) advance();
        String text = source.substring(start, current);
        addToken("=".equals(text) ? TokenType.EQUALS : TokenType.OPERATOR);
    }

    // Names such as "1M" start with a digit; a digit run followed by a letter is an identifier
    private void digitLed() {
        while (isDigit(peek())) advance();
        if (isAlpha(peek())) {
            identifier();
        } else {
            number();
        }
    }

    private void number() {
        // Greedy on purpose: "1.2.3" is delimited as one malformed literal
        while (isDigit(peek()) || peek() == '.') advance();
        addToken(TokenType.NUMBER);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line, startColumn));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isOperatorChar(char c) {
        return c == '<' || c == '>' || c == '=' || c == '!';
    }
}
