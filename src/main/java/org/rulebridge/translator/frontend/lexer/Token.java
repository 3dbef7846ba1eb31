package org.rulebridge.translator.frontend.lexer;

/**
 * Represents a single token extracted from a statement by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {
    /**
     * @param keyword The keyword to compare with.
     * @return {@code true} if this is an identifier spelled exactly as {@code keyword}.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equals(keyword);
    }
}
