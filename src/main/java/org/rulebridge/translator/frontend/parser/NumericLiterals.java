package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.api.SourceInfo;
import org.rulebridge.translator.frontend.lexer.Token;

/**
 * Conversions of NUMBER tokens into values.
 */
final class NumericLiterals {

    private NumericLiterals() {}

    static boolean isInteger(Token token) {
        return token.text().chars().allMatch(Character::isDigit);
    }

    static boolean startsWithDigit(Token token) {
        return !token.text().isEmpty() && Character.isDigit(token.text().charAt(0));
    }

    /**
     * Reads the leading digit run of a NUMBER token, so {@code 10.5} yields 10.
     */
    static int toLeadingInt(Token token, SourceInfo source) {
        String text = token.text();
        int end = 0;
        while (end < text.length() && Character.isDigit(text.charAt(end))) end++;
        try {
            return Integer.parseInt(text.substring(0, end));
        } catch (NumberFormatException e) {
            throw new MalformedLiteralException(text, source, e);
        }
    }

    static double toDouble(Token token, SourceInfo source) {
        try {
            return Double.parseDouble(token.text());
        } catch (NumberFormatException e) {
            throw new MalformedLiteralException(token.text(), source, e);
        }
    }

    static int toInt(Token token, SourceInfo source) {
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new MalformedLiteralException(token.text(), source, e);
        }
    }
}
