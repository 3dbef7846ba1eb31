package org.rulebridge.translator.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A name such as a layer, a rule or a keyword like WIDTH. */
    IDENTIFIER,
    /** A run of digits and dots, e.g. 0.5 or 10. */
    NUMBER,
    /** A comparison operator built from {@code < > = !}. */
    OPERATOR,
    /** A single {@code =} used for assignment. */
    EQUALS,
    /** The '{' character. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** Any other single character. */
    OTHER,
    /** Represents the end of the statement. */
    END_OF_STATEMENT
}
