package org.rulebridge.translator.api;

/**
 * An exception that is thrown when a deck cannot be translated.
 * <p>
 * It is part of the public API and hides the internal exception types of the translator.
 */
public class TranslationException extends Exception {

    /**
     * Constructs a new translation exception with the specified detail message.
     * @param message The detail message.
     */
    public TranslationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new translation exception pointing at a source position.
     * @param message The detail message.
     * @param sourceInfo The source position.
     * @param cause The cause.
     */
    public TranslationException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(String.format("%s at %s", message, sourceInfo), cause);
    }
}
