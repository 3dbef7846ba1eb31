package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.api.SourceInfo;

/**
 * Thrown when a statement has a recognized shape but one of its numeric
 * literals cannot be converted. Unlike an unrecognized statement this is
 * not skipped; it aborts the translation run.
 */
public class MalformedLiteralException extends RuntimeException {

    private final transient SourceInfo source;

    /**
     * @param literal The offending literal text.
     * @param source The statement position.
     * @param cause The conversion failure.
     */
    public MalformedLiteralException(String literal, SourceInfo source, NumberFormatException cause) {
        super("Malformed numeric literal '" + literal + "'", cause);
        this.source = source;
    }

    public SourceInfo source() {
        return source;
    }
}
