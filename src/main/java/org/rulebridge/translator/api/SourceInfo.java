package org.rulebridge.translator.api;

/**
 * A pure data class representing a position in a source deck.
 * It is part of the public translator API and free of implementation details.
 *
 * @param fileName The deck the statement was read from.
 * @param lineNumber The 1-based line number.
 * @param lineContent The (trimmed) content of the line.
 */
public record SourceInfo(String fileName, int lineNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
