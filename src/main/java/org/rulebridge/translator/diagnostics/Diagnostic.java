package org.rulebridge.translator.diagnostics;

/**
 * Represents a single diagnostic message (error, warning)
 * that occurs while a deck is translated.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The deck in which the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts translation. */
        ERROR,
        /** A statement that was skipped or only partially translated. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
