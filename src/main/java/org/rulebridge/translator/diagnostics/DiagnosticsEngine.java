package org.rulebridge.translator.diagnostics;

import org.rulebridge.translator.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostic messages that occur while a deck is parsed.
 * <p>
 * Parsers report here instead of throwing, so one unrecognized statement
 * never aborts translation of the rest of the deck.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param source  The position of the offending statement.
     */
    public void reportError(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, source.fileName(), source.lineNumber()));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  The position of the offending statement.
     */
    public void reportWarning(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, source.fileName(), source.lineNumber()));
    }

    /**
     * @return {@code true} if at least one warning was reported.
     */
    public boolean hasWarnings() {
        return warningCount() > 0;
    }

    /**
     * @return The number of reported warnings.
     */
    public int warningCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
