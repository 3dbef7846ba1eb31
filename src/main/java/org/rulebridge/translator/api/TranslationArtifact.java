package org.rulebridge.translator.api;

import org.rulebridge.translator.TranslationStatistics;
import org.rulebridge.translator.diagnostics.Diagnostic;
import org.rulebridge.translator.ir.RuleDeck;

import java.util.List;

/**
 * The result of one translation run.
 *
 * @param deck The intermediate representation built by the parser.
 * @param output The generated PXL text.
 * @param statistics Counts of layers, rule kinds and skipped statements.
 * @param diagnostics Non-fatal issues reported while parsing, in source order.
 */
public record TranslationArtifact(
        RuleDeck deck,
        String output,
        TranslationStatistics statistics,
        List<Diagnostic> diagnostics
) {
}
