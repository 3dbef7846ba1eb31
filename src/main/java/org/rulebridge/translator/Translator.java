package org.rulebridge.translator;

import org.rulebridge.translator.api.ITranslator;
import org.rulebridge.translator.api.TranslationArtifact;
import org.rulebridge.translator.api.TranslationException;
import org.rulebridge.translator.backend.emit.PxlEmitter;
import org.rulebridge.translator.config.TranslatorSettings;
import org.rulebridge.translator.diagnostics.Diagnostic;
import org.rulebridge.translator.diagnostics.DiagnosticsEngine;
import org.rulebridge.translator.frontend.parser.DeckParser;
import org.rulebridge.translator.frontend.parser.MalformedLiteralException;
import org.rulebridge.translator.frontend.preprocessor.CommentStripper;
import org.rulebridge.translator.frontend.segmenter.LineSegmenter;
import org.rulebridge.translator.frontend.segmenter.Statement;
import org.rulebridge.translator.ir.RuleDeck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main translator implementation. This class orchestrates the pipeline from
 * SVRF source text to PXL text. A new pipeline state is created per call, so one
 * instance can translate any number of decks.
 */
public class Translator implements ITranslator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final TranslatorSettings settings;

    public Translator() {
        this(TranslatorSettings.defaults());
    }

    public Translator(TranslatorSettings settings) {
        this.settings = settings;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Unsupported statements are skipped and reported as warnings in the artifact.
     * In strict mode the first run with warnings fails instead.
     */
    @Override
    public TranslationArtifact translate(String source, String sourceName) throws TranslationException {
        RuleDeck deck;
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Block comment removal
        String stripped = CommentStripper.strip(source);

        // Phase 2: Segmentation into logical statements
        List<Statement> statements = new LineSegmenter(sourceName).segment(stripped);
        log.debug("{}: {} statements", sourceName, statements.size());

        // Phase 3: Parsing into the IR
        try {
            deck = new DeckParser(diagnostics).parse(statements, sourceName);
        } catch (MalformedLiteralException e) {
            diagnostics.reportError(e.getMessage(), e.source());
            log.debug("{}", diagnostics.summary());
            throw new TranslationException(e.getMessage(), e.source(), e);
        }
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            log.debug("{}", diagnostic);
        }
        if (settings.strictMode() && diagnostics.hasWarnings()) {
            throw new TranslationException("Strict mode: " + diagnostics.warningCount()
                    + " statement(s) could not be translated\n" + diagnostics.summary());
        }

        // Phase 4: Emission
        String output = generate(deck);
        TranslationStatistics statistics = TranslationStatistics.of(deck, diagnostics.warningCount());
        log.debug("{}: {} layers, {} rules, {} skipped", sourceName, statistics.layers(), statistics.rules(),
                statistics.skippedStatements());
        return new TranslationArtifact(deck, output, statistics, diagnostics.getDiagnostics());
    }

    /**
     * Renders an already built deck.
     * @param deck The deck.
     * @return The PXL text.
     */
    public String generate(RuleDeck deck) {
        return new PxlEmitter(settings).emit(deck);
    }
}
