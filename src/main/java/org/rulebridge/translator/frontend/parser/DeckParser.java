package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.diagnostics.DiagnosticsEngine;
import org.rulebridge.translator.frontend.segmenter.AssignmentStatement;
import org.rulebridge.translator.frontend.segmenter.IgnorableStatement;
import org.rulebridge.translator.frontend.segmenter.LayerDeclStatement;
import org.rulebridge.translator.frontend.segmenter.RuleBlockStatement;
import org.rulebridge.translator.frontend.segmenter.Statement;
import org.rulebridge.translator.ir.CheckNode;
import org.rulebridge.translator.ir.LayerDef;
import org.rulebridge.translator.ir.RuleDeck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds a {@link RuleDeck} from segmented statements in a single forward pass.
 * <p>
 * Each statement is dispatched to the parser for its kind. Statements that do not
 * have a supported shape produce no node and are reported as warnings; a malformed
 * numeric literal propagates as {@link MalformedLiteralException}.
 */
public class DeckParser {

    private static final Logger log = LoggerFactory.getLogger(DeckParser.class);

    private final DiagnosticsEngine diagnostics;
    private final LayerDeclParser layerParser;
    private final RuleBlockClassifier blockClassifier;
    private final AssignmentParser assignmentParser;

    public DeckParser(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.layerParser = new LayerDeclParser(diagnostics);
        this.blockClassifier = new RuleBlockClassifier(diagnostics);
        this.assignmentParser = new AssignmentParser(diagnostics);
    }

    /**
     * @param statements The statements in source order.
     * @param sourceName The deck name recorded in the result.
     * @return The immutable deck.
     */
    public RuleDeck parse(List<Statement> statements, String sourceName) {
        RuleDeck.Builder builder = RuleDeck.builder(sourceName);
        for (Statement statement : statements) {
            if (statement instanceof LayerDeclStatement layerDecl) {
                layerParser.parse(layerDecl).ifPresent(layer -> define(builder, layer, layerDecl));
            } else if (statement instanceof RuleBlockStatement block) {
                blockClassifier.classify(block).ifPresent(rule -> append(builder, rule));
            } else if (statement instanceof AssignmentStatement assignment) {
                assignmentParser.parse(assignment).ifPresent(rule -> append(builder, rule));
            } else if (statement instanceof IgnorableStatement ignorable) {
                diagnostics.reportWarning("Skipped unsupported statement: " + ignorable.source().lineContent(), ignorable.source());
            } else {
                throw new IllegalStateException("Unhandled statement type: " + statement.getClass().getName());
            }
        }
        return builder.build();
    }

    private void append(RuleDeck.Builder builder, CheckNode rule) {
        builder.addRule(rule);
        log.debug("{}: added {} '{}'", rule.source(), rule.getClass().getSimpleName(), rule.name());
    }

    private void define(RuleDeck.Builder builder, LayerDef layer, LayerDeclStatement statement) {
        LayerDef previous = builder.defineLayer(layer);
        if (previous != null) {
            log.debug("{}: layer '{}' redeclared, replacing {} with {}", statement.source(), layer.name(), previous, layer);
        }
    }
}
