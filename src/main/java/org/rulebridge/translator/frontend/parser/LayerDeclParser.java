package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.diagnostics.DiagnosticsEngine;
import org.rulebridge.translator.frontend.lexer.Lexer;
import org.rulebridge.translator.frontend.lexer.Token;
import org.rulebridge.translator.frontend.lexer.TokenType;
import org.rulebridge.translator.frontend.segmenter.LayerDeclStatement;
import org.rulebridge.translator.ir.LayerDef;

import java.util.Optional;

/**
 * Parses layer declarations of the forms
 * <pre>
 *   LAYER name layer
 *   LAYER name layer datatype
 *   LAYER name layer DATATYPE datatype
 * </pre>
 * Tokens after a complete declaration are ignored. A layer number with a fractional
 * part contributes its integer part only, and the declaration then ends there.
 */
public class LayerDeclParser {

    private final DiagnosticsEngine diagnostics;

    public LayerDeclParser(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @param statement The layer declaration statement.
     * @return The layer definition, or empty if the line does not have a supported shape.
     * @throws MalformedLiteralException if a layer number does not fit an int.
     */
    public Optional<LayerDef> parse(LayerDeclStatement statement) {
        TokenCursor cursor = new TokenCursor(new Lexer(statement.text(), statement.source().lineNumber()).scanTokens());
        if (!cursor.matchKeyword("LAYER") || !cursor.match(TokenType.IDENTIFIER)) {
            return skip(statement, "expected 'LAYER name number'");
        }
        String name = cursor.previous().text();

        if (!cursor.check(TokenType.NUMBER) || !NumericLiterals.startsWithDigit(cursor.peek())) {
            return skip(statement, "layer number of '" + name + "' is not an integer");
        }
        Token layerToken = cursor.advance();
        int layer = NumericLiterals.toLeadingInt(layerToken, statement.source());
        if (!NumericLiterals.isInteger(layerToken)) {
            // "LAYER M1 10.5 ..." declares layer 10; nothing after the fraction is read
            return Optional.of(new LayerDef(name, layer, 0));
        }

        int datatype = 0;
        cursor.matchKeyword("DATATYPE");
        if (cursor.check(TokenType.NUMBER) && NumericLiterals.isInteger(cursor.peek())) {
            Token datatypeToken = cursor.advance();
            datatype = NumericLiterals.toInt(datatypeToken, statement.source());
        }
        return Optional.of(new LayerDef(name, layer, datatype));
    }

    private Optional<LayerDef> skip(LayerDeclStatement statement, String reason) {
        diagnostics.reportWarning("Skipped layer declaration: " + reason, statement.source());
        return Optional.empty();
    }
}
