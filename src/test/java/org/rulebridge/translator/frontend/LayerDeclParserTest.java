package org.rulebridge.translator.frontend;

import org.rulebridge.translator.api.SourceInfo;
import org.rulebridge.translator.diagnostics.DiagnosticsEngine;
import org.rulebridge.translator.frontend.parser.LayerDeclParser;
import org.rulebridge.translator.frontend.parser.MalformedLiteralException;
import org.rulebridge.translator.frontend.segmenter.LayerDeclStatement;
import org.rulebridge.translator.ir.LayerDef;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LayerDeclParser}.
 */
@Tag("unit")
public class LayerDeclParserTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final LayerDeclParser parser = new LayerDeclParser(diagnostics);

    private Optional<LayerDef> parse(String line) {
        return parser.parse(new LayerDeclStatement(line, new SourceInfo("test.svrf", 1, line)));
    }

    @Test
    void datatypeDefaultsToZero() {
        assertThat(parse("LAYER METAL1 10")).contains(new LayerDef("METAL1", 10, 0));
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void readsExplicitDatatype() {
        assertThat(parse("LAYER VIA1 15 2")).contains(new LayerDef("VIA1", 15, 2));
    }

    @Test
    void acceptsDatatypeKeyword() {
        assertThat(parse("LAYER POLY 5 DATATYPE 1")).contains(new LayerDef("POLY", 5, 1));
    }

    @Test
    void ignoresTrailingTokens() {
        assertThat(parse("LAYER M2 20 0 extra stuff")).contains(new LayerDef("M2", 20, 0));
    }

    /**
     * A declaration whose layer number is not a number is skipped with a warning.
     */
    @Test
    void skipsDeclarationWithoutLayerNumber() {
        assertThat(parse("LAYER METAL1 ten")).isEmpty();
        assertThat(parse("LAYER METAL1 .5")).isEmpty();
        assertThat(diagnostics.warningCount()).isEqualTo(2);
    }

    /**
     * Only the integer part of a fractional layer number is used, and nothing after it is read.
     */
    @Test
    void fractionalLayerNumberKeepsIntegerPart() {
        assertThat(parse("LAYER M1 10.5")).contains(new LayerDef("M1", 10, 0));
        assertThat(parse("LAYER M1 10.5 3")).contains(new LayerDef("M1", 10, 0));
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void acceptsNameStartingWithDigit() {
        assertThat(parse("LAYER 1M 31")).contains(new LayerDef("1M", 31, 0));
    }

    @Test
    void overflowingLayerNumberIsMalformed() {
        assertThatThrownBy(() -> parse("LAYER METAL1 99999999999"))
                .isInstanceOf(MalformedLiteralException.class)
                .hasMessageContaining("99999999999");
    }
}
