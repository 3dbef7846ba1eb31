package org.rulebridge.translator.frontend;

import org.rulebridge.translator.frontend.segmenter.AssignmentStatement;
import org.rulebridge.translator.frontend.segmenter.IgnorableStatement;
import org.rulebridge.translator.frontend.segmenter.LayerDeclStatement;
import org.rulebridge.translator.frontend.segmenter.LineSegmenter;
import org.rulebridge.translator.frontend.segmenter.RuleBlockStatement;
import org.rulebridge.translator.frontend.segmenter.Statement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LineSegmenter}, which splits comment-free deck text
 * into logical statements.
 */
public class LineSegmenterTest {

    private final LineSegmenter segmenter = new LineSegmenter("test.svrf");

    /**
     * Verifies that each statement kind is recognized and that source order is kept.
     */
    @Test
    @Tag("unit")
    void segmentsStatementsInSourceOrder() {
        // Arrange
        String source = String.join("\n",
                "// line comment",
                "LAYER METAL1 10",
                "",
                "W1 { WIDTH METAL1 < 0.5 }",
                "RESULT = AND METAL1 METAL2",
                "DRC RESULTS DATABASE out.db");

        // Act
        List<Statement> statements = segmenter.segment(source);

        // Assert
        assertThat(statements).hasSize(4);
        assertThat(statements.get(0)).isInstanceOf(LayerDeclStatement.class);
        assertThat(statements.get(1)).isInstanceOf(RuleBlockStatement.class);
        assertThat(statements.get(2)).isInstanceOf(AssignmentStatement.class);
        assertThat(statements.get(3)).isInstanceOf(IgnorableStatement.class);
        assertThat(statements).extracting(s -> s.source().lineNumber()).containsExactly(2, 4, 5, 6);
    }

    /**
     * Verifies that a rule block spanning several lines is collected into a single statement
     * and that the annotation line is captured as the block comment.
     */
    @Test
    @Tag("unit")
    void collectsMultiLineRuleBlockWithAnnotation() {
        // Arrange
        String source = String.join("\n",
                "M1.W.1 {",
                "  @ Minimum metal1 width",
                "  WIDTH METAL1 < 0.14",
                "}",
                "LAYER METAL2 20");

        // Act
        List<Statement> statements = segmenter.segment(source);

        // Assert
        assertThat(statements).hasSize(2);
        RuleBlockStatement block = (RuleBlockStatement) statements.get(0);
        assertThat(block.name()).isEqualTo("M1.W.1");
        assertThat(block.annotation()).isEqualTo("Minimum metal1 width");
        assertThat(block.body()).contains("WIDTH METAL1 < 0.14").doesNotContain("Minimum");
        assertThat(statements.get(1).source().lineNumber()).isEqualTo(5);
    }

    /**
     * Every annotation line is removed from the body, so words in a multi-line
     * description never reach the classifier.
     */
    @Test
    @Tag("unit")
    void removesEveryAnnotationLineFromBody() {
        // Arrange
        String source = String.join("\n",
                "M1.S.1 @ Metal1 spacing {",
                "  @ edge to edge, not WIDTH",
                "  @ see ENC rules for vias",
                "  EXTERNAL M1 < 0.14",
                "}");

        // Act
        List<Statement> statements = segmenter.segment(source);

        // Assert
        RuleBlockStatement block = (RuleBlockStatement) statements.get(0);
        assertThat(block.annotation()).isEqualTo("Metal1 spacing edge to edge, not WIDTH see ENC rules for vias");
        assertThat(block.body()).doesNotContain("WIDTH").doesNotContain("ENC").contains("EXTERNAL M1 < 0.14");
    }

    @Test
    @Tag("unit")
    void annotationOnOpeningLineEndsAtBrace() {
        List<Statement> statements = segmenter.segment("W1 @ Width rule { WIDTH M1 < 0.5 }");

        RuleBlockStatement block = (RuleBlockStatement) statements.get(0);
        assertThat(block.name()).isEqualTo("W1");
        assertThat(block.annotation()).isEqualTo("Width rule");
        assertThat(block.body()).contains("WIDTH M1 < 0.5");
    }

    @Test
    @Tag("unit")
    void unbalancedBlockRunsToEndOfInput() {
        List<Statement> statements = segmenter.segment("W1 {\nWIDTH M1 < 0.5\nLAYER M2 20");

        assertThat(statements).hasSize(1);
        assertThat(((RuleBlockStatement) statements.get(0)).body()).contains("LAYER M2 20");
    }

    @Test
    @Tag("unit")
    void assignmentAnnotationIsSplitOff() {
        List<Statement> statements = segmenter.segment("GATE = AND POLY DIFF @ Transistor gate");

        AssignmentStatement assignment = (AssignmentStatement) statements.get(0);
        assertThat(assignment.text()).isEqualTo("GATE = AND POLY DIFF");
        assertThat(assignment.annotation()).isEqualTo("Transistor gate");
    }

    /**
     * Only an exact {@code LAYER} first word starts a layer declaration.
     */
    @Test
    @Tag("unit")
    void layerPrefixedWordIsNotALayerDeclaration() {
        List<Statement> statements = segmenter.segment("LAYERX = OR M1 M2");

        assertThat(statements).singleElement().isInstanceOf(AssignmentStatement.class);
    }
}
