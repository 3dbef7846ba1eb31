package org.rulebridge.translator.backend.emit;

import org.rulebridge.translator.config.TranslatorSettings;
import org.rulebridge.translator.ir.BooleanOp;
import org.rulebridge.translator.ir.CheckNode;
import org.rulebridge.translator.ir.CheckNodeVisitor;
import org.rulebridge.translator.ir.ComparisonOperator;
import org.rulebridge.translator.ir.EnclosureCheck;
import org.rulebridge.translator.ir.LayerDef;
import org.rulebridge.translator.ir.RuleDeck;
import org.rulebridge.translator.ir.SpacingCheck;
import org.rulebridge.translator.ir.WidthCheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a {@link RuleDeck} as PXL text.
 * <p>
 * The output consists of a header, the layer section sorted by GDS layer number
 * (ties broken by name), the rule section in deck order and a footer. Rendering
 * reads the deck only, so emitting the same deck twice yields identical text.
 */
public class PxlEmitter {

    private static final Logger log = LoggerFactory.getLogger(PxlEmitter.class);

    private static final String BANNER = "// ============================================================================";
    private static final Comparator<LayerDef> LAYER_ORDER =
            Comparator.comparingInt(LayerDef::gdsLayer).thenComparing(LayerDef::name);

    private final TranslatorSettings settings;

    public PxlEmitter(TranslatorSettings settings) {
        this.settings = settings;
    }

    /**
     * @param deck The deck to render.
     * @return The complete PXL text, ending with a newline.
     */
    public String emit(RuleDeck deck) {
        List<String> lines = new ArrayList<>();
        emitHeader(deck, lines);
        emitLayers(deck, lines);
        emitRules(deck, lines);
        emitFooter(lines);
        return String.join("\n", lines) + "\n";
    }

    private void emitHeader(RuleDeck deck, List<String> lines) {
        lines.add(BANNER);
        lines.add("// Automatically Generated by SVRF-to-PXL Translator");
        lines.add(BANNER);
        lines.add("// Translated from Calibre SVRF source: " + deck.sourceName());
        lines.add("// Manual review and validation recommended");
        lines.add(BANNER);
        lines.add("");
        lines.add("#include <" + settings.includeFile() + ">");
        lines.add("");
    }

    private void emitLayers(RuleDeck deck, List<String> lines) {
        section("LAYER DEFINITIONS", lines);
        deck.layers().values().stream()
                .sorted(LAYER_ORDER)
                .map(layer -> layer.name() + " = layer(" + layer.gdsLayer() + ", " + layer.gdsDatatype() + ");")
                .forEach(lines::add);
        lines.add("");
    }

    private void emitRules(RuleDeck deck, List<String> lines) {
        section("DRC RULES", lines);
        RuleRenderer renderer = new RuleRenderer();
        for (CheckNode rule : deck.rules()) {
            if (rule.hasComment()) {
                lines.add("// " + rule.comment());
            }
            lines.addAll(rule.accept(renderer));
            lines.add("");
        }
    }

    private void emitFooter(List<String> lines) {
        lines.add(BANNER);
        lines.add("// END OF DRC DECK");
        lines.add(BANNER);
    }

    private static void section(String title, List<String> lines) {
        lines.add(BANNER);
        lines.add("// " + title);
        lines.add(BANNER);
        lines.add("");
    }

    /**
     * Formats a threshold the way it is written in decks: plain decimal notation with
     * at least one fractional digit, e.g. {@code 0.5}, {@code 2.0}, {@code 0.0001}.
     *
     * @param value The threshold.
     * @return The formatted number.
     */
    static String formatValue(double value) {
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /**
     * Builds a variable name accepted by PXL from a rule name such as {@code M1.W.1}.
     */
    static String violationVariable(String ruleName) {
        return ruleName.replaceAll("\\W", "_") + "_violations";
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private final class RuleRenderer implements CheckNodeVisitor<List<String>> {

        private final Set<String> usedVariables = new HashSet<>();

        @Override
        public List<String> visitWidth(WidthCheck check) {
            return measurement(check.ruleName(), "width(" + check.layer() + ")",
                    check.operator(), check.value(), "Width");
        }

        @Override
        public List<String> visitSpacing(SpacingCheck check) {
            return measurement(check.ruleName(), "external_distance(" + check.layer() + ", " + check.layer() + ")",
                    check.operator(), check.value(), "Spacing");
        }

        @Override
        public List<String> visitEnclosure(EnclosureCheck check) {
            return measurement(check.ruleName(), "external_enclosure(" + check.outerLayer() + ", " + check.innerLayer() + ")",
                    check.operator(), check.value(), "Enclosure");
        }

        @Override
        public List<String> visitBoolean(BooleanOp op) {
            String keyword = op.operation().pxlKeyword();
            if (op.isBinary()) {
                return List.of(op.resultName() + " = " + op.layer1() + " " + keyword + " " + op.layer2() + ";");
            }
            return List.of(op.resultName() + " = " + keyword + " " + op.layer1() + ";");
        }

        private List<String> measurement(String ruleName, String measure, ComparisonOperator operator,
                                         double value, String kind) {
            String variable = uniqueVariable(ruleName);
            String threshold = formatValue(value);
            String description = kind + " violation: " + operator.symbol() + " " + threshold + settings.unitSuffix();
            return List.of(
                    variable + " = " + measure + " " + operator.symbol() + " " + threshold + ";",
                    "drc_deck(" + variable + ", " + quote(ruleName) + ", " + quote(description) + ");");
        }

        // Distinct rule names may sanitize to the same identifier; later ones get _2, _3, ...
        private String uniqueVariable(String ruleName) {
            String base = violationVariable(ruleName);
            String variable = base;
            for (int n = 2; !usedVariables.add(variable); n++) {
                variable = base + "_" + n;
            }
            if (!variable.equals(base)) {
                log.warn("Rule '{}' maps to an existing variable name {}; using {}", ruleName, base, variable);
            }
            return variable;
        }
    }
}
