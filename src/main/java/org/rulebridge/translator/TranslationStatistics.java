package org.rulebridge.translator;

import org.rulebridge.translator.ir.BooleanOp;
import org.rulebridge.translator.ir.CheckNode;
import org.rulebridge.translator.ir.CheckNodeVisitor;
import org.rulebridge.translator.ir.EnclosureCheck;
import org.rulebridge.translator.ir.RuleDeck;
import org.rulebridge.translator.ir.SpacingCheck;
import org.rulebridge.translator.ir.SpacingKind;
import org.rulebridge.translator.ir.WidthCheck;

/**
 * Counts of what a translation run produced.
 *
 * @param layers Number of distinct layers.
 * @param widthChecks Number of width checks.
 * @param externalSpacingChecks Spacing checks produced by EXTERNAL.
 * @param internalSpacingChecks Spacing checks produced by INTERNAL.
 * @param enclosureChecks Number of enclosure checks.
 * @param booleanOps Number of derived layers.
 * @param skippedStatements Number of warnings reported while parsing.
 */
public record TranslationStatistics(
        int layers,
        int widthChecks,
        int externalSpacingChecks,
        int internalSpacingChecks,
        int enclosureChecks,
        int booleanOps,
        int skippedStatements
) {

    public int spacingChecks() {
        return externalSpacingChecks + internalSpacingChecks;
    }

    public int rules() {
        return widthChecks + spacingChecks() + enclosureChecks + booleanOps;
    }

    /**
     * @param deck The translated deck.
     * @param skippedStatements The number of warnings reported while parsing it.
     * @return The statistics of the deck.
     */
    public static TranslationStatistics of(RuleDeck deck, int skippedStatements) {
        Counter counter = new Counter();
        for (CheckNode rule : deck.rules()) {
            rule.accept(counter);
        }
        return new TranslationStatistics(deck.layers().size(), counter.width, counter.external, counter.internal,
                counter.enclosure, counter.bool, skippedStatements);
    }

    private static final class Counter implements CheckNodeVisitor<Void> {
        private int width;
        private int external;
        private int internal;
        private int enclosure;
        private int bool;

        @Override
        public Void visitWidth(WidthCheck check) {
            width++;
            return null;
        }

        @Override
        public Void visitSpacing(SpacingCheck check) {
            if (check.kind() == SpacingKind.INTERNAL) internal++;
            else external++;
            return null;
        }

        @Override
        public Void visitEnclosure(EnclosureCheck check) {
            enclosure++;
            return null;
        }

        @Override
        public Void visitBoolean(BooleanOp op) {
            bool++;
            return null;
        }
    }
}
