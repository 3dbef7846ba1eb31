package org.rulebridge.translator.ir;

import org.rulebridge.translator.api.SourceInfo;

/**
 * Spacing check between shapes of a single layer, produced by either
 * the {@code EXTERNAL} or the {@code INTERNAL} keyword.
 *
 * @param ruleName The rule name as declared in the source deck.
 * @param layer The measured layer.
 * @param operator The comparison operator.
 * @param value The threshold.
 * @param kind The keyword that produced the check.
 * @param comment The rule annotation, or {@code null}.
 * @param source Where the rule block starts.
 */
public record SpacingCheck(
        String ruleName,
        String layer,
        ComparisonOperator operator,
        double value,
        SpacingKind kind,
        String comment,
        SourceInfo source
) implements CheckNode {

    @Override
    public String name() {
        return ruleName;
    }

    @Override
    public <R> R accept(CheckNodeVisitor<R> visitor) {
        return visitor.visitSpacing(this);
    }
}
