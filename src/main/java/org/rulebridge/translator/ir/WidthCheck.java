package org.rulebridge.translator.ir;

import org.rulebridge.translator.api.SourceInfo;

/**
 * Minimum/maximum width check on a single layer.
 *
 * @param ruleName The rule name as declared in the source deck.
 * @param layer The measured layer.
 * @param operator The comparison operator.
 * @param value The threshold.
 * @param comment The rule annotation, or {@code null}.
 * @param source Where the rule block starts.
 */
public record WidthCheck(
        String ruleName,
        String layer,
        ComparisonOperator operator,
        double value,
        String comment,
        SourceInfo source
) implements CheckNode {

    @Override
    public String name() {
        return ruleName;
    }

    @Override
    public <R> R accept(CheckNodeVisitor<R> visitor) {
        return visitor.visitWidth(this);
    }
}
