package org.rulebridge.translator.ir;

import org.rulebridge.translator.api.SourceInfo;

/**
 * Enclosure check: how far the outer layer surrounds the inner layer.
 *
 * @param ruleName The rule name as declared in the source deck.
 * @param outerLayer The enclosing layer.
 * @param innerLayer The enclosed layer.
 * @param operator The comparison operator.
 * @param value The threshold.
 * @param comment The rule annotation, or {@code null}.
 * @param source Where the rule block starts.
 */
public record EnclosureCheck(
        String ruleName,
        String outerLayer,
        String innerLayer,
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
        return visitor.visitEnclosure(this);
    }
}
