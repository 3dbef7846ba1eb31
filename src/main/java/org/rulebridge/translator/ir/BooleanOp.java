package org.rulebridge.translator.ir;

import org.rulebridge.translator.api.SourceInfo;

/**
 * A derived layer computed from one or two operand layers.
 *
 * @param resultName The derived layer name.
 * @param operation The set operation.
 * @param layer1 The first operand.
 * @param layer2 The second operand, or {@code null} for the unary form.
 * @param comment The statement annotation, or {@code null}.
 * @param source Where the assignment was declared.
 */
public record BooleanOp(
        String resultName,
        BooleanOperation operation,
        String layer1,
        String layer2,
        String comment,
        SourceInfo source
) implements CheckNode {

    @Override
    public String name() {
        return resultName;
    }

    public boolean isBinary() {
        return layer2 != null;
    }

    @Override
    public <R> R accept(CheckNodeVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
