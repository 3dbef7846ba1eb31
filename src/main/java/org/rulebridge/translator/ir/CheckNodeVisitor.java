package org.rulebridge.translator.ir;

/**
 * A visitor over the closed set of {@link CheckNode} variants. Adding a variant
 * breaks every implementation at compile time, so no consumer can miss one.
 *
 * @param <R> The result type of the visit methods.
 */
public interface CheckNodeVisitor<R> {
    R visitWidth(WidthCheck check);
    R visitSpacing(SpacingCheck check);
    R visitEnclosure(EnclosureCheck check);
    R visitBoolean(BooleanOp op);
}
