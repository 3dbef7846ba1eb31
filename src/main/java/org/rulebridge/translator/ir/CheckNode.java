package org.rulebridge.translator.ir;

import org.rulebridge.translator.api.SourceInfo;

/**
 * A rule or derived-layer node of a {@link RuleDeck}. The set of variants is closed;
 * consumers handle every variant through a {@link CheckNodeVisitor}.
 * <p>
 * Nodes reference layers by name only. Whether a referenced layer is declared
 * is never checked.
 */
public sealed interface CheckNode permits WidthCheck, SpacingCheck, EnclosureCheck, BooleanOp {

    /**
     * @return The rule name for checks, the result layer name for boolean operations.
     */
    String name();

    /**
     * @return The inline annotation attached in the source deck, or {@code null}.
     */
    String comment();

    /**
     * @return Where the node was declared.
     */
    SourceInfo source();

    /**
     * Dispatches to the visitor method for this variant.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(CheckNodeVisitor<R> visitor);

    default boolean hasComment() {
        return comment() != null && !comment().isBlank();
    }
}
