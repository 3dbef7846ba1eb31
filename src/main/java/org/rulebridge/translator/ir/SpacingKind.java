package org.rulebridge.translator.ir;

/**
 * The source keyword that produced a {@link SpacingCheck}. Both kinds render
 * identically; the kind is kept for statistics and traceability.
 */
public enum SpacingKind {
    EXTERNAL,
    INTERNAL
}
