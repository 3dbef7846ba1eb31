package org.rulebridge.translator.ir;

import java.util.Locale;
import java.util.Optional;

/**
 * Set-algebra operations that derive a new layer from existing ones.
 */
public enum BooleanOperation {
    AND,
    OR,
    NOT;

    /**
     * @return The operator keyword in the target language.
     */
    public String pxlKeyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return {@code true} if the operation takes exactly one operand.
     */
    public boolean isUnary() {
        return this == NOT;
    }

    /**
     * Parses an operation keyword case-insensitively.
     * @param keyword The keyword as written in the source deck.
     * @return The operation, or empty if the keyword is unknown.
     */
    public static Optional<BooleanOperation> fromKeyword(String keyword) {
        for (BooleanOperation op : values()) {
            if (op.name().equalsIgnoreCase(keyword)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
