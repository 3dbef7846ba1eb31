package org.rulebridge.translator.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * The comparison operators a measurement check may use. Both rule languages
 * spell them the same way, so the symbol is passed through verbatim.
 */
public enum ComparisonOperator {
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its exact symbol.
     * @param symbol The operator text, e.g. {@code "<="}.
     * @return The operator, or empty if the text is not a comparison operator.
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
