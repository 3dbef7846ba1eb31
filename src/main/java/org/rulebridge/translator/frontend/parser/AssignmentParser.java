package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.diagnostics.DiagnosticsEngine;
import org.rulebridge.translator.frontend.lexer.Lexer;
import org.rulebridge.translator.frontend.lexer.TokenType;
import org.rulebridge.translator.frontend.segmenter.AssignmentStatement;
import org.rulebridge.translator.ir.BooleanOp;
import org.rulebridge.translator.ir.BooleanOperation;

import java.util.Optional;

/**
 * Parses boolean layer derivations of the form {@code result = OP a [b]}, where
 * {@code OP} is AND, OR or NOT in any letter case. NOT keeps only its first operand.
 * Tokens after the operands are ignored.
 */
public class AssignmentParser {

    private final DiagnosticsEngine diagnostics;

    public AssignmentParser(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @param statement The assignment statement.
     * @return The boolean operation, or empty if the statement is not a supported derivation.
     */
    public Optional<BooleanOp> parse(AssignmentStatement statement) {
        TokenCursor cursor = new TokenCursor(new Lexer(statement.text(), statement.source().lineNumber()).scanTokens());

        if (!cursor.match(TokenType.IDENTIFIER)) {
            return skip(statement, "expected a result name");
        }
        String result = cursor.previous().text();
        if (!cursor.match(TokenType.EQUALS) || !cursor.match(TokenType.IDENTIFIER)) {
            return skip(statement, "expected '" + result + " = AND|OR|NOT ...'");
        }
        Optional<BooleanOperation> operation = BooleanOperation.fromKeyword(cursor.previous().text());
        if (operation.isEmpty()) {
            return skip(statement, "unsupported operation '" + cursor.previous().text() + "'");
        }
        if (!cursor.match(TokenType.IDENTIFIER)) {
            return skip(statement, operation.get() + " requires a layer operand");
        }
        String first = cursor.previous().text();
        String second = cursor.match(TokenType.IDENTIFIER) ? cursor.previous().text() : null;

        if (operation.get().isUnary() && second != null) {
            diagnostics.reportWarning("NOT takes one operand; ignoring '" + second + "'", statement.source());
            second = null;
        }
        return Optional.of(new BooleanOp(result, operation.get(), first, second, statement.annotation(), statement.source()));
    }

    private Optional<BooleanOp> skip(AssignmentStatement statement, String reason) {
        diagnostics.reportWarning("Skipped assignment: " + reason, statement.source());
        return Optional.empty();
    }
}
