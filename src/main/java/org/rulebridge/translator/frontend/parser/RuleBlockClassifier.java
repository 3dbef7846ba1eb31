package org.rulebridge.translator.frontend.parser;

import org.rulebridge.translator.api.SourceInfo;
import org.rulebridge.translator.diagnostics.DiagnosticsEngine;
import org.rulebridge.translator.frontend.lexer.Lexer;
import org.rulebridge.translator.frontend.lexer.Token;
import org.rulebridge.translator.frontend.lexer.TokenType;
import org.rulebridge.translator.frontend.segmenter.RuleBlockStatement;
import org.rulebridge.translator.ir.CheckNode;
import org.rulebridge.translator.ir.ComparisonOperator;
import org.rulebridge.translator.ir.EnclosureCheck;
import org.rulebridge.translator.ir.SpacingCheck;
import org.rulebridge.translator.ir.SpacingKind;
import org.rulebridge.translator.ir.WidthCheck;

import java.util.List;
import java.util.Optional;

/**
 * Turns a rule block into a typed check node.
 * <p>
 * The body is searched for the check keywords in the fixed priority order
 * {@code WIDTH}, {@code EXTERNAL}, {@code INTERNAL}, {@code ENC}. The first keyword
 * present decides the check kind, regardless of where it appears in the body; other
 * keywords in the same block are ignored. Every occurrence of the deciding keyword is
 * tried until one has the expected shape:
 * <pre>
 *   WIDTH layer OP value
 *   EXTERNAL layer OP value
 *   INTERNAL layer OP value
 *   ENC outer inner OP value
 * </pre>
 */
public class RuleBlockClassifier {

    private static final List<String> KEYWORDS_BY_PRIORITY = List.of("WIDTH", "EXTERNAL", "INTERNAL", "ENC");

    private final DiagnosticsEngine diagnostics;

    public RuleBlockClassifier(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @param block The rule block statement.
     * @return The check node, or empty if the block holds no supported check.
     * @throws MalformedLiteralException if the threshold of a matching check is not a number.
     */
    public Optional<CheckNode> classify(RuleBlockStatement block) {
        if (block.name().isEmpty()) {
            return skip(block, "rule block has no name");
        }
        List<Token> tokens = new Lexer(block.body(), block.source().lineNumber()).scanTokens();

        for (String keyword : KEYWORDS_BY_PRIORITY) {
            if (tokens.stream().noneMatch(t -> t.isKeyword(keyword))) {
                continue;
            }
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).isKeyword(keyword)) {
                    Optional<CheckNode> node = parseCheck(keyword, new TokenCursor(tokens, i + 1), block);
                    if (node.isPresent()) {
                        return node;
                    }
                }
            }
            return skip(block, keyword + " check does not have the expected operands");
        }
        return skip(block, "no supported check keyword");
    }

    private Optional<CheckNode> parseCheck(String keyword, TokenCursor cursor, RuleBlockStatement block) {
        if (!cursor.match(TokenType.IDENTIFIER)) {
            return Optional.empty();
        }
        String layer = cursor.previous().text();
        String inner = null;
        if ("ENC".equals(keyword)) {
            if (!cursor.match(TokenType.IDENTIFIER)) {
                return Optional.empty();
            }
            inner = cursor.previous().text();
        }

        Optional<ComparisonOperator> operator = cursor.match(TokenType.OPERATOR)
                ? ComparisonOperator.fromSymbol(cursor.previous().text())
                : Optional.empty();
        if (operator.isEmpty() || !cursor.match(TokenType.NUMBER)) {
            return Optional.empty();
        }
        double value = NumericLiterals.toDouble(cursor.previous(), block.source());

        String name = block.name();
        String comment = block.annotation();
        SourceInfo source = block.source();
        CheckNode node = switch (keyword) {
            case "WIDTH" -> new WidthCheck(name, layer, operator.get(), value, comment, source);
            case "EXTERNAL" -> new SpacingCheck(name, layer, operator.get(), value, SpacingKind.EXTERNAL, comment, source);
            case "INTERNAL" -> new SpacingCheck(name, layer, operator.get(), value, SpacingKind.INTERNAL, comment, source);
            case "ENC" -> new EnclosureCheck(name, layer, inner, operator.get(), value, comment, source);
            default -> throw new IllegalStateException("Unhandled check keyword " + keyword);
        };
        return Optional.of(node);
    }

    private Optional<CheckNode> skip(RuleBlockStatement block, String reason) {
        diagnostics.reportWarning("Skipped rule block '" + block.name() + "': " + reason, block.source());
        return Optional.empty();
    }
}
