package org.rulebridge.translator.frontend.segmenter;

import org.rulebridge.translator.api.SourceInfo;

/**
 * A named, brace-delimited rule block.
 *
 * @param name The text before the opening brace, without its annotation.
 * @param body Everything from the opening brace to the balancing closing brace, annotation removed.
 * @param annotation The inline {@code @} annotation, or {@code null}.
 * @param source The position of the opening line.
 */
public record RuleBlockStatement(String name, String body, String annotation, SourceInfo source) implements Statement {
}
