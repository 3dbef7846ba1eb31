package org.rulebridge.translator.frontend.segmenter;

import org.rulebridge.translator.api.SourceInfo;

/**
 * A top-level statement containing {@code =}.
 *
 * @param text The statement without its annotation.
 * @param annotation The {@code @} suffix, or {@code null}.
 * @param source The line position.
 */
public record AssignmentStatement(String text, String annotation, SourceInfo source) implements Statement {
}
