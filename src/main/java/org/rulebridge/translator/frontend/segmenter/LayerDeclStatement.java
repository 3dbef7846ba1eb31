package org.rulebridge.translator.frontend.segmenter;

import org.rulebridge.translator.api.SourceInfo;

/**
 * A line starting with the {@code LAYER} keyword.
 *
 * @param text The trimmed line.
 * @param source The line position.
 */
public record LayerDeclStatement(String text, SourceInfo source) implements Statement {
}
