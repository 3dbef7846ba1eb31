package org.rulebridge.translator.frontend.segmenter;

import org.rulebridge.translator.api.SourceInfo;

/**
 * A non-blank line of a shape the translator does not handle.
 *
 * @param source The line position; {@link SourceInfo#lineContent()} holds the text.
 */
public record IgnorableStatement(SourceInfo source) implements Statement {
}
