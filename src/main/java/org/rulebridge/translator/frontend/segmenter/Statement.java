package org.rulebridge.translator.frontend.segmenter;

import org.rulebridge.translator.api.SourceInfo;

/**
 * One logical statement of a deck as produced by the {@link LineSegmenter}.
 * A statement may span several physical lines; {@link #source()} points at the first one.
 */
public sealed interface Statement permits LayerDeclStatement, RuleBlockStatement, AssignmentStatement, IgnorableStatement {
    SourceInfo source();
}
