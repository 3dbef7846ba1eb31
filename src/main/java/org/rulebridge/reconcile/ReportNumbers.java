package org.rulebridge.reconcile;

/**
 * Shared lexical patterns for report parsing.
 */
final class ReportNumbers {

    /** A signed decimal coordinate such as {@code -10.5}, {@code 3} or {@code .25}. */
    static final String NUMBER = "-?(?:\\d+(?:\\.\\d*)?|\\.\\d+)";

    private ReportNumbers() {}
}
