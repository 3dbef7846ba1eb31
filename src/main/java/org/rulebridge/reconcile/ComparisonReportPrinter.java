package org.rulebridge.reconcile;

import java.io.PrintWriter;
import java.util.List;

/**
 * Renders a {@link ComparisonResult} as a plain-text console report.
 */
public class ComparisonReportPrinter {

    private static final String RULE = "=".repeat(80);

    private final PrintWriter out;

    public ComparisonReportPrinter(PrintWriter out) {
        this.out = out;
    }

    public void print(ComparisonResult result, double tolerance) {
        out.println(RULE);
        out.println("DRC RESULTS COMPARISON REPORT");
        out.println(RULE);
        out.println();
        out.printf("Tolerance:                %s um%n", tolerance);
        out.printf("Total Calibre violations: %d%n", result.totalCalibre());
        out.printf("Total ICV violations:     %d%n", result.totalIcv());
        out.printf("Rules compared:           %d%n", result.rules().size());
        out.println();

        for (RuleComparison.Status status : RuleComparison.Status.values()) {
            List<RuleComparison> section = result.withStatus(status);
            if (section.isEmpty()) {
                continue;
            }
            out.printf("%s (%d):%n", status.heading(), section.size());
            for (RuleComparison r : section) {
                out.printf("  %-30s Calibre: %4d  ICV: %4d%n", r.rule(), r.calibreCount(), r.icvCount());
            }
            out.println();
        }

        out.println(RULE);
        out.println(result.perfectMatch() ? "RESULT: PERFECT MATCH" : "RESULT: DIFFERENCES FOUND");
        out.println(RULE);
        out.flush();
    }
}
