package org.rulebridge.reconcile;

/**
 * The outcome of comparing one rule across both reports.
 *
 * @param rule The rule name.
 * @param calibreCount The number of Calibre violations.
 * @param icvCount The number of ICV violations.
 * @param status The comparison verdict.
 */
public record RuleComparison(String rule, int calibreCount, int icvCount, Status status) {

    public enum Status {
        MATCH("Perfect matches"),
        LOCATIONS_DIFFER("Location mismatches"),
        COUNTS_DIFFER("Count mismatches"),
        ONLY_CALIBRE("Only in Calibre"),
        ONLY_ICV("Only in ICV");

        private final String heading;

        Status(String heading) {
            this.heading = heading;
        }

        public String heading() {
            return heading;
        }
    }
}
