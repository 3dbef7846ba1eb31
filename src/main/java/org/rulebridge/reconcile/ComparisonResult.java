package org.rulebridge.reconcile;

import java.util.List;

/**
 * The full reconciliation result, one entry per rule sorted by rule name.
 */
public record ComparisonResult(List<RuleComparison> rules, int totalCalibre, int totalIcv) {

    public ComparisonResult {
        rules = List.copyOf(rules);
    }

    public boolean perfectMatch() {
        return rules.stream().allMatch(r -> r.status() == RuleComparison.Status.MATCH);
    }

    public List<RuleComparison> withStatus(RuleComparison.Status status) {
        return rules.stream().filter(r -> r.status() == status).toList();
    }
}
