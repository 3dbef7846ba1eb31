package org.rulebridge.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Compares the violations of two DRC engines rule by rule.
 * <p>
 * Locations are paired one-to-one: a rule matches when each Calibre violation can be
 * assigned its own ICV violation lying strictly within the tolerance on both axes.
 */
public class ViolationComparator {

    private static final Logger log = LoggerFactory.getLogger(ViolationComparator.class);

    private final double tolerance;

    public ViolationComparator(double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public double tolerance() {
        return tolerance;
    }

    public ComparisonResult compare(Map<String, List<Violation>> calibre, Map<String, List<Violation>> icv) {
        TreeSet<String> ruleNames = new TreeSet<>(calibre.keySet());
        ruleNames.addAll(icv.keySet());

        List<RuleComparison> rules = new ArrayList<>();
        int totalCalibre = 0;
        int totalIcv = 0;
        for (String rule : ruleNames) {
            List<Violation> c = calibre.getOrDefault(rule, List.of());
            List<Violation> i = icv.getOrDefault(rule, List.of());
            totalCalibre += c.size();
            totalIcv += i.size();
            RuleComparison.Status status = classify(calibre.containsKey(rule), icv.containsKey(rule), c, i);
            log.debug("Rule {}: calibre={}, icv={}, status={}", rule, c.size(), i.size(), status);
            rules.add(new RuleComparison(rule, c.size(), i.size(), status));
        }
        return new ComparisonResult(rules, totalCalibre, totalIcv);
    }

    private RuleComparison.Status classify(boolean inCalibre, boolean inIcv, List<Violation> c, List<Violation> i) {
        if (!inIcv) {
            return RuleComparison.Status.ONLY_CALIBRE;
        }
        if (!inCalibre) {
            return RuleComparison.Status.ONLY_ICV;
        }
        if (c.size() != i.size()) {
            return RuleComparison.Status.COUNTS_DIFFER;
        }
        return locationsMatch(c, i) ? RuleComparison.Status.MATCH : RuleComparison.Status.LOCATIONS_DIFFER;
    }

    /**
     * Decides whether every Calibre violation can be paired with a distinct ICV violation,
     * by growing a maximum bipartite matching one augmenting path at a time.
     */
    boolean locationsMatch(List<Violation> calibre, List<Violation> icv) {
        int[] pairedWith = new int[icv.size()];
        Arrays.fill(pairedWith, -1);
        for (int c = 0; c < calibre.size(); c++) {
            if (!augment(c, calibre, icv, pairedWith, new boolean[icv.size()])) {
                return false;
            }
        }
        return true;
    }

    private boolean augment(int c, List<Violation> calibre, List<Violation> icv, int[] pairedWith, boolean[] visited) {
        for (int k = 0; k < icv.size(); k++) {
            if (visited[k] || !calibre.get(c).matches(icv.get(k), tolerance)) {
                continue;
            }
            visited[k] = true;
            if (pairedWith[k] < 0 || augment(pairedWith[k], calibre, icv, pairedWith, visited)) {
                pairedWith[k] = c;
                return true;
            }
        }
        return false;
    }
}
