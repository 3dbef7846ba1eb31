package org.rulebridge.reconcile;

/**
 * A single DRC violation reported by a verification engine, located by a representative point.
 *
 * @param rule The rule check name, e.g. {@code M1.W.1}.
 * @param x The x coordinate in microns.
 * @param y The y coordinate in microns.
 * @param shape The report element the point was taken from (polygon, edge, ...).
 */
public record Violation(String rule, double x, double y, String shape) {

    /**
     * @param other The violation to compare with.
     * @param tolerance The exclusive bound on the coordinate difference per axis.
     * @return {@code true} if both violations belong to the same rule and differ by less than the tolerance on both axes.
     */
    public boolean matches(Violation other, double tolerance) {
        return rule.equals(other.rule)
                && Math.abs(x - other.x) < tolerance
                && Math.abs(y - other.y) < tolerance;
    }
}
