package org.rulebridge.reconcile;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link ViolationComparator}.
 * These tests cover every comparison status and the one-to-one pairing of locations.
 */
public class ViolationComparatorTest {

    private final ViolationComparator comparator = new ViolationComparator(0.001);

    private static Violation v(String rule, double x, double y) {
        return new Violation(rule, x, y, "unknown");
    }

    /**
     * Coordinates that differ by less than the tolerance on both axes are the same violation.
     */
    @Test
    @Tag("unit")
    void locationsWithinToleranceMatch() {
        // Arrange
        Map<String, List<Violation>> calibre = Map.of("M1.W.1", List.of(v("M1.W.1", 10.5, 20.3)));
        Map<String, List<Violation>> icv = Map.of("M1.W.1", List.of(v("M1.W.1", 10.5003, 20.2997)));

        // Act
        ComparisonResult result = comparator.compare(calibre, icv);

        // Assert
        assertThat(result.rules()).singleElement()
                .extracting(RuleComparison::status).isEqualTo(RuleComparison.Status.MATCH);
        assertThat(result.perfectMatch()).isTrue();
        assertThat(result.totalCalibre()).isEqualTo(1);
        assertThat(result.totalIcv()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void locationsBeyondToleranceDiffer() {
        ComparisonResult result = comparator.compare(
                Map.of("R", List.of(v("R", 10.5, 20.3))),
                Map.of("R", List.of(v("R", 10.502, 20.3))));

        assertThat(result.rules().get(0).status()).isEqualTo(RuleComparison.Status.LOCATIONS_DIFFER);
        assertThat(result.perfectMatch()).isFalse();
    }

    @Test
    @Tag("unit")
    void differentCountsAreReported() {
        ComparisonResult result = comparator.compare(
                Map.of("R", List.of(v("R", 1, 1), v("R", 2, 2))),
                Map.of("R", List.of(v("R", 1, 1))));

        assertThat(result.rules().get(0))
                .extracting(RuleComparison::status, RuleComparison::calibreCount, RuleComparison::icvCount)
                .containsExactly(RuleComparison.Status.COUNTS_DIFFER, 2, 1);
    }

    @Test
    @Tag("unit")
    void rulesPresentInOneReportOnly() {
        ComparisonResult result = comparator.compare(
                Map.of("B", List.of(v("B", 0, 0))),
                Map.of("A", List.of(v("A", 0, 0))));

        assertThat(result.rules()).extracting(RuleComparison::rule, RuleComparison::status)
                .containsExactly(
                        tuple("A", RuleComparison.Status.ONLY_ICV),
                        tuple("B", RuleComparison.Status.ONLY_CALIBRE));
    }

    /**
     * Each ICV violation may pair with only one Calibre violation, so two Calibre
     * violations near the same ICV point do not both match it.
     */
    @Test
    @Tag("unit")
    void pairingIsOneToOne() {
        ComparisonResult result = comparator.compare(
                Map.of("R", List.of(v("R", 1, 1), v("R", 1.0005, 1))),
                Map.of("R", List.of(v("R", 1, 1), v("R", 5, 5))));

        assertThat(result.rules().get(0).status()).isEqualTo(RuleComparison.Status.LOCATIONS_DIFFER);
    }

    /**
     * The first candidate of an earlier violation is given up when that is the only way
     * to pair every violation.
     */
    @Test
    @Tag("unit")
    void earlierPairingIsRevisitedToCompleteTheMatch() {
        // Arrange
        ViolationComparator wide = new ViolationComparator(1.0);
        Map<String, List<Violation>> calibre = Map.of("R", List.of(v("R", 0, 0), v("R", 1.8, 0)));
        Map<String, List<Violation>> icv = Map.of("R", List.of(v("R", 0.9, 0), v("R", -0.9, 0)));

        // Act
        ComparisonResult result = wide.compare(calibre, icv);

        // Assert
        assertThat(result.rules().get(0).status()).isEqualTo(RuleComparison.Status.MATCH);
    }

    @Test
    @Tag("unit")
    void differenceEqualToToleranceIsOutside() {
        ViolationComparator half = new ViolationComparator(0.5);

        ComparisonResult result = half.compare(
                Map.of("R", List.of(v("R", 1.0, 2.0))),
                Map.of("R", List.of(v("R", 1.5, 2.0))));

        assertThat(result.rules().get(0).status()).isEqualTo(RuleComparison.Status.LOCATIONS_DIFFER);
    }

    @Test
    @Tag("unit")
    void orderOfViolationsDoesNotMatter() {
        ComparisonResult result = comparator.compare(
                Map.of("R", List.of(v("R", 1, 1), v("R", 2, 2))),
                Map.of("R", List.of(v("R", 2, 2), v("R", 1, 1))));

        assertThat(result.perfectMatch()).isTrue();
    }

    @Test
    @Tag("unit")
    void emptyReportsAreAPerfectMatch() {
        assertThat(comparator.compare(Map.of(), Map.of()).perfectMatch()).isTrue();
    }

    @Test
    @Tag("unit")
    void negativeToleranceIsRejected() {
        assertThatThrownBy(() -> new ViolationComparator(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void reportListsEachStatusSection() {
        ComparisonResult result = comparator.compare(
                Map.of("M1.W.1", List.of(v("M1.W.1", 1, 1)), "ONLY.C", List.of(v("ONLY.C", 0, 0))),
                Map.of("M1.W.1", List.of(v("M1.W.1", 1, 1))));
        StringWriter text = new StringWriter();

        new ComparisonReportPrinter(new PrintWriter(text)).print(result, 0.001);

        assertThat(text.toString())
                .contains("Total Calibre violations: 2")
                .contains("Perfect matches (1):")
                .contains("Only in Calibre (1):")
                .contains("RESULT: DIFFERENCES FOUND")
                .doesNotContain("Only in ICV");
    }
}
