package org.rulebridge.reconcile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Calibre ASCII DRC reports.
 * <p>
 * A {@code RULECHECK <name>} line starts a rule; every following {@code POLYGON} or
 * {@code EDGE} line contributes one violation located at its first {@code ( x y )} pair.
 */
public class CalibreReportParser implements IViolationReportParser {

    private static final Pattern RULECHECK = Pattern.compile("RULECHECK\\s+(\\S+)");
    private static final Pattern COORDINATE = Pattern.compile(
            "\\(\\s*(" + ReportNumbers.NUMBER + ")\\s+(" + ReportNumbers.NUMBER + ")\\s*\\)");

    @Override
    public Map<String, List<Violation>> parse(List<String> lines) {
        Map<String, List<Violation>> violations = new LinkedHashMap<>();
        String currentRule = null;
        for (String line : lines) {
            if (line.contains("RULECHECK")) {
                Matcher m = RULECHECK.matcher(line);
                if (m.find()) {
                    currentRule = m.group(1);
                }
            } else if (currentRule != null && (line.contains("POLYGON") || line.contains("EDGE"))) {
                String shape = line.contains("POLYGON") ? "polygon" : "edge";
                String rule = currentRule;
                firstCoordinate(line).ifPresent(xy -> violations
                        .computeIfAbsent(rule, k -> new ArrayList<>())
                        .add(new Violation(rule, xy[0], xy[1], shape)));
            }
        }
        return violations;
    }

    private static Optional<double[]> firstCoordinate(String line) {
        Matcher m = COORDINATE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new double[]{Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2))});
    }
}
