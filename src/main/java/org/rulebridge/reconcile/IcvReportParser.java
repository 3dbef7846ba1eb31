package org.rulebridge.reconcile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses IC Validator result logs.
 * <p>
 * Every line mentioning {@code violation} (in any case) whose first word is a rule name
 * and which contains a coordinate pair contributes one violation, e.g.
 * <pre>
 *   M1.W.1 violation at (10.5003, 20.2997)
 * </pre>
 */
public class IcvReportParser implements IViolationReportParser {

    private static final Pattern VIOLATION_LINE = Pattern.compile(
            "^\\s*([\\w.]+)[\\s:].*?(" + ReportNumbers.NUMBER + ")[,\\s]+(" + ReportNumbers.NUMBER + ")");

    @Override
    public Map<String, List<Violation>> parse(List<String> lines) {
        Map<String, List<Violation>> violations = new LinkedHashMap<>();
        for (String line : lines) {
            if (!line.toLowerCase(Locale.ROOT).contains("violation")) {
                continue;
            }
            Matcher m = VIOLATION_LINE.matcher(line);
            if (m.find()) {
                String rule = m.group(1);
                violations.computeIfAbsent(rule, k -> new ArrayList<>())
                        .add(new Violation(rule, Double.parseDouble(m.group(2)), Double.parseDouble(m.group(3)), "unknown"));
            }
        }
        return violations;
    }
}
