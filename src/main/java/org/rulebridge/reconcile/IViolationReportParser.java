package org.rulebridge.reconcile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads the native result report of one DRC engine.
 */
public interface IViolationReportParser {

    /**
     * @param lines The report lines.
     * @return The violations grouped by rule name, in report order.
     */
    Map<String, List<Violation>> parse(List<String> lines);

    /**
     * @param reportPath The report file.
     * @return The violations grouped by rule name.
     * @throws IOException if the report cannot be read.
     */
    default Map<String, List<Violation>> parse(Path reportPath) throws IOException {
        return parse(Files.readAllLines(reportPath, StandardCharsets.UTF_8));
    }
}
