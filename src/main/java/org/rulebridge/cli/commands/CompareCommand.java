package org.rulebridge.cli.commands;

import com.typesafe.config.Config;
import org.rulebridge.cli.CommandLineInterface;
import org.rulebridge.cli.config.LoggingConfigurator;
import org.rulebridge.reconcile.CalibreReportParser;
import org.rulebridge.reconcile.ComparisonReportPrinter;
import org.rulebridge.reconcile.ComparisonResult;
import org.rulebridge.reconcile.IcvReportParser;
import org.rulebridge.reconcile.Violation;
import org.rulebridge.reconcile.ViolationComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "compare",
    description = "Compares Calibre and IC Validator DRC results rule by rule"
)
public class CompareCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompareCommand.class);
    private static final String TOLERANCE_PATH = "reconcile.tolerance";
    private static final double DEFAULT_TOLERANCE = 0.001;

    @Option(
        names = {"-c", "--calibre"},
        required = true,
        description = "Calibre ASCII DRC report"
    )
    private Path calibreReport;

    @Option(
        names = {"-i", "--icv"},
        required = true,
        description = "IC Validator result log"
    )
    private Path icvReport;

    @Option(
        names = {"-t", "--tolerance"},
        description = "Coordinate tolerance in microns (default: reconcile.tolerance)"
    )
    private Double tolerance;

    @Option(
        names = {"-v", "--verbose"},
        description = "Verbose output"
    )
    private boolean verbose;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }
        double effectiveTolerance = tolerance != null ? tolerance
                : config.hasPath(TOLERANCE_PATH) ? config.getDouble(TOLERANCE_PATH) : DEFAULT_TOLERANCE;

        Map<String, List<Violation>> calibre;
        Map<String, List<Violation>> icv;
        try {
            calibre = new CalibreReportParser().parse(calibreReport);
            icv = new IcvReportParser().parse(icvReport);
        } catch (IOException e) {
            log.error("Failed to read DRC report", e);
            spec.commandLine().getErr().println("Error: Cannot read report: " + e.getMessage());
            return 1;
        }
        log.debug("Parsed {} Calibre rules and {} ICV rules", calibre.size(), icv.size());

        ViolationComparator comparator;
        try {
            comparator = new ViolationComparator(effectiveTolerance);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
        ComparisonResult result = comparator.compare(calibre, icv);
        new ComparisonReportPrinter(spec.commandLine().getOut()).print(result, comparator.tolerance());
        return result.perfectMatch() ? 0 : 1;
    }
}
