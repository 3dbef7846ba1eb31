package org.rulebridge.cli.commands;

import com.typesafe.config.Config;
import org.rulebridge.cli.CommandLineInterface;
import org.rulebridge.cli.config.LoggingConfigurator;
import org.rulebridge.translator.TranslationStatistics;
import org.rulebridge.translator.Translator;
import org.rulebridge.translator.api.TranslationArtifact;
import org.rulebridge.translator.api.TranslationException;
import org.rulebridge.translator.config.TranslatorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "translate",
    description = "Translates an SVRF rule deck into a PXL rule deck"
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

    @Option(
        names = {"-i", "--input"},
        required = true,
        description = "Input SVRF rule deck"
    )
    private Path input;

    @Option(
        names = {"-o", "--output"},
        required = true,
        description = "Output PXL rule deck"
    )
    private Path output;

    @Option(
        names = {"-v", "--verbose"},
        description = "Verbose output: debug logging, statistics and stack traces"
    )
    private boolean verbose;

    @Option(
        names = {"--stats"},
        description = "Print translation statistics"
    )
    private boolean stats;

    @Option(
        names = {"--strict"},
        description = "Fail when any statement cannot be translated (overrides translator.strict-mode)"
    )
    private Boolean strict;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config = parent.getConfig();
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }
        TranslatorSettings settings = TranslatorSettings.fromConfig(config);
        if (strict != null) {
            settings = settings.withStrictMode(strict);
        }

        String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.error("Input file not found: {}", input);
            err.println("Error: Input file not found: " + input);
            return 1;
        } catch (IOException e) {
            log.error("Failed to read input file {}", input, e);
            err.println("Error: Cannot read input file " + input + ": " + e.getMessage());
            return 1;
        }

        out.println("Translating " + input + " -> " + output);
        TranslationArtifact artifact;
        try {
            artifact = new Translator(settings).translate(source, input.getFileName().toString());
        } catch (TranslationException e) {
            log.error("Translation of {} failed: {}", input, e.getMessage());
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }

        try {
            Files.writeString(output, artifact.output(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write output file {}", output, e);
            err.println("Error: Cannot write output file " + output + ": " + e.getMessage());
            return 1;
        }

        if (stats || verbose) {
            printStatistics(out, artifact);
        }
        if (verbose) {
            artifact.diagnostics().forEach(out::println);
        }
        out.println("Translation completed successfully!");
        return 0;
    }

    private static void printStatistics(PrintWriter out, TranslationArtifact artifact) {
        TranslationStatistics s = artifact.statistics();
        String text = artifact.output();
        long lines = text.chars().filter(c -> c == '\n').count();
        int bytes = text.getBytes(StandardCharsets.UTF_8).length;

        out.println();
        out.println("Translation Statistics:");
        out.printf("  Layers:            %d%n", s.layers());
        out.printf("  Rules:             %d%n", s.rules());
        out.printf("    Width checks:    %d%n", s.widthChecks());
        out.printf("    Spacing checks:  %d (external: %d, internal: %d)%n",
                s.spacingChecks(), s.externalSpacingChecks(), s.internalSpacingChecks());
        out.printf("    Enclosure:       %d%n", s.enclosureChecks());
        out.printf("    Boolean ops:     %d%n", s.booleanOps());
        out.printf("  Skipped:           %d%n", s.skippedStatements());
        out.printf("  Output:            %d lines, %d bytes%n", lines, bytes);
        out.println();
    }
}
