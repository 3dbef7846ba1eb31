package org.rulebridge.cli.commands;

import org.rulebridge.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the {@code compare} subcommand.
 */
@Tag("integration")
public class CompareCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void matchingReportsExitWithZero() throws IOException {
        // Arrange
        Path calibre = write("calibre.rpt", "RULECHECK M1.W.1\nPOLYGON 1 ( 10.5 20.3 ) ( 11 21 )\n");
        Path icv = write("icv.log", "M1.W.1 violation at (10.5003, 20.2997)\n");

        // Act
        int exitCode = execute("compare", "-c", calibre.toString(), "-i", icv.toString());

        // Assert
        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("RESULT: PERFECT MATCH");
    }

    @Test
    void tighterToleranceReportsDifferences() throws IOException {
        Path calibre = write("calibre.rpt", "RULECHECK M1.W.1\nPOLYGON 1 ( 10.5 20.3 )\n");
        Path icv = write("icv.log", "M1.W.1 violation at (10.5003, 20.2997)\n");

        int exitCode = execute("compare", "-c", calibre.toString(), "-i", icv.toString(), "-t", "0.0001");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("Location mismatches (1):");
    }

    @Test
    void missingReportFails() throws IOException {
        Path icv = write("icv.log", "");

        int exitCode = execute("compare", "-c", tempDir.resolve("absent.rpt").toString(), "-i", icv.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Cannot read report");
    }
}
