package com.sidr;

import com.sidr.report.ReportFormat;
import com.sidr.report.ReportOutput;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineTest {

    @Test
    void defaults() {
        var commandLine = CommandLine.parse("evidence");

        assertEquals(Paths.get("evidence"), commandLine.getInput());
        assertEquals(ReportFormat.JSON, commandLine.getFormat());
        assertEquals(ReportOutput.TO_FILE, commandLine.getOutput());
        assertEquals(Paths.get("").toAbsolutePath(), commandLine.getOutputDirectory());
        assertFalse(commandLine.isHelp());
    }

    @Test
    void shortOptions() {
        var commandLine = CommandLine.parse("-f", "csv", "-r", "to-stdout", "-o", "out", "evidence");

        assertEquals(ReportFormat.CSV, commandLine.getFormat());
        assertEquals(ReportOutput.TO_STDOUT, commandLine.getOutput());
        assertEquals(Paths.get("out"), commandLine.getOutputDirectory());
        assertEquals(Paths.get("evidence"), commandLine.getInput());
    }

    @Test
    void longOptionsInAnyOrder() {
        var commandLine = CommandLine.parse("evidence", "--outdir", "out", "--report-type", "TO-FILE", "--format", "JSON");

        assertEquals(ReportFormat.JSON, commandLine.getFormat());
        assertEquals(ReportOutput.TO_FILE, commandLine.getOutput());
        assertEquals(Paths.get("out"), commandLine.getOutputDirectory());
    }

    @Test
    void helpNeedsNoInput() {
        assertTrue(CommandLine.parse("--help").isHelp());
        assertTrue(CommandLine.parse("-f", "csv", "-h").isHelp());
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, CommandLine::parse);
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse("-f", "xml", "evidence"));
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse("-r", "to-printer", "evidence"));
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse("evidence", "-o"));
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse("--verbose", "evidence"));
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse("one", "two"));
    }
}
