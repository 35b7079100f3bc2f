package com.sidr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Sidr")
class SidrTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    private int run(String... args) {
        return Sidr.run(args, new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    private String console() {
        return console.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should print usage for invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThat(run("-f", "xml", "evidence")).isEqualTo(Sidr.EXIT_USAGE);
        assertThat(console()).contains("Unknown report format: xml").contains("Usage: sidr");
    }

    @Test
    @DisplayName("should print usage on request")
    void shouldPrintHelp() {
        assertThat(run("--help")).isEqualTo(Sidr.EXIT_OK);
        assertThat(console()).startsWith("Usage: sidr");
    }

    @Test
    @DisplayName("should fail for a missing input directory")
    void shouldFailForMissingInput() {
        assertThat(run("-o", tempDir.resolve("out").toString(), tempDir.resolve("missing").toString()))
                .isEqualTo(Sidr.EXIT_INPUT);
    }

    @Test
    @DisplayName("should fail when the output directory cannot be created")
    void shouldFailForUnusableOutput() throws IOException {
        var file = Files.write(tempDir.resolve("out"), new byte[] {1});
        Files.createDirectories(tempDir.resolve("in"));

        assertThat(run("-o", file.toString(), tempDir.resolve("in").toString())).isEqualTo(Sidr.EXIT_INPUT);
    }

    @Test
    @DisplayName("should complete a scan without stores")
    void shouldScanEmptyDirectory() throws IOException {
        var input = Files.createDirectories(tempDir.resolve("in"));
        var output = tempDir.resolve("out");

        assertThat(run("-o", output.toString(), input.toString())).isEqualTo(Sidr.EXIT_OK);
        assertThat(output).isDirectory();
        try (var files = Files.list(output)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("should complete a scan when a store is damaged")
    void shouldSurviveDamagedStore() throws IOException {
        var input = Files.createDirectories(tempDir.resolve("in"));
        Files.write(input.resolve("Windows.edb"), new byte[8192]);

        assertThat(run("-o", tempDir.resolve("out").toString(), input.toString())).isEqualTo(Sidr.EXIT_OK);
    }
}
