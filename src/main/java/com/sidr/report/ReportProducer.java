package com.sidr.report;

import com.sidr.mapping.ReportKind;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Creates the report sinks of a run.
 * <p>
 * Report files are named {@code {hostname}_{report}_{yyyyMMdd_HHmmss.nnnnnnnnn}.{json|csv}}
 * with the UTC creation time, inside the output directory, which is created if missing.
 * In standard-output mode all reports share one stream.
 */
@Slf4j
public final class ReportProducer {
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss.SSSSSSSSS").withZone(ZoneOffset.UTC);

    @Getter
    private final Path directory;
    @Getter
    private final ReportFormat format;
    @Getter
    private final ReportOutput output;
    private final PrintStream stdout;
    private final Clock clock;
    private final OutputStreamWriter stdoutWriter;

    public ReportProducer(Path directory, ReportFormat format, ReportOutput output) throws IOException {
        this(directory, format, output, System.out, Clock.systemUTC());
    }

    public ReportProducer(Path directory, ReportFormat format, ReportOutput output, PrintStream stdout, Clock clock)
            throws IOException {
        this.directory = directory;
        this.format = format;
        this.output = output;
        this.stdout = stdout;
        this.clock = clock;
        this.stdoutWriter = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
        if (output == ReportOutput.TO_FILE && !Files.isDirectory(directory)) {
            Files.createDirectories(directory);
            log.info("Created output directory {}", directory);
        }
    }

    /**
     * Open a new report for one store.
     *
     * @param storePath the store the report is generated from
     * @param hostname  host name recovered from the store, or the fallback name
     */
    public ReportSink newReport(Path storePath, String hostname, ReportKind kind) throws IOException {
        if (output == ReportOutput.TO_STDOUT) {
            var target = LineTarget.shared(stdoutWriter, stdout);
            return create(target, kind.getStreamTag());
        }
        var path = reportPath(hostname, kind);
        var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        log.info("Writing {} of {} to {}", kind.getFileSuffix(), storePath, path);
        return create(LineTarget.owned(writer), null);
    }

    Path reportPath(String hostname, ReportKind kind) {
        var name = sanitize(hostname) + "_" + kind.getFileSuffix() + "_" + TIMESTAMP.format(clock.instant())
                + "." + format.getExtension();
        return directory.resolve(name);
    }

    private ReportSink create(LineTarget target, String streamTag) {
        switch (format) {
            case CSV:
                return new CsvReport(target, streamTag);
            case JSON:
            default:
                return new JsonReport(target, streamTag);
        }
    }

    /**
     * Host names come from store content; keep them from escaping the output directory.
     */
    static String sanitize(String hostname) {
        var cleaned = hostname.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
        return cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..") ? "_" : cleaned;
    }
}
