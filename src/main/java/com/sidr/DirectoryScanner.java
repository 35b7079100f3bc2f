package com.sidr;

import com.sidr.error.SidrException;
import com.sidr.report.ReportProducer;
import com.sidr.sqlite.SqliteReportGenerator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;

/**
 * Walks a directory tree and generates reports for every {@code Windows.edb} and
 * {@code Windows.db} found. A store that fails is logged and the walk goes on.
 */
@Slf4j
public final class DirectoryScanner {
    private final Map<String, ReportGenerator> generators;

    public DirectoryScanner(SidrConfig config) {
        this(Map.of(Constants.ESE_FILE_NAME, new EseReportGenerator(config),
                Constants.SQLITE_FILE_NAME, new SqliteReportGenerator(config)));
    }

    /**
     * @param generators report generator per exact file name
     */
    public DirectoryScanner(Map<String, ReportGenerator> generators) {
        this.generators = Map.copyOf(generators);
    }

    /**
     * @return number of stores found, including those that failed
     * @throws IOException if the input directory itself cannot be read
     */
    public int scan(Path input, ReportProducer producer) throws IOException {
        if (!Files.isDirectory(input) || !Files.isReadable(input)) {
            throw new IOException("Cannot read directory " + input);
        }
        int[] found = {0};
        Files.walkFileTree(input, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                var generator = generators.get(file.getFileName().toString());
                if (generator != null && attrs.isRegularFile()) {
                    found[0]++;
                    process(generator, file, producer);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot access {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        if (found[0] > 0) {
            log.info("Found {} Windows Search database(s)", found[0]);
        } else {
            log.info("No Windows Search database found under {}", input);
        }
        return found[0];
    }

    private static void process(ReportGenerator generator, Path file, ReportProducer producer) {
        log.info("Processing {}", file);
        try {
            generator.generateReport(file, producer);
        } catch (SidrException e) {
            log.error("Report generation for {} failed: {} ({})", file, e.getMessage(), e.getErrorType());
            log.debug("Failure details", e);
        } catch (RuntimeException e) {
            log.error("Report generation for {} failed unexpectedly", file, e);
        }
    }
}
