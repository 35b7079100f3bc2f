package com.sidr;

import com.sidr.catalog.TableSchema;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.mapping.ArtifactMapper;
import com.sidr.mapping.ReportRecord;
import com.sidr.mapping.SourceRow;
import com.sidr.mapping.WindowsSearchMappings;
import com.sidr.report.ReportProducer;
import com.sidr.store.EseDatabase;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reports for an ESE store ({@code Windows.edb}).
 * <p>
 * Opening the store and loading its catalog must succeed, otherwise the whole file fails.
 * Each mapped table is then scanned on its own: a structurally corrupt table is logged and
 * abandoned, keeping the records already written, and the next table is scanned.
 */
@Slf4j
public final class EseReportGenerator implements ReportGenerator {
    static final int HOSTNAME_SCAN_ROWS = 10_000;

    private final ArtifactMapper mapper;
    private final SidrConfig config;
    private final int hostnameScanRows;

    public EseReportGenerator(SidrConfig config) {
        this(WindowsSearchMappings.ese(), config);
    }

    public EseReportGenerator(ArtifactMapper mapper, SidrConfig config) {
        this(mapper, config, HOSTNAME_SCAN_ROWS);
    }

    EseReportGenerator(ArtifactMapper mapper, SidrConfig config, int hostnameScanRows) {
        this.mapper = mapper;
        this.config = config;
        this.hostnameScanRows = hostnameScanRows;
    }

    @Override
    public void generateReport(Path path, ReportProducer producer) throws SidrException {
        try (var database = EseDatabase.open(path, config.isVerifyChecksums())) {
            var tables = mappedTables(database);
            if (tables.isEmpty()) {
                log.warn("{} has none of the tables {}", path, mapper.getTableNames());
                return;
            }
            var hostname = findHostname(database, tables);
            try (var reports = ReportSet.open(producer, path, hostname, mapper)) {
                for (var table : tables) {
                    scanTable(database, table, reports);
                }
                for (var kind : mapper.getReportKinds()) {
                    log.info("{}: {} {} records", path, reports.recordCount(kind), kind.getFileSuffix());
                }
            }
        } catch (IOException e) {
            throw new SidrException(ErrorType.IO_ERROR, "Cannot write reports of " + path + ": " + e.getMessage(), e);
        }
    }

    private List<TableSchema> mappedTables(EseDatabase database) {
        var tables = new ArrayList<TableSchema>();
        for (var name : mapper.getTableNames()) {
            var table = database.getCatalog().getTable(name);
            if (table != null) {
                tables.add(table);
            }
        }
        return tables;
    }

    private void scanTable(EseDatabase database, TableSchema table, ReportSet reports) throws SidrException {
        try {
            var result = database.scan(table, record -> {
                var report = mapper.map(table.getName(), SourceRow.fromRecord(table, record));
                if (report != null) {
                    write(reports, report);
                }
                return true;
            });
            log.debug("{}: table {} scanned, {} rows, {} skipped",
                    database.getReader().getPath(), table.getName(), result.getRows(), result.getSkippedRows());
        } catch (SidrException e) {
            if (e.getErrorType() == ErrorType.IO_ERROR) {
                throw e;
            }
            log.error("{}: scan of table {} aborted: {}", database.getReader().getPath(), table.getName(), e.getMessage());
        }
    }

    private static void write(ReportSet reports, ReportRecord report) throws SidrException {
        try {
            reports.write(report);
        } catch (IOException e) {
            throw new SidrException(ErrorType.IO_ERROR, "Cannot write " + report.getKind() + " record", e);
        }
    }

    /**
     * First host name found in the mapped tables, or the configured fallback. Only the host
     * name column is resolved, and each table is searched for its first rows only.
     */
    private String findHostname(EseDatabase database, List<TableSchema> tables) {
        String[] found = {null};
        for (var table : tables) {
            var columns = hostnameColumns(table);
            if (columns.isEmpty()) {
                continue;
            }
            long[] rows = {0};
            try {
                database.scan(table, columns, record -> {
                    found[0] = ArtifactMapper.hostname(SourceRow.fromRecord(table, record));
                    return found[0] == null && ++rows[0] < hostnameScanRows;
                });
            } catch (SidrException e) {
                log.debug("Host name lookup in table {} failed: {}", table.getName(), e.getMessage());
            }
            if (found[0] != null) {
                return found[0];
            }
        }
        log.info("{}: no {} recorded, using {}", database.getReader().getPath(),
                ArtifactMapper.HOSTNAME_COLUMN, config.getFallbackHostname());
        return config.getFallbackHostname();
    }

    private static IntSet hostnameColumns(TableSchema table) {
        var columns = new IntOpenHashSet();
        for (var column : table.getColumns().values()) {
            if (ArtifactMapper.HOSTNAME_COLUMN.equals(SourceRow.normalizeColumnName(column.getName()))) {
                columns.add(column.getId());
            }
        }
        return columns;
    }
}
