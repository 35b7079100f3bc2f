package com.sidr.sqlite;

import com.sidr.ReportGenerator;
import com.sidr.ReportSet;
import com.sidr.SidrConfig;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.mapping.ArtifactMapper;
import com.sidr.mapping.SourceRow;
import com.sidr.mapping.WindowsSearchMappings;
import com.sidr.report.ReportProducer;
import com.sidr.types.Value;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Reports for a SQLite store ({@code Windows.db}).
 * <p>
 * The property store keeps one row per (work id, property); rows are pivoted into one
 * {@link SourceRow} per work id, keyed by the property's unique key from the metadata
 * table, and handed to the mapper under the property store's table name.
 */
@Slf4j
public final class SqliteReportGenerator implements ReportGenerator {
    static final String PROPERTY_TABLE = WindowsSearchMappings.SQLITE_PROPERTY_STORE;
    static final String METADATA_TABLE = PROPERTY_TABLE + "_Metadata";
    static final String WORK_ID_COLUMN = "WorkID";

    private static final String PROPERTIES_QUERY = "SELECT s.WorkId, m.UniqueKey, s.Value FROM " + PROPERTY_TABLE
            + " s JOIN " + METADATA_TABLE + " m ON m.Id = s.ColumnId ORDER BY s.WorkId";
    private static final String HOSTNAME_QUERY = "SELECT s.Value FROM " + PROPERTY_TABLE
            + " s JOIN " + METADATA_TABLE + " m ON m.Id = s.ColumnId WHERE m.UniqueKey LIKE ?";
    private static final String TABLE_QUERY = "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?";

    private final ArtifactMapper mapper;
    private final SidrConfig config;

    public SqliteReportGenerator(SidrConfig config) {
        this(WindowsSearchMappings.sqlite(), config);
    }

    public SqliteReportGenerator(ArtifactMapper mapper, SidrConfig config) {
        this.mapper = mapper;
        this.config = config;
    }

    @Override
    public void generateReport(Path path, ReportProducer producer) throws SidrException {
        try (var connection = open(path)) {
            if (!hasTable(connection, PROPERTY_TABLE) || !hasTable(connection, METADATA_TABLE)) {
                log.warn("{} has no {} / {} tables", path, PROPERTY_TABLE, METADATA_TABLE);
                return;
            }
            var hostname = findHostname(connection);
            if (hostname == null) {
                log.info("{}: no {} recorded, using {}", path, ArtifactMapper.HOSTNAME_COLUMN, config.getFallbackHostname());
                hostname = config.getFallbackHostname();
            }
            try (var reports = ReportSet.open(producer, path, hostname, mapper);
                 var statement = connection.prepareStatement(PROPERTIES_QUERY);
                 var rows = statement.executeQuery()) {
                long items = pivot(rows, reports);
                log.info("{}: {} work items", path, items);
                for (var kind : mapper.getReportKinds()) {
                    log.info("{}: {} {} records", path, reports.recordCount(kind), kind.getFileSuffix());
                }
            }
        } catch (SQLException e) {
            throw new SidrException(ErrorType.DATABASE_ERROR, "Cannot read " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SidrException(ErrorType.IO_ERROR, "Cannot write reports of " + path + ": " + e.getMessage(), e);
        }
    }

    static Connection open(Path path) throws SQLException {
        var sqliteConfig = new SQLiteConfig();
        sqliteConfig.setReadOnly(true);
        return sqliteConfig.createConnection("jdbc:sqlite:" + path.toAbsolutePath());
    }

    private static boolean hasTable(Connection connection, String table) throws SQLException {
        try (var statement = connection.prepareStatement(TABLE_QUERY)) {
            statement.setString(1, table);
            try (var result = statement.executeQuery()) {
                return result.next();
            }
        }
    }

    private static String findHostname(Connection connection) throws SQLException {
        try (var statement = connection.prepareStatement(HOSTNAME_QUERY)) {
            statement.setString(1, "%" + ArtifactMapper.HOSTNAME_COLUMN);
            try (var result = statement.executeQuery()) {
                while (result.next()) {
                    var row = SourceRow.builder()
                            .put(ArtifactMapper.HOSTNAME_COLUMN, toValue(result.getObject(1)))
                            .build();
                    var hostname = ArtifactMapper.hostname(row);
                    if (hostname != null) {
                        return hostname;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Rows arrive ordered by work id; a change of work id completes the previous item.
     *
     * @return the number of items
     */
    private long pivot(ResultSet rows, ReportSet reports) throws SQLException, IOException {
        long items = 0;
        long currentWorkId = 0;
        SourceRow.Builder current = null;
        while (rows.next()) {
            long workId = rows.getLong(1);
            if (current == null || currentWorkId != workId) {
                if (current != null) {
                    emit(current.build(), reports);
                    items++;
                }
                currentWorkId = workId;
                current = SourceRow.builder().put(WORK_ID_COLUMN, Value.fromLong(workId));
            }
            var key = rows.getString(2);
            if (key != null) {
                current.put(key, toValue(rows.getObject(3)));
            }
        }
        if (current != null) {
            emit(current.build(), reports);
            items++;
        }
        return items;
    }

    private void emit(SourceRow row, ReportSet reports) throws IOException {
        var record = mapper.map(PROPERTY_TABLE, row);
        if (record != null) {
            reports.write(record);
        }
    }

    static Value toValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[]) {
            return Value.fromBinary((byte[]) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Value.fromLong(((Number) value).longValue());
        }
        if (value instanceof Number) {
            return Value.fromDouble(((Number) value).doubleValue());
        }
        return Value.fromText(value.toString());
    }
}
