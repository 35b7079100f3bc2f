package com.sidr.report;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Comma-separated rows under a header line.
 * <p>
 * The header lists the declared fields followed by any other field of the first record,
 * and is written with that first record. Text values are quoted with embedded quotes
 * doubled; integers are written bare; unset fields are left empty. On shared output
 * the header starts with {@code Report Suffix} and every row with the report name.
 */
@Slf4j
public final class CsvReport extends AbstractReport {
    static final String SUFFIX_COLUMN = "Report Suffix";

    private final Set<String> header = new LinkedHashSet<>();
    private final Set<String> dropped = new LinkedHashSet<>();
    private boolean headerWritten;

    CsvReport(LineTarget target, String streamTag) {
        super(target, streamTag);
    }

    @Override
    public synchronized void declareField(String name) {
        if (headerWritten) {
            log.debug("Field {} declared after the CSV header was written", name);
            return;
        }
        header.add(name);
    }

    @Override
    protected void writeRecord(Map<String, Object> fields) throws IOException {
        if (!headerWritten) {
            header.addAll(fields.keySet());
            target.writeLine(headerLine());
            headerWritten = true;
        }
        var row = new StringBuilder();
        if (streamTag != null) {
            row.append(quote(streamTag));
        }
        boolean first = streamTag == null;
        for (var name : header) {
            if (!first) {
                row.append(',');
            }
            first = false;
            var value = fields.get(name);
            if (value instanceof Long) {
                row.append(value);
            } else if (value != null) {
                row.append(quote(value.toString()));
            }
        }
        for (var name : fields.keySet()) {
            if (!header.contains(name) && dropped.add(name)) {
                log.warn("Field {} is not in the CSV header and is left out", name);
            }
        }
        target.writeLine(row.toString());
    }

    private String headerLine() {
        var line = new StringBuilder();
        if (streamTag != null) {
            line.append(SUFFIX_COLUMN);
        }
        for (var name : header) {
            if (line.length() > 0) {
                line.append(',');
            }
            line.append(name);
        }
        return line.toString();
    }

    static String quote(String value) {
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
