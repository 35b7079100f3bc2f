package com.sidr.report;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Buffers the fields of the current record and hands the finished record to the format.
 * Field values are {@link String} or {@link Long}.
 */
abstract class AbstractReport implements ReportSink {
    protected final LineTarget target;
    /** Report name written in front of every record on shared output, null for a report file. */
    protected final String streamTag;

    private final Map<String, Object> pending = new LinkedHashMap<>();
    private long recordCount;
    private boolean closed;

    AbstractReport(LineTarget target, String streamTag) {
        this.target = target;
        this.streamTag = streamTag;
    }

    @Override
    public synchronized void beginRecord() {
        pending.clear();
    }

    @Override
    public synchronized void setString(String name, String value) {
        if (value != null) {
            pending.put(name, value);
        }
    }

    @Override
    public synchronized void setInteger(String name, long value) {
        pending.put(name, value);
    }

    @Override
    public synchronized void endRecord() throws IOException {
        if (closed) {
            throw new IOException("Report already closed");
        }
        if (pending.isEmpty()) {
            return;
        }
        try {
            writeRecord(pending);
            recordCount++;
        } finally {
            pending.clear();
        }
    }

    @Override
    public synchronized long getRecordCount() {
        return recordCount;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        target.close();
    }

    protected abstract void writeRecord(Map<String, Object> fields) throws IOException;
}
