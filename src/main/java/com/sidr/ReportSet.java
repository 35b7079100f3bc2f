package com.sidr;

import com.sidr.mapping.ArtifactMapper;
import com.sidr.mapping.ReportKind;
import com.sidr.mapping.ReportRecord;
import com.sidr.report.ReportProducer;
import com.sidr.report.ReportSink;
import com.sidr.types.Value;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * The open reports of one store, one per report kind the mapper can produce.
 */
public final class ReportSet implements Closeable {
    private final Map<ReportKind, ReportSink> sinks;

    private ReportSet(Map<ReportKind, ReportSink> sinks) {
        this.sinks = sinks;
    }

    public static ReportSet open(ReportProducer producer, Path storePath, String hostname, ArtifactMapper mapper)
            throws IOException {
        var sinks = new EnumMap<ReportKind, ReportSink>(ReportKind.class);
        var reports = new ReportSet(sinks);
        try {
            for (var kind : mapper.getReportKinds()) {
                var sink = producer.newReport(storePath, hostname, kind);
                sinks.put(kind, sink);
                for (var field : mapper.declaredFields(kind)) {
                    sink.declareField(field);
                }
            }
        } catch (IOException | RuntimeException e) {
            try {
                reports.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return reports;
    }

    /**
     * Emit one record. The sink sees exactly one begin and one end even for a record without fields.
     */
    public void write(ReportRecord record) throws IOException {
        var sink = sinks.get(record.getKind());
        if (sink == null) {
            throw new IllegalStateException("No report open for " + record.getKind());
        }
        synchronized (sink) {
            sink.beginRecord();
            for (var field : record.getFields().entrySet()) {
                var value = field.getValue();
                if (value instanceof Value.IntValue) {
                    sink.setInteger(field.getKey(), ((Value.IntValue) value).getValue());
                } else {
                    sink.setString(field.getKey(), String.valueOf(value.asObject()));
                }
            }
            sink.endRecord();
        }
    }

    public long recordCount(ReportKind kind) {
        var sink = sinks.get(kind);
        return sink == null ? 0 : sink.getRecordCount();
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (var sink : sinks.values()) {
            try {
                sink.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
