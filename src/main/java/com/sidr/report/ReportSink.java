package com.sidr.report;

import java.io.Closeable;
import java.io.IOException;

/**
 * Receives report records field by field.
 * <p>
 * Fields set between {@link #beginRecord()} and {@link #endRecord()} form one record,
 * which is written as a unit when it ends; a record without fields is dropped.
 * Implementations are safe to share between threads.
 */
public interface ReportSink extends Closeable {

    void beginRecord();

    /**
     * Announce a field before any record is written, so tabular output can list it in its header.
     */
    void declareField(String name);

    void setString(String name, String value);

    void setInteger(String name, long value);

    void endRecord() throws IOException;

    /**
     * @return the number of records written so far
     */
    long getRecordCount();
}
