package com.sidr.store;

import lombok.Value;

/**
 * Outcome of one table scan.
 */
@Value
public class ScanResult {
    String tableName;
    long rows;
    long skippedRows;
    boolean stoppedEarly;
}
