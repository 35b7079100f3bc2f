package com.sidr.store;

import com.sidr.error.SidrException;
import com.sidr.record.TableRecord;

/**
 * Receives the decoded rows of a table scan.
 */
@FunctionalInterface
public interface RowVisitor {

    /**
     * @return false to stop the scan after this row
     */
    boolean visit(TableRecord record) throws SidrException;
}
