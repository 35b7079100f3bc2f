package com.sidr.core;

import com.sidr.error.SidrException;

/**
 * Callback for full tree scans.
 */
@FunctionalInterface
public interface RecordVisitor {
    void visit(RawRecord record) throws SidrException;
}
