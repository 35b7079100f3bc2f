package com.sidr;

import com.sidr.error.SidrException;
import com.sidr.report.ReportProducer;

import java.nio.file.Path;

/**
 * Produces the artifact reports of one Windows Search store.
 */
public interface ReportGenerator {

    /**
     * @throws SidrException if the store cannot be opened or its reports cannot be written;
     *                       failures confined to one table or one record are logged instead
     */
    void generateReport(Path path, ReportProducer producer) throws SidrException;
}
