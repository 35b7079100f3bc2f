package com.sidr.store;

import com.sidr.catalog.Catalog;
import com.sidr.catalog.TableSchema;
import com.sidr.core.BTree;
import com.sidr.core.PageReader;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.record.LongValueResolver;
import com.sidr.record.RecordDecoder;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * An open ESE store: the page reader plus the catalog loaded from it.
 * <p>
 * Opening fails if the header or the catalog cannot be read. Table scans decode every
 * leaf record, resolve long values, and skip records that fail with a record-level
 * error; any other error aborts the scan and propagates.
 */
@Slf4j
@Getter
public final class EseDatabase implements Closeable {

    private final PageReader reader;
    private final Catalog catalog;
    private final BTree tree;

    private EseDatabase(PageReader reader, BTree tree, Catalog catalog) {
        this.reader = reader;
        this.tree = tree;
        this.catalog = catalog;
    }

    public static EseDatabase open(Path path, boolean verifyChecksums) throws SidrException {
        var reader = PageReader.open(path, verifyChecksums);
        try {
            var tree = new BTree(reader);
            var catalog = Catalog.load(tree);
            if (log.isDebugEnabled()) {
                catalog.describe().forEach(line -> log.debug("{}: {}", path, line));
            }
            return new EseDatabase(reader, tree, catalog);
        } catch (SidrException | RuntimeException e) {
            try {
                reader.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Scan a table in key order.
     *
     * @throws SidrException if the table is unknown or its tree is structurally corrupt
     */
    public ScanResult scan(String tableName, RowVisitor visitor) throws SidrException {
        var table = catalog.getTable(tableName);
        if (table == null) {
            throw new SidrException(ErrorType.CATALOG_CORRUPT, "No table " + tableName + " in " + reader.getPath());
        }
        return scan(table, visitor);
    }

    public ScanResult scan(TableSchema table, RowVisitor visitor) throws SidrException {
        return scan(table, null, visitor);
    }

    /**
     * Scan a table, narrowing every record to {@code columnIds} before its long values are
     * resolved. Long values of the other columns are never read.
     *
     * @param columnIds columns to keep, or null for all of them
     */
    public ScanResult scan(TableSchema table, IntSet columnIds, RowVisitor visitor) throws SidrException {
        boolean largePages = reader.getHeader().isLargePageLayout();
        var longValues = table.hasLongValues() ? new LongValueResolver(tree, table.getLongValueRootPage()) : null;
        var cursor = tree.openCursor(table.getRootPage());
        long rows = 0;
        long skipped = 0;
        for (var raw = cursor.first(); raw != null; raw = cursor.next()) {
            try {
                var record = RecordDecoder.decode(table, raw.getData(), largePages);
                if (columnIds != null) {
                    record = record.retain(columnIds);
                }
                if (longValues != null) {
                    record = longValues.resolveAll(table, record);
                }
                rows++;
                if (!visitor.visit(record)) {
                    return new ScanResult(table.getName(), rows, skipped, true);
                }
            } catch (SidrException e) {
                if (!e.isRecordLocal()) {
                    throw e;
                }
                skipped++;
                log.warn("{}: skipping record at page {} tag {} of table {}: {}", reader.getPath().getFileName(),
                        raw.getPageNumber(), raw.getTagIndex(), table.getName(), e.getMessage());
            }
        }
        return new ScanResult(table.getName(), rows, skipped, false);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
