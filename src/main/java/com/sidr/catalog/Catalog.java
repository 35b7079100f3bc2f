package com.sidr.catalog;

import com.sidr.Constants;
import com.sidr.core.BTree;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.types.ColumnType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table schemas of one store, keyed by table name.
 */
@Slf4j
public final class Catalog {

    private final Map<String, TableSchema> tables;

    Catalog(Map<String, TableSchema> tables) {
        this.tables = Collections.unmodifiableMap(tables);
    }

    /**
     * @return the table, or null if the store has no table of that name
     */
    public TableSchema getTable(String name) {
        return tables.get(name);
    }

    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    public Set<String> getTableNames() {
        return tables.keySet();
    }

    public int size() {
        return tables.size();
    }

    /**
     * Read the catalog tree, falling back to the shadow catalog when the primary one is
     * structurally damaged.
     */
    public static Catalog load(BTree tree) throws SidrException {
        try {
            return load(tree, Constants.CATALOG_ROOT_PAGE);
        } catch (SidrException e) {
            if (e.getErrorType() == ErrorType.CATALOG_CORRUPT) {
                throw e;
            }
            log.warn("Catalog at page {} unreadable ({}), trying shadow catalog at page {}",
                    Constants.CATALOG_ROOT_PAGE, e.getMessage(), Constants.SHADOW_CATALOG_ROOT_PAGE);
            try {
                return load(tree, Constants.SHADOW_CATALOG_ROOT_PAGE);
            } catch (SidrException shadowFailure) {
                var failure = new SidrException(ErrorType.CATALOG_CORRUPT,
                        "Neither catalog nor shadow catalog readable: " + e.getMessage(), e);
                failure.addSuppressed(shadowFailure);
                throw failure;
            }
        }
    }

    static Catalog load(BTree tree, int rootPage) throws SidrException {
        var builders = new LinkedHashMap<Integer, TableSchema.Builder>();
        int[] skipped = {0};
        tree.forEach(rootPage, record -> {
            CatalogEntry entry;
            try {
                entry = CatalogDecoder.decode(record.getData());
            } catch (SidrException e) {
                if (!e.isRecordLocal()) {
                    throw e;
                }
                skipped[0]++;
                log.warn("Skipping unreadable catalog row at page {} tag {}: {}",
                        record.getPageNumber(), record.getTagIndex(), e.getMessage());
                return;
            }
            apply(builders.computeIfAbsent(entry.getTableObjectId(), TableSchema::builder), entry);
        });

        var tables = new LinkedHashMap<String, TableSchema>();
        for (var builder : builders.values()) {
            if (!builder.hasTableEntry()) {
                log.warn("Ignoring catalog rows of object {} without a table entry", builder.getObjectId());
                continue;
            }
            var table = builder.build();
            if (table.getRootPage() <= 0) {
                throw new SidrException(ErrorType.CATALOG_CORRUPT, "Table " + table.getName() + " has no root page");
            }
            tables.put(table.getName(), table);
        }
        log.debug("{} at page {}: {} tables, {} skipped rows", Constants.CATALOG_TABLE_NAME, rootPage, tables.size(), skipped[0]);
        return new Catalog(tables);
    }

    private static void apply(TableSchema.Builder builder, CatalogEntry entry) {
        switch (entry.getType()) {
            case TABLE:
                builder.table(entry.getName(), entry.getTypeOrPage());
                break;
            case COLUMN:
                try {
                    var type = ColumnType.fromCode(entry.getTypeOrPage());
                    builder.column(new ColumnDef(entry.getId(), entry.getName(), type,
                            entry.getSpaceUsage(), entry.getFlags(), entry.getPagesOrLocale()));
                } catch (SidrException e) {
                    log.warn("Skipping column {} of object {}: {}", entry.getName(), entry.getTableObjectId(), e.getMessage());
                }
                break;
            case LONG_VALUE:
                builder.longValueRoot(entry.getTypeOrPage());
                break;
            case INDEX:
            case CALLBACK:
            case UNKNOWN:
            default:
                log.debug("Ignoring catalog entry {}", entry);
        }
    }

    /**
     * Table names in catalog order, for diagnostics.
     */
    public List<String> describe() {
        var lines = new ArrayList<String>();
        for (var table : tables.values()) {
            lines.add(table.toString());
        }
        return lines;
    }
}
