package com.sidr.catalog;

import com.sidr.Constants;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMaps;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable layout of one table, derived from its catalog rows.
 * <p>
 * Fixed columns are ordered by identifier; their byte offsets inside a record are the
 * running sum of the widths of all lower fixed columns, starting after the 4-byte record
 * header. Variable columns are ordered by identifier; their position in the variable
 * offset table is {@code id - 128}.
 */
@Getter
public final class TableSchema {
    public static final int RECORD_HEADER_BYTES = 4;

    private final String name;
    private final int objectId;
    private final int rootPage;
    private final int longValueRootPage;
    private final List<ColumnDef> fixedColumns;
    private final int[] fixedOffsets;
    private final List<ColumnDef> variableColumns;
    private final Int2ObjectSortedMap<ColumnDef> taggedColumns;
    private final Int2ObjectSortedMap<ColumnDef> columns;

    private TableSchema(Builder builder) {
        this.name = builder.name;
        this.objectId = builder.objectId;
        this.rootPage = builder.rootPage;
        this.longValueRootPage = builder.longValueRootPage;
        this.columns = Int2ObjectSortedMaps.unmodifiable(new Int2ObjectAVLTreeMap<>(builder.columns));

        var fixed = new ArrayList<ColumnDef>();
        var variable = new ArrayList<ColumnDef>();
        var tagged = new Int2ObjectAVLTreeMap<ColumnDef>();
        for (var column : columns.values()) {
            switch (column.getColumnClass()) {
                case FIXED:
                    fixed.add(column);
                    break;
                case VARIABLE:
                    variable.add(column);
                    break;
                case TAGGED:
                    tagged.put(column.getId(), column);
                    break;
            }
        }
        this.fixedColumns = Collections.unmodifiableList(fixed);
        this.variableColumns = Collections.unmodifiableList(variable);
        this.taggedColumns = Int2ObjectSortedMaps.unmodifiable(tagged);

        this.fixedOffsets = new int[fixed.size()];
        int offset = RECORD_HEADER_BYTES;
        for (int i = 0; i < fixed.size(); i++) {
            fixedOffsets[i] = offset;
            offset += fixed.get(i).fixedWidth();
        }
    }

    public ColumnDef getColumn(int columnId) {
        return columns.get(columnId);
    }

    /**
     * Look up a column by exact name.
     *
     * @return the column, or null if the table has no such column
     */
    public ColumnDef findColumn(String columnName) {
        for (var column : columns.values()) {
            if (column.getName().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    public boolean hasLongValues() {
        return longValueRootPage != 0;
    }

    @Override
    public String toString() {
        return "TableSchema{name=" + name + ", objid=" + objectId + ", root=" + rootPage
                + ", lvRoot=" + longValueRootPage + ", columns=" + columns.size() + "}";
    }

    public static Builder builder(int objectId) {
        return new Builder(objectId);
    }

    /**
     * Accumulates catalog rows of one table object.
     */
    @Slf4j
    public static final class Builder {
        private final int objectId;
        private String name;
        private int rootPage;
        private int longValueRootPage;
        private final Int2ObjectAVLTreeMap<ColumnDef> columns = new Int2ObjectAVLTreeMap<>();

        private Builder(int objectId) {
            this.objectId = objectId;
        }

        public Builder table(String tableName, int tableRootPage) {
            this.name = tableName;
            this.rootPage = tableRootPage;
            return this;
        }

        public Builder longValueRoot(int page) {
            this.longValueRootPage = page;
            return this;
        }

        /**
         * Add a column unless its identifier is already taken; the first definition wins.
         */
        public Builder column(ColumnDef column) {
            if (column.getId() < Constants.FIRST_FIXED_COLUMN) {
                log.warn("Table {} ignores column {} with invalid id {}", name, column.getName(), column.getId());
                return this;
            }
            var existing = columns.putIfAbsent(column.getId(), column);
            if (existing != null) {
                log.warn("Table {} defines column id {} twice ({} and {}), keeping the first",
                        name, column.getId(), existing.getName(), column.getName());
            }
            return this;
        }

        public boolean hasTableEntry() {
            return name != null;
        }

        public String getName() {
            return name;
        }

        public int getObjectId() {
            return objectId;
        }

        public TableSchema build() {
            return new TableSchema(this);
        }
    }
}
