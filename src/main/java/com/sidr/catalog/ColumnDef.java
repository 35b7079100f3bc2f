package com.sidr.catalog;

import com.sidr.types.ColumnType;
import lombok.Value;

/**
 * A column of a table schema.
 */
@Value
public class ColumnDef {
    public static final int FLAG_FIXED = 0x0001;
    public static final int FLAG_TAGGED = 0x0002;
    public static final int FLAG_MULTI_VALUED = 0x0400;

    int id;
    String name;
    ColumnType type;
    int spaceUsage;
    int flags;
    int codePage;

    public ColumnClass getColumnClass() {
        return ColumnClass.ofId(id);
    }

    /**
     * Bytes a fixed column occupies in the fixed data area.
     */
    public int fixedWidth() {
        return type.getFixedSize() > 0 ? type.getFixedSize() : spaceUsage;
    }
}
