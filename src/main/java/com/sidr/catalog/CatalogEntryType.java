package com.sidr.catalog;

/**
 * Kind of a catalog row, from its Type column.
 */
public enum CatalogEntryType {
    UNKNOWN,
    TABLE,
    COLUMN,
    INDEX,
    LONG_VALUE,
    CALLBACK;

    public static CatalogEntryType fromCode(int code) {
        var types = values();
        return code > 0 && code < types.length ? types[code] : UNKNOWN;
    }
}
