package com.sidr.catalog;

import com.sidr.Constants;

/**
 * Storage class of a column, implied by its identifier range.
 */
public enum ColumnClass {
    FIXED,
    VARIABLE,
    TAGGED;

    public static ColumnClass ofId(int columnId) {
        if (columnId <= Constants.LAST_FIXED_COLUMN) {
            return FIXED;
        }
        return columnId <= Constants.LAST_VARIABLE_COLUMN ? VARIABLE : TAGGED;
    }
}
