package com.sidr.mapping;

import com.sidr.types.Value;

/**
 * Selects the source rows a mapping rule applies to.
 */
@FunctionalInterface
public interface RowPredicate {

    boolean test(SourceRow row);

    static RowPredicate always() {
        return row -> true;
    }

    /**
     * Matches rows whose column, read as text, equals {@code expected} ignoring case.
     */
    static RowPredicate columnEquals(String column, String expected) {
        return row -> {
            Value value = row.get(column);
            if (value == null) {
                return false;
            }
            var text = ValueTransform.TEXT.apply(value);
            return text != null && expected.equalsIgnoreCase(text.asObject().toString().trim());
        };
    }
}
