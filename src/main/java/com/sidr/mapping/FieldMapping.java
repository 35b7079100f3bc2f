package com.sidr.mapping;

import lombok.Value;

/**
 * One source column copied into one report field.
 */
@Value
public class FieldMapping {
    String column;
    String field;
    ValueTransform transform;

    public static FieldMapping of(String column, ValueTransform transform) {
        return new FieldMapping(column, column, transform);
    }

    public static FieldMapping of(String column, String field, ValueTransform transform) {
        return new FieldMapping(column, field, transform);
    }
}
