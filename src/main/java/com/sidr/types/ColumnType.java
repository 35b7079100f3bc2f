package com.sidr.types;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import lombok.Getter;

/**
 * Column types as stored in the catalog's ColtypOrPgnoFDP field.
 */
public enum ColumnType {
    NIL(0, 0),
    BIT(1, 1),
    UNSIGNED_BYTE(2, 1),
    SHORT(3, 2),
    LONG(4, 4),
    CURRENCY(5, 8),
    IEEE_SINGLE(6, 4),
    IEEE_DOUBLE(7, 8),
    DATE_TIME(8, 8),
    BINARY(9, 0),
    TEXT(10, 0),
    LONG_BINARY(11, 0),
    LONG_TEXT(12, 0),
    SLV(13, 0),
    UNSIGNED_LONG(14, 4),
    LONG_LONG(15, 8),
    GUID(16, 16),
    UNSIGNED_SHORT(17, 2),
    UNSIGNED_LONG_LONG(18, 8);

    @Getter
    private final int code;

    /**
     * Natural storage width, or 0 when the width comes from the column's space usage.
     */
    @Getter
    private final int fixedSize;

    private static final ColumnType[] LOOKUP = new ColumnType[19];

    static {
        for (var type : values()) {
            LOOKUP[type.code] = type;
        }
    }

    ColumnType(int code, int fixedSize) {
        this.code = code;
        this.fixedSize = fixedSize;
    }

    public static ColumnType fromCode(int code) throws SidrException {
        if (code >= 0 && code < LOOKUP.length) {
            var type = LOOKUP[code];
            if (type != null) return type;
        }
        throw new SidrException(ErrorType.TYPE_MISMATCH, "Unknown column type: " + code);
    }

    public boolean isBinary() {
        return this == BINARY || this == LONG_BINARY;
    }
}
