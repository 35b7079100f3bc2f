package com.sidr.record;

import lombok.Value;

/**
 * Flags byte that leads a tagged column value.
 */
@Value
public class TaggedFlags {
    public static final int VARIABLE_SIZE = 0x01;
    public static final int COMPRESSED = 0x02;
    public static final int LONG_VALUE = 0x04;
    public static final int MULTI_VALUE = 0x08;
    public static final int MULTI_VALUE_SIZE_PREFIX = 0x10;

    public static final TaggedFlags NONE = new TaggedFlags(0);

    int value;

    public boolean isSet(int flag) {
        return (value & flag) != 0;
    }

    public boolean isCompressed() {
        return isSet(COMPRESSED);
    }

    public boolean isLongValue() {
        return isSet(LONG_VALUE);
    }

    public boolean isMultiValue() {
        return isSet(MULTI_VALUE);
    }

    public boolean isSizePrefixedMultiValue() {
        return isSet(MULTI_VALUE_SIZE_PREFIX);
    }
}
