package com.sidr.core;

import lombok.Value;

import java.util.Arrays;

/**
 * A B-tree entry: full key and the bytes that follow it.
 */
@Value
public class RawRecord {
    int pageNumber;
    int tagIndex;
    byte[] key;
    byte[] data;

    public int compareKey(byte[] other) {
        return Arrays.compareUnsigned(key, other);
    }

    @Override
    public String toString() {
        return "RawRecord{page=" + pageNumber + ", tag=" + tagIndex
                + ", key=" + key.length + "b, data=" + data.length + "b}";
    }
}
