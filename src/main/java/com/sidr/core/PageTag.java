package com.sidr.core;

import lombok.Value;

/**
 * A line entry of a page: where one value lives inside the page.
 */
@Value
public class PageTag {
    public static final int FLAG_VERSION = 0x1;
    public static final int FLAG_DEFUNCT = 0x2;
    public static final int FLAG_COMMON_KEY = 0x4;

    int index;
    /** Absolute offset within the page. */
    int offset;
    int size;
    int flags;

    public boolean isDefunct() {
        return (flags & FLAG_DEFUNCT) != 0;
    }

    public boolean hasCommonKey() {
        return (flags & FLAG_COMMON_KEY) != 0;
    }

    public int end() {
        return offset + size;
    }
}
