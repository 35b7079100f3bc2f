package com.sidr.core;

import lombok.Value;

/**
 * Page flags from the page header.
 */
@Value
public class PageFlags {
    public static final int ROOT = 0x0001;
    public static final int LEAF = 0x0002;
    public static final int PARENT = 0x0004;
    public static final int EMPTY = 0x0008;
    public static final int SPACE_TREE = 0x0020;
    public static final int INDEX = 0x0040;
    public static final int LONG_VALUE = 0x0080;
    public static final int NEW_RECORD_FORMAT = 0x2000;

    int value;

    public boolean isSet(int flag) {
        return (value & flag) != 0;
    }

    public boolean isRoot() {
        return isSet(ROOT);
    }

    public PageRole role() {
        if (isSet(EMPTY)) {
            return PageRole.EMPTY;
        }
        if (isSet(SPACE_TREE)) {
            return PageRole.SPACE_TREE;
        }
        if (isSet(PARENT)) {
            return PageRole.BRANCH;
        }
        if (isSet(LEAF)) {
            return isSet(LONG_VALUE) ? PageRole.LONG_VALUE : PageRole.LEAF;
        }
        return PageRole.EMPTY;
    }

    @Override
    public String toString() {
        return "0x" + Integer.toHexString(value);
    }
}
