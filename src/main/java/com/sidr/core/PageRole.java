package com.sidr.core;

/**
 * What a page holds, decided once from its flags when the page is read.
 * <p>
 * Root is not a role: a root page is also a leaf or a branch, so it is exposed
 * separately through {@link Page#isRoot()}.
 */
public enum PageRole {
    /** Data records of a table or index tree. */
    LEAF,
    /** Separator keys and child page numbers. */
    BRANCH,
    /** Leaf of a long-value tree; records are long-value roots and segments. */
    LONG_VALUE,
    /** Released page, no records. */
    EMPTY,
    /** Space management page; never part of a data tree. */
    SPACE_TREE;

    public boolean holdsRecords() {
        return this == LEAF || this == LONG_VALUE;
    }
}
