package com.sidr.core;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Forward cursor over the leaf records of one B+tree.
 * <p>
 * {@link #first()} and {@link #seek(byte[])} descend from the root; {@link #next()} walks
 * the current leaf and then follows the leaf's next-page pointer. Every page entered is
 * checked against its expected position in the tree, and the number of distinct pages a
 * cursor may touch is bounded by the store's page count, so a corrupt chain ends with
 * {@link ErrorType#CORRUPT_BTREE} instead of looping.
 */
@Slf4j
public final class BTreeCursor {

    private final PageReader reader;
    @Getter
    private final int rootPage;
    private final int objectId;
    private final IntSet visitedLeaves = new IntOpenHashSet();

    private int leafDepth = -1;
    private Page leaf;
    private int tagIndex;

    BTreeCursor(PageReader reader, int rootPage) throws SidrException {
        this.reader = reader;
        this.rootPage = rootPage;
        var root = reader.readPage(rootPage);
        if (!root.isRoot()) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Page " + rootPage + " is not a tree root: " + root);
        }
        if (!root.getRole().holdsRecords() && root.getRole() != PageRole.BRANCH) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Root page " + rootPage + " has role " + root.getRole());
        }
        this.objectId = root.getFdpObjectId();
    }

    /**
     * Position on the first record of the tree.
     *
     * @return the first record, or null if the tree is empty
     */
    public RawRecord first() throws SidrException {
        visitedLeaves.clear();
        enterLeaf(descend(null));
        return next();
    }

    /**
     * @return the next record in key order, or null past the last record
     */
    public RawRecord next() throws SidrException {
        if (leaf == null) {
            return null;
        }
        while (true) {
            tagIndex++;
            if (tagIndex < leaf.getTags().size()) {
                if (leaf.getTags().get(tagIndex).isDefunct()) {
                    continue;
                }
                return leaf.entry(tagIndex);
            }
            int nextPage = leaf.getNextPage();
            if (nextPage == 0) {
                leaf = null;
                return null;
            }
            enterLeaf(readChained(nextPage));
        }
    }

    /**
     * Position on the first record whose key is greater than or equal to {@code key}.
     *
     * @return that record, or null if every key is smaller
     */
    public RawRecord seek(byte[] key) throws SidrException {
        visitedLeaves.clear();
        enterLeaf(descend(key));
        RawRecord record;
        while ((record = next()) != null) {
            if (record.compareKey(key) >= 0) {
                return record;
            }
        }
        return null;
    }

    /**
     * Walk from the root to a leaf. A null key takes the leftmost child at every level;
     * otherwise the first child whose separator is not smaller than the key, the last
     * entry of a branch being unbounded.
     */
    private Page descend(byte[] key) throws SidrException {
        var page = reader.readPage(rootPage);
        var path = new IntOpenHashSet();
        path.add(rootPage);
        int depth = 0;
        while (true) {
            switch (page.getRole()) {
                case LEAF:
                case LONG_VALUE:
                    checkLeafDepth(page, depth);
                    return page;
                case BRANCH:
                    if (leafDepth >= 0 && depth >= leafDepth) {
                        throw new SidrException(ErrorType.CORRUPT_BTREE,
                                "Branch page " + page.getPageNumber() + " found at leaf depth " + depth);
                    }
                    int child = chooseChild(page, key);
                    if (!path.add(child) || path.size() > reader.getPageCount()) {
                        throw new SidrException(ErrorType.CORRUPT_BTREE,
                                "Descent from root " + rootPage + " revisits page " + child);
                    }
                    page = readChild(page, child);
                    depth++;
                    break;
                case EMPTY:
                case SPACE_TREE:
                default:
                    throw new SidrException(ErrorType.CORRUPT_BTREE,
                            "Page " + page.getPageNumber() + " with role " + page.getRole() + " inside tree " + rootPage);
            }
        }
    }

    private int chooseChild(Page branch, byte[] key) throws SidrException {
        int last = -1;
        for (int i = 1; i < branch.getTags().size(); i++) {
            if (branch.getTags().get(i).isDefunct()) {
                continue;
            }
            var entry = branch.entry(i);
            last = childPageOf(branch, entry);
            if (key == null || entry.compareKey(key) >= 0) {
                return last;
            }
        }
        if (last < 0) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Branch page " + branch.getPageNumber() + " has no entries");
        }
        return last;
    }

    static int childPageOf(Page branch, RawRecord entry) throws SidrException {
        if (entry.getData().length < 4) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Branch entry " + entry.getTagIndex()
                    + " on page " + branch.getPageNumber() + " has no child page number");
        }
        byte[] data = entry.getData();
        return (data[0] & 0xFF) | (data[1] & 0xFF) << 8 | (data[2] & 0xFF) << 16 | (data[3] & 0xFF) << 24;
    }

    private Page readChild(Page parent, int child) throws SidrException {
        var page = readTreePage(child);
        if (page.isRoot()) {
            throw new SidrException(ErrorType.CORRUPT_BTREE,
                    "Branch page " + parent.getPageNumber() + " points to root page " + child);
        }
        return page;
    }

    private Page readChained(int pageNumber) throws SidrException {
        if (visitedLeaves.contains(pageNumber)) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Leaf chain of tree " + rootPage
                    + " revisits page " + pageNumber + " after page " + leaf.getPageNumber());
        }
        var page = readTreePage(pageNumber);
        if (!page.getRole().holdsRecords()) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Leaf chain of tree " + rootPage
                    + " reaches page " + pageNumber + " with role " + page.getRole());
        }
        if (page.getPreviousPage() != leaf.getPageNumber()) {
            log.debug("Page {} back pointer {} does not match predecessor {}",
                    pageNumber, page.getPreviousPage(), leaf.getPageNumber());
        }
        return page;
    }

    /**
     * Read a page that must belong to this tree's object.
     */
    private Page readTreePage(int pageNumber) throws SidrException {
        Page page;
        try {
            page = reader.readPage(pageNumber);
        } catch (SidrException e) {
            if (e.getErrorType() == ErrorType.OUT_OF_RANGE) {
                throw new SidrException(ErrorType.CORRUPT_BTREE,
                        "Tree " + rootPage + " points outside the file: " + e.getMessage(), e);
            }
            throw e;
        }
        if (page.getFdpObjectId() != objectId) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Page " + pageNumber + " belongs to object "
                    + page.getFdpObjectId() + ", expected " + objectId);
        }
        return page;
    }

    private void enterLeaf(Page page) throws SidrException {
        visitedLeaves.add(page.getPageNumber());
        if (visitedLeaves.size() > reader.getPageCount()) {
            throw new SidrException(ErrorType.CORRUPT_BTREE,
                    "Tree " + rootPage + " visits more leaves than the store holds");
        }
        leaf = page;
        tagIndex = 0;
    }

    private void checkLeafDepth(Page page, int depth) throws SidrException {
        if (leafDepth < 0) {
            leafDepth = depth;
        } else if (leafDepth != depth) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Leaf page " + page.getPageNumber()
                    + " at depth " + depth + ", expected " + leafDepth);
        }
    }
}
