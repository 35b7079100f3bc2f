package com.sidr.core;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.Getter;

/**
 * Entry point for B+tree traversal over a {@link PageReader}.
 */
public final class BTree {

    @Getter
    private final PageReader reader;

    public BTree(PageReader reader) {
        this.reader = reader;
    }

    public BTreeCursor openCursor(int rootPage) throws SidrException {
        return new BTreeCursor(reader, rootPage);
    }

    /**
     * Visit every leaf record of the tree by following the leaf chain.
     */
    public void forEach(int rootPage, RecordVisitor visitor) throws SidrException {
        var cursor = openCursor(rootPage);
        for (var record = cursor.first(); record != null; record = cursor.next()) {
            visitor.visit(record);
        }
    }

    /**
     * Visit every leaf record by an in-order walk through the branch pages, without using
     * leaf next-page pointers. Yields the same records in the same order as
     * {@link #forEach(int, RecordVisitor)} on a consistent tree.
     */
    public void forEachByDescent(int rootPage, RecordVisitor visitor) throws SidrException {
        var root = reader.readPage(rootPage);
        if (!root.isRoot()) {
            throw new SidrException(ErrorType.CORRUPT_BTREE, "Page " + rootPage + " is not a tree root: " + root);
        }
        var walk = new DescentWalk(root.getFdpObjectId(), visitor);
        walk.visit(root, 0);
    }

    private final class DescentWalk {
        private final int objectId;
        private final RecordVisitor visitor;
        private final IntSet visited = new IntOpenHashSet();
        private int leafDepth = -1;

        DescentWalk(int objectId, RecordVisitor visitor) {
            this.objectId = objectId;
            this.visitor = visitor;
        }

        void visit(Page page, int depth) throws SidrException {
            if (!visited.add(page.getPageNumber()) || visited.size() > reader.getPageCount()) {
                throw new SidrException(ErrorType.CORRUPT_BTREE, "Page " + page.getPageNumber() + " reached twice");
            }
            if (page.getFdpObjectId() != objectId) {
                throw new SidrException(ErrorType.CORRUPT_BTREE, "Page " + page.getPageNumber()
                        + " belongs to object " + page.getFdpObjectId() + ", expected " + objectId);
            }
            switch (page.getRole()) {
                case LEAF:
                case LONG_VALUE:
                    if (leafDepth < 0) {
                        leafDepth = depth;
                    } else if (leafDepth != depth) {
                        throw new SidrException(ErrorType.CORRUPT_BTREE, "Leaf page " + page.getPageNumber()
                                + " at depth " + depth + ", expected " + leafDepth);
                    }
                    for (int i = 1; i < page.getTags().size(); i++) {
                        if (!page.getTags().get(i).isDefunct()) {
                            visitor.visit(page.entry(i));
                        }
                    }
                    break;
                case BRANCH:
                    if (leafDepth >= 0 && depth >= leafDepth) {
                        throw new SidrException(ErrorType.CORRUPT_BTREE,
                                "Branch page " + page.getPageNumber() + " found at leaf depth " + depth);
                    }
                    for (int i = 1; i < page.getTags().size(); i++) {
                        if (page.getTags().get(i).isDefunct()) {
                            continue;
                        }
                        int child = BTreeCursor.childPageOf(page, page.entry(i));
                        var childPage = reader.readPage(child);
                        if (childPage.isRoot()) {
                            throw new SidrException(ErrorType.CORRUPT_BTREE,
                                    "Branch page " + page.getPageNumber() + " points to root page " + child);
                        }
                        visit(childPage, depth + 1);
                    }
                    break;
                case EMPTY:
                case SPACE_TREE:
                default:
                    throw new SidrException(ErrorType.CORRUPT_BTREE, "Page " + page.getPageNumber()
                            + " with role " + page.getRole() + " inside tree " + objectId);
            }
        }
    }
}
