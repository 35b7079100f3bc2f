package com.sidr.core;

import com.sidr.Constants;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.util.EseBuffer;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One validated database page.
 * <p>
 * Construction parses the header and tag array and rejects any page whose tags do not
 * fit geometrically, so a {@code Page} instance is always safe to index into.
 */
@Getter
public final class Page {
    static final int OFFSET_PREVIOUS_PAGE = 16;
    static final int OFFSET_NEXT_PAGE = 20;
    static final int OFFSET_FDP_OBJECT_ID = 24;
    static final int OFFSET_AVAILABLE_DATA_SIZE = 28;
    static final int OFFSET_AVAILABLE_DATA_OFFSET = 32;
    static final int OFFSET_TAG_COUNT = 34;
    static final int OFFSET_FLAGS = 36;

    private static final int SMALL_PAGE_MASK = 0x1FFF;
    private static final int LARGE_PAGE_MASK = 0x7FFF;

    private final int pageNumber;
    private final int previousPage;
    private final int nextPage;
    private final int fdpObjectId;
    private final int availableDataSize;
    private final int availableDataOffset;
    private final PageFlags flags;
    private final PageRole role;
    private final List<PageTag> tags;

    @Getter(AccessLevel.NONE)
    private final EseBuffer data;
    @Getter(AccessLevel.NONE)
    private final boolean largePageLayout;

    Page(int pageNumber, EseBuffer data, FileHeader header) throws SidrException {
        this.pageNumber = pageNumber;
        this.data = data;
        this.largePageLayout = header.isLargePageLayout();
        this.previousPage = data.getInt(OFFSET_PREVIOUS_PAGE);
        this.nextPage = data.getInt(OFFSET_NEXT_PAGE);
        this.fdpObjectId = data.getInt(OFFSET_FDP_OBJECT_ID);
        this.availableDataSize = data.getUnsignedShort(OFFSET_AVAILABLE_DATA_SIZE);
        this.availableDataOffset = data.getUnsignedShort(OFFSET_AVAILABLE_DATA_OFFSET);
        this.flags = new PageFlags(data.getInt(OFFSET_FLAGS));
        this.role = flags.role();
        this.tags = readTags(data.getUnsignedShort(OFFSET_TAG_COUNT), header.pageHeaderSize());
    }

    public boolean isRoot() {
        return flags.isRoot();
    }

    /**
     * Number of B-tree entries, not counting tag 0 which holds the page's common key
     * (or, on a root page, the tree header).
     */
    public int entryCount() {
        return Math.max(0, tags.size() - 1);
    }

    /**
     * Value bytes of a tag. On large pages the tag flags sharing the first u16 of the
     * value are masked out.
     */
    public EseBuffer value(int tagIndex) throws SidrException {
        var tag = tags.get(tagIndex);
        if (!largePageLayout || tagIndex == 0 || tag.getSize() < 2) {
            return data.slice(tag.getOffset(), tag.getSize());
        }
        byte[] copy = data.getBytes(tag.getOffset(), tag.getSize());
        copy[1] &= 0x1F;
        return new EseBuffer(copy, ErrorType.CORRUPT_PAGE);
    }

    /**
     * Parse entry {@code tagIndex} (1-based) into its full key and payload.
     */
    public RawRecord entry(int tagIndex) throws SidrException {
        var tag = tags.get(tagIndex);
        var value = value(tagIndex);
        int position = 0;
        byte[] prefix = new byte[0];
        if (tag.hasCommonKey()) {
            int commonKeySize = value.getUnsignedShort(0);
            position = 2;
            var tag0 = tags.get(0);
            if (commonKeySize > tag0.getSize()) {
                throw new SidrException(ErrorType.CORRUPT_PAGE, "Common key size " + commonKeySize
                        + " exceeds common key of " + tag0.getSize() + " bytes on page " + pageNumber);
            }
            prefix = data.getBytes(tag0.getOffset(), commonKeySize);
        }
        int localKeySize = value.getUnsignedShort(position);
        position += 2;
        byte[] localKey = value.getBytes(position, localKeySize);
        position += localKeySize;

        byte[] key = Arrays.copyOf(prefix, prefix.length + localKey.length);
        System.arraycopy(localKey, 0, key, prefix.length, localKey.length);
        byte[] payload = value.getBytes(position, value.capacity() - position);
        return new RawRecord(pageNumber, tagIndex, key, payload);
    }

    private List<PageTag> readTags(int tagCount, int headerSize) throws SidrException {
        int pageSize = data.capacity();
        long tagArrayBytes = (long) tagCount * Constants.PAGE_TAG_BYTES;
        if (headerSize + tagArrayBytes > pageSize) {
            throw new SidrException(ErrorType.CORRUPT_PAGE, "Page " + pageNumber + " declares " + tagCount
                    + " tags which do not fit in " + pageSize + " bytes");
        }
        int valueAreaEnd = (int) (pageSize - tagArrayBytes);
        if (headerSize + availableDataOffset > valueAreaEnd) {
            throw new SidrException(ErrorType.CORRUPT_PAGE, "Page " + pageNumber
                    + " available data offset " + availableDataOffset + " overlaps the tag array");
        }

        int mask = largePageLayout ? LARGE_PAGE_MASK : SMALL_PAGE_MASK;
        var result = new ArrayList<PageTag>(tagCount);
        for (int i = 0; i < tagCount; i++) {
            int at = pageSize - Constants.PAGE_TAG_BYTES * (i + 1);
            int rawSize = data.getUnsignedShort(at);
            int rawOffset = data.getUnsignedShort(at + 2);
            int size = rawSize & mask;
            int offset = headerSize + (rawOffset & mask);
            int tagFlags;
            if (largePageLayout) {
                tagFlags = i > 0 && size >= 2 ? data.getUnsignedByte(offset + 1) >>> 5 : 0;
            } else {
                tagFlags = rawOffset >>> 13;
            }
            if (offset + size > valueAreaEnd) {
                throw new SidrException(ErrorType.CORRUPT_PAGE, "Tag " + i + " of page " + pageNumber
                        + " spans [" + offset + ", " + (offset + size) + ") beyond value area end " + valueAreaEnd);
            }
            result.add(new PageTag(i, offset, size, tagFlags));
        }
        checkOverlap(result);
        return Collections.unmodifiableList(result);
    }

    private void checkOverlap(List<PageTag> pageTags) throws SidrException {
        var sorted = new ArrayList<PageTag>(pageTags.size());
        for (var tag : pageTags) {
            if (tag.getSize() > 0) {
                sorted.add(tag);
            }
        }
        sorted.sort(Comparator.comparingInt(PageTag::getOffset));
        for (int i = 1; i < sorted.size(); i++) {
            var previous = sorted.get(i - 1);
            var current = sorted.get(i);
            if (previous.end() > current.getOffset()) {
                throw new SidrException(ErrorType.CORRUPT_PAGE, "Tags " + previous.getIndex() + " and "
                        + current.getIndex() + " overlap on page " + pageNumber);
            }
        }
    }

    @Override
    public String toString() {
        return "Page{number=" + pageNumber + ", role=" + role + ", root=" + isRoot()
                + ", objid=" + fdpObjectId + ", tags=" + tags.size() + ", next=" + nextPage + "}";
    }
}
