package com.sidr.record;

import com.sidr.catalog.ColumnDef;
import com.sidr.catalog.TableSchema;
import com.sidr.core.BTree;
import com.sidr.core.RawRecord;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.types.ColumnValues;
import com.sidr.types.Value;
import com.sidr.util.Decompressor;
import com.sidr.util.EseBuffer;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;

/**
 * Reassembles long values stored out of line in a table's long-value tree.
 * <p>
 * Keys of the long-value tree are big-endian: the long-value id alone for the root
 * record ({@code u32 reference count, u32 total size}), and the id followed by a u32
 * byte offset for each data segment.
 */
@Slf4j
public final class LongValueResolver {
    private static final int SEGMENT_OFFSET_BYTES = 4;
    private static final long MAX_VALUE_BYTES = Integer.MAX_VALUE - 8;

    private final BTree tree;
    private final int rootPage;

    public LongValueResolver(BTree tree, int rootPage) {
        this.tree = tree;
        this.rootPage = rootPage;
    }

    /**
     * @throws SidrException {@link ErrorType#DANGLING_LONG_VALUE} if the tree holds no data for the id,
     *                       {@link ErrorType#TRUNCATED_RECORD} if the segments leave gaps, overlap, or
     *                       disagree with the declared size
     */
    public byte[] resolve(long longValueId) throws SidrException {
        byte[] idKey = keyOf(longValueId);
        var cursor = tree.openCursor(rootPage);
        var segments = new Int2ObjectAVLTreeMap<byte[]>();
        long declaredSize = -1;
        long segmentBytes = 0;

        for (var record = cursor.seek(idKey); record != null && hasPrefix(record, idKey); record = cursor.next()) {
            int suffix = record.getKey().length - idKey.length;
            if (suffix == 0) {
                var root = new EseBuffer(record.getData(), ErrorType.TRUNCATED_RECORD);
                declaredSize = root.getUnsignedInt(4);
                checkSize(longValueId, declaredSize, "declares");
            } else if (suffix == SEGMENT_OFFSET_BYTES) {
                long offset = new EseBuffer(record.getKey(), ErrorType.CORRUPT_BTREE)
                        .getBigEndian(idKey.length, SEGMENT_OFFSET_BYTES);
                if (offset > Integer.MAX_VALUE || segments.put((int) offset, record.getData()) != null) {
                    throw new SidrException(ErrorType.TRUNCATED_RECORD, "Long value " + longValueId
                            + " has an invalid or repeated segment offset " + offset);
                }
                segmentBytes += record.getData().length;
                checkSize(longValueId, segmentBytes, "holds");
            } else {
                break;
            }
        }

        if (segments.isEmpty()) {
            if (declaredSize == 0) {
                return new byte[0];
            }
            throw new SidrException(ErrorType.DANGLING_LONG_VALUE, "Long value " + longValueId
                    + " not found in tree " + rootPage);
        }
        if (declaredSize >= 0 && declaredSize != segmentBytes) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Long value " + longValueId + " declares "
                    + declaredSize + " bytes, segments hold " + segmentBytes);
        }
        return assemble(longValueId, segments, (int) segmentBytes);
    }

    /**
     * Segments must tile {@code [0, size)} without gaps or overlaps.
     */
    private static byte[] assemble(long longValueId, Int2ObjectAVLTreeMap<byte[]> segments, int size)
            throws SidrException {
        byte[] result = new byte[size];
        int end = 0;
        for (var entry : segments.int2ObjectEntrySet()) {
            int offset = entry.getIntKey();
            if (offset != end) {
                throw new SidrException(ErrorType.TRUNCATED_RECORD, "Long value " + longValueId
                        + " has a segment at offset " + offset + ", expected " + end);
            }
            System.arraycopy(entry.getValue(), 0, result, offset, entry.getValue().length);
            end += entry.getValue().length;
        }
        return result;
    }

    /**
     * No long value can be larger than the file holding it.
     */
    private void checkSize(long longValueId, long size, String verb) throws SidrException {
        var reader = tree.getReader();
        long limit = Math.min((long) reader.getPageCount() * reader.getHeader().getPageSize(), MAX_VALUE_BYTES);
        if (size > limit) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Long value " + longValueId + " " + verb
                    + " " + size + " bytes, more than the " + limit + " the store can hold");
        }
    }

    /**
     * Replace every long-value reference of a record by its resolved, typed value. A
     * reference that cannot be resolved is dropped from the record, leaving the field empty.
     */
    public TableRecord resolveAll(TableSchema schema, TableRecord record) throws SidrException {
        var result = record;
        for (int columnId : record.columnIds()) {
            var value = record.get(columnId);
            if (value.getKind() != Value.Kind.LONG_VALUE_REF && value.getKind() != Value.Kind.MULTI) {
                continue;
            }
            var column = schema.getColumn(columnId);
            try {
                result = result.with(columnId, resolveValue(column, value));
            } catch (SidrException e) {
                if (e.getErrorType() != ErrorType.DANGLING_LONG_VALUE) {
                    throw e;
                }
                log.warn("Table {} column {}: {}", schema.getName(), column.getName(), e.getMessage());
                result = result.without(columnId);
            }
        }
        return result;
    }

    private Value resolveValue(ColumnDef column, Value value) throws SidrException {
        if (value instanceof Value.LongValueRef) {
            var ref = (Value.LongValueRef) value;
            byte[] bytes = resolve(ref.getId());
            if (ref.isCompressed()) {
                bytes = Decompressor.decompress(bytes, column.getType().isBinary());
            }
            return ColumnValues.decode(column.getType(), column.getCodePage(), bytes);
        }
        if (value instanceof Value.MultiValue) {
            var elements = ((Value.MultiValue) value).getValues();
            var resolved = new ArrayList<Value>(elements.size());
            for (var element : elements) {
                resolved.add(resolveValue(column, element));
            }
            return Value.fromValues(resolved);
        }
        return value;
    }

    /**
     * Big-endian tree key of a long-value id; ids beyond 32 bits use an 8-byte key.
     */
    static byte[] keyOf(long longValueId) {
        int width = (longValueId & 0xFFFFFFFF00000000L) != 0 ? 8 : 4;
        byte[] key = new byte[width];
        for (int i = 0; i < width; i++) {
            key[i] = (byte) (longValueId >>> (8 * (width - 1 - i)));
        }
        return key;
    }

    private static boolean hasPrefix(RawRecord record, byte[] prefix) {
        byte[] key = record.getKey();
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
