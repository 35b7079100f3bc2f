package com.sidr.record;

import com.sidr.Constants;
import com.sidr.catalog.ColumnDef;
import com.sidr.catalog.TableSchema;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.types.ColumnValues;
import com.sidr.types.Value;
import com.sidr.util.Decompressor;
import com.sidr.util.EseBuffer;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes leaf record data of a table into a {@link TableRecord}.
 * <p>
 * Record layout:
 * <pre>
 *   u8  last fixed column id
 *   u8  last variable column id
 *   u16 offset of the variable offset table
 *   fixed column data, in column id order
 *   null bitmap, one bit per fixed column up to the last fixed id
 *   variable offset table, one u16 per variable column up to the last variable id
 *   variable column data
 *   tagged area: (u16 column id, u16 offset) pairs, then tagged data
 * </pre>
 * Decoding has no side effects; the same input always yields an equal record.
 */
@Slf4j
@UtilityClass
public final class RecordDecoder {

    private static final int VARIABLE_NULL_BIT = 0x8000;
    private static final int VARIABLE_OFFSET_MASK = 0x7FFF;
    private static final int TAGGED_FLAGS_PRESENT = 0x4000;
    private static final int SMALL_TAGGED_OFFSET_MASK = 0x3FFF;
    private static final int LARGE_TAGGED_OFFSET_MASK = 0x7FFF;
    private static final int MULTI_VALUE_OFFSET_MASK = 0x7FFF;
    private static final int TAGGED_ENTRY_BYTES = 4;

    public static TableRecord decode(TableSchema schema, byte[] data, boolean largePageLayout) throws SidrException {
        var buffer = new EseBuffer(data, ErrorType.TRUNCATED_RECORD);
        int lastFixed = buffer.getUnsignedByte(0);
        int lastVariable = buffer.getUnsignedByte(1);
        int variableOffset = buffer.getUnsignedShort(2);
        if (variableOffset < TableSchema.RECORD_HEADER_BYTES || variableOffset > data.length) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Variable offset table at " + variableOffset
                    + " outside record of " + data.length + " bytes");
        }

        var values = new Int2ObjectAVLTreeMap<Value>();
        decodeFixed(schema, buffer, lastFixed, variableOffset, values);
        int taggedStart = decodeVariable(schema, buffer, lastVariable, variableOffset, values);
        if (taggedStart < data.length) {
            decodeTagged(schema, buffer.slice(taggedStart, data.length - taggedStart), largePageLayout, values);
        }
        return new TableRecord(values);
    }

    private static void decodeFixed(TableSchema schema, EseBuffer buffer, int lastFixed, int variableOffset,
                                    Int2ObjectAVLTreeMap<Value> values) throws SidrException {
        var columns = schema.getFixedColumns();
        int[] offsets = schema.getFixedOffsets();
        int dataEnd = TableSchema.RECORD_HEADER_BYTES;
        int present = 0;
        while (present < columns.size() && columns.get(present).getId() <= lastFixed) {
            dataEnd = offsets[present] + columns.get(present).fixedWidth();
            present++;
        }
        int bitmapBytes = (lastFixed + 7) / 8;
        if (dataEnd + bitmapBytes > variableOffset) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Fixed data of " + present + " columns ends at "
                    + (dataEnd + bitmapBytes) + ", past variable offset table at " + variableOffset);
        }
        for (int i = 0; i < present; i++) {
            var column = columns.get(i);
            int bit = column.getId() - 1;
            if ((buffer.getUnsignedByte(dataEnd + bit / 8) & (1 << (bit % 8))) != 0) {
                continue;
            }
            byte[] raw = buffer.getBytes(offsets[i], column.fixedWidth());
            values.put(column.getId(), ColumnValues.decode(column.getType(), column.getCodePage(), raw));
        }
    }

    /**
     * @return offset at which the tagged area starts
     */
    private static int decodeVariable(TableSchema schema, EseBuffer buffer, int lastVariable, int variableOffset,
                                      Int2ObjectAVLTreeMap<Value> values) throws SidrException {
        int count = lastVariable >= Constants.FIRST_VARIABLE_COLUMN ? lastVariable - Constants.LAST_FIXED_COLUMN : 0;
        int dataStart = variableOffset + 2 * count;
        if (dataStart > buffer.capacity()) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, count + " variable offsets at " + variableOffset
                    + " exceed record of " + buffer.capacity() + " bytes");
        }
        int previousEnd = 0;
        for (int i = 0; i < count; i++) {
            int entry = buffer.getUnsignedShort(variableOffset + 2 * i);
            int end = entry & VARIABLE_OFFSET_MASK;
            if (end < previousEnd || dataStart + end > buffer.capacity()) {
                throw new SidrException(ErrorType.TRUNCATED_RECORD, "Variable column " + (Constants.FIRST_VARIABLE_COLUMN + i)
                        + " ends at " + end + " (previous " + previousEnd + ", record " + buffer.capacity() + " bytes)");
            }
            int start = previousEnd;
            previousEnd = end;
            if ((entry & VARIABLE_NULL_BIT) != 0 || end == start) {
                continue;
            }
            var column = schema.getColumn(Constants.FIRST_VARIABLE_COLUMN + i);
            if (column == null) {
                log.debug("Table {} has no variable column {}", schema.getName(), Constants.FIRST_VARIABLE_COLUMN + i);
                continue;
            }
            byte[] raw = buffer.getBytes(dataStart + start, end - start);
            values.put(column.getId(), ColumnValues.decode(column.getType(), column.getCodePage(), raw));
        }
        return dataStart + previousEnd;
    }

    private static void decodeTagged(TableSchema schema, EseBuffer area, boolean largePageLayout,
                                     Int2ObjectAVLTreeMap<Value> values) throws SidrException {
        int offsetMask = largePageLayout ? LARGE_TAGGED_OFFSET_MASK : SMALL_TAGGED_OFFSET_MASK;
        int firstOffset = area.getUnsignedShort(2) & offsetMask;
        int count = firstOffset / TAGGED_ENTRY_BYTES;
        if (count == 0 || firstOffset > area.capacity()) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Tagged area of " + area.capacity()
                    + " bytes declares first value at " + firstOffset);
        }
        int previousId = 0;
        for (int i = 0; i < count; i++) {
            int columnId = area.getUnsignedShort(TAGGED_ENTRY_BYTES * i);
            int rawOffset = area.getUnsignedShort(TAGGED_ENTRY_BYTES * i + 2);
            int start = rawOffset & offsetMask;
            int end = i + 1 < count
                    ? area.getUnsignedShort(TAGGED_ENTRY_BYTES * (i + 1) + 2) & offsetMask
                    : area.capacity();
            if (start < firstOffset || end < start || end > area.capacity()) {
                throw new SidrException(ErrorType.TRUNCATED_RECORD, "Tagged column " + columnId
                        + " spans [" + start + ", " + end + ") in area of " + area.capacity() + " bytes");
            }
            if (columnId <= previousId) {
                throw new SidrException(ErrorType.TRUNCATED_RECORD, "Tagged column " + columnId
                        + " follows column " + previousId);
            }
            previousId = columnId;

            var column = schema.getColumn(columnId);
            if (column == null || columnId < Constants.FIRST_TAGGED_COLUMN) {
                log.debug("Table {} has no tagged column {}", schema.getName(), columnId);
                continue;
            }
            if (end == start) {
                continue;
            }
            var flags = TaggedFlags.NONE;
            int valueStart = start;
            if (largePageLayout || (rawOffset & TAGGED_FLAGS_PRESENT) != 0) {
                flags = new TaggedFlags(area.getUnsignedByte(start));
                valueStart++;
            }
            byte[] raw = area.getBytes(valueStart, end - valueStart);
            var value = decodeTaggedValue(column, flags, raw);
            if (value != null) {
                values.put(columnId, value);
            }
        }
    }

    private static Value decodeTaggedValue(ColumnDef column, TaggedFlags flags, byte[] raw) throws SidrException {
        if (flags.isSizePrefixedMultiValue()) {
            return Value.fromValues(splitSizePrefixed(column, flags, raw));
        }
        if (flags.isMultiValue()) {
            return Value.fromValues(splitMultiValue(column, flags, raw));
        }
        return decodeElement(column, flags, raw);
    }

    /**
     * Multi-value data starts with a u16 offset per element; the first offset therefore
     * also gives the element count.
     */
    private static List<Value> splitMultiValue(ColumnDef column, TaggedFlags flags, byte[] raw) throws SidrException {
        var buffer = new EseBuffer(raw, ErrorType.TRUNCATED_RECORD);
        int first = buffer.getUnsignedShort(0) & MULTI_VALUE_OFFSET_MASK;
        int count = first / 2;
        if (count == 0 || first > raw.length) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Multi-value of column " + column.getName()
                    + " declares first element at " + first + " in " + raw.length + " bytes");
        }
        var elements = new ArrayList<Value>(count);
        for (int i = 0; i < count; i++) {
            int start = buffer.getUnsignedShort(2 * i) & MULTI_VALUE_OFFSET_MASK;
            int end = i + 1 < count ? buffer.getUnsignedShort(2 * (i + 1)) & MULTI_VALUE_OFFSET_MASK : raw.length;
            if (start < first || end < start || end > raw.length) {
                throw new SidrException(ErrorType.TRUNCATED_RECORD, "Element " + i + " of column " + column.getName()
                        + " spans [" + start + ", " + end + ") in " + raw.length + " bytes");
            }
            var element = decodeElement(column, flags, buffer.getBytes(start, end - start));
            if (element != null) {
                elements.add(element);
            }
        }
        return elements;
    }

    /**
     * Two-element form: a leading byte with the size of the first element, the rest is the second.
     */
    private static List<Value> splitSizePrefixed(ColumnDef column, TaggedFlags flags, byte[] raw) throws SidrException {
        var buffer = new EseBuffer(raw, ErrorType.TRUNCATED_RECORD);
        int firstSize = buffer.getUnsignedByte(0);
        var elements = new ArrayList<Value>(2);
        var first = decodeElement(column, flags, buffer.getBytes(1, firstSize));
        if (first != null) {
            elements.add(first);
        }
        int rest = 1 + firstSize;
        var second = decodeElement(column, flags, buffer.getBytes(rest, raw.length - rest));
        if (second != null) {
            elements.add(second);
        }
        return elements;
    }

    private static Value decodeElement(ColumnDef column, TaggedFlags flags, byte[] raw) throws SidrException {
        if (raw.length == 0) {
            return null;
        }
        if (flags.isLongValue()) {
            return Value.longValueRef(longValueId(column, raw), flags.isCompressed());
        }
        byte[] bytes = flags.isCompressed() ? Decompressor.decompress(raw, column.getType().isBinary()) : raw;
        return ColumnValues.decode(column.getType(), column.getCodePage(), bytes);
    }

    private static long longValueId(ColumnDef column, byte[] raw) throws SidrException {
        var buffer = new EseBuffer(raw, ErrorType.TRUNCATED_RECORD);
        switch (raw.length) {
            case 4:
                return buffer.getUnsignedInt(0);
            case 8:
                return buffer.getLong(0);
            default:
                throw new SidrException(ErrorType.TRUNCATED_RECORD, "Long value reference of column "
                        + column.getName() + " has " + raw.length + " bytes");
        }
    }
}
