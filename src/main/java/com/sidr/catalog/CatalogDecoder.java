package com.sidr.catalog;

import com.sidr.Constants;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.util.EseBuffer;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;

/**
 * Bootstrap decoder for catalog rows.
 * <p>
 * The catalog describes the layout of every table including its own, so its rows cannot
 * be read through a schema taken from itself. This decoder hard-codes the catalog layout:
 * <pre>
 *   id  column            width
 *    1  ObjidTable        4
 *    2  Type              2
 *    3  Id                4
 *    4  ColtypOrPgnoFDP   4
 *    5  SpaceUsage        4
 *    6  Flags             4
 *    7  PagesOrLocale     4
 *    8  RootFlag          1
 *    9  RecordOffset      2
 *   10  LCMapFlags        4
 *   11  KeyMost           2
 *   12  LVChunkMax        4
 *  128  Name              variable
 * </pre>
 */
@UtilityClass
public final class CatalogDecoder {

    static final int[] FIXED_WIDTHS = {4, 2, 4, 4, 4, 4, 4, 1, 2, 4, 2, 4};
    static final int REQUIRED_FIXED_COLUMNS = 4;

    private static final int[] FIXED_OFFSETS = new int[FIXED_WIDTHS.length];

    static {
        int offset = TableSchema.RECORD_HEADER_BYTES;
        for (int i = 0; i < FIXED_WIDTHS.length; i++) {
            FIXED_OFFSETS[i] = offset;
            offset += FIXED_WIDTHS[i];
        }
    }

    public static CatalogEntry decode(byte[] data) throws SidrException {
        var buffer = new EseBuffer(data, ErrorType.TRUNCATED_RECORD);
        int lastFixed = buffer.getUnsignedByte(0);
        int lastVariable = buffer.getUnsignedByte(1);
        int variableOffset = buffer.getUnsignedShort(2);
        if (lastFixed < REQUIRED_FIXED_COLUMNS) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD,
                    "Catalog row has only " + lastFixed + " fixed columns");
        }

        int tableObjectId = fixedInt(buffer, lastFixed, 1);
        int type = buffer.getShort(FIXED_OFFSETS[1]);
        int id = fixedInt(buffer, lastFixed, 3);
        int typeOrPage = fixedInt(buffer, lastFixed, 4);
        int spaceUsage = fixedInt(buffer, lastFixed, 5);
        int flags = fixedInt(buffer, lastFixed, 6);
        int pagesOrLocale = fixedInt(buffer, lastFixed, 7);

        String name = "";
        if (lastVariable >= Constants.FIRST_VARIABLE_COLUMN) {
            int variableCount = lastVariable - Constants.LAST_FIXED_COLUMN;
            int nameEnd = buffer.getUnsignedShort(variableOffset);
            if ((nameEnd & 0x8000) == 0) {
                int dataStart = variableOffset + 2 * variableCount;
                name = new String(buffer.getBytes(dataStart, nameEnd & 0x7FFF), StandardCharsets.US_ASCII);
            }
        }
        return new CatalogEntry(tableObjectId, CatalogEntryType.fromCode(type), id, typeOrPage,
                spaceUsage, flags, pagesOrLocale, name);
    }

    /**
     * A 4-byte fixed column, or 0 when the row predates it.
     */
    private static int fixedInt(EseBuffer buffer, int lastFixed, int columnId) throws SidrException {
        if (columnId > lastFixed || columnId > FIXED_WIDTHS.length) {
            return 0;
        }
        return buffer.getInt(FIXED_OFFSETS[columnId - 1]);
    }
}
