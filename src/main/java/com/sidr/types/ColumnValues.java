package com.sidr.types;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.util.EseBuffer;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Conversion of raw column bytes into {@link Value}s according to the column type.
 */
@UtilityClass
public final class ColumnValues {

    public static final int CODE_PAGE_UNICODE = 1200;
    public static final int CODE_PAGE_UTF8 = 65001;
    public static final int CODE_PAGE_ASCII = 20127;
    public static final int CODE_PAGE_WESTERN = 1252;

    // Days between the OLE automation epoch (1899-12-30) and the Unix epoch.
    private static final double OLE_EPOCH_OFFSET_DAYS = 25569.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    public static Value decode(ColumnType type, int codePage, byte[] raw) throws SidrException {
        var buffer = new EseBuffer(raw, ErrorType.TYPE_MISMATCH);
        switch (type) {
            case BIT:
                expectSize(type, raw, 1);
                return Value.fromBoolean(raw[0] != 0);
            case UNSIGNED_BYTE:
                expectSize(type, raw, 1);
                return Value.fromLong(raw[0] & 0xFF);
            case SHORT:
                expectSize(type, raw, 2);
                return Value.fromLong(buffer.getShort(0));
            case UNSIGNED_SHORT:
                expectSize(type, raw, 2);
                return Value.fromLong(buffer.getUnsignedShort(0));
            case LONG:
                expectSize(type, raw, 4);
                return Value.fromLong(buffer.getInt(0));
            case UNSIGNED_LONG:
                expectSize(type, raw, 4);
                return Value.fromLong(buffer.getUnsignedInt(0));
            case LONG_LONG:
            case UNSIGNED_LONG_LONG:
                expectSize(type, raw, 8);
                return Value.fromLong(buffer.getLong(0));
            case CURRENCY:
                expectSize(type, raw, 8);
                return Value.fromCurrency(BigDecimal.valueOf(buffer.getLong(0), 4));
            case IEEE_SINGLE:
                expectSize(type, raw, 4);
                return Value.fromDouble(Float.intBitsToFloat(buffer.getInt(0)));
            case IEEE_DOUBLE:
                expectSize(type, raw, 8);
                return Value.fromDouble(Double.longBitsToDouble(buffer.getLong(0)));
            case DATE_TIME:
                expectSize(type, raw, 8);
                return Value.fromDateTime(fromOleDate(Double.longBitsToDouble(buffer.getLong(0))));
            case GUID:
                expectSize(type, raw, 16);
                return Value.fromGuid(toGuid(buffer));
            case TEXT:
            case LONG_TEXT:
                return Value.fromText(decodeText(raw, codePage));
            case NIL:
            case BINARY:
            case LONG_BINARY:
            case SLV:
                return Value.fromBinary(raw);
            default:
                throw new SidrException(ErrorType.TYPE_MISMATCH, "Cannot decode " + type);
        }
    }

    /**
     * OLE automation date: days since 1899-12-30, fraction is the time of day.
     */
    public static Instant fromOleDate(double days) {
        return Instant.ofEpochMilli(Math.round((days - OLE_EPOCH_OFFSET_DAYS) * MILLIS_PER_DAY));
    }

    public static String decodeText(byte[] raw, int codePage) {
        var text = new String(raw, charsetFor(codePage));
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\0') {
            end--;
        }
        return text.substring(0, end);
    }

    public static Charset charsetFor(int codePage) {
        switch (codePage) {
            case CODE_PAGE_UNICODE:
                return StandardCharsets.UTF_16LE;
            case CODE_PAGE_UTF8:
                return StandardCharsets.UTF_8;
            case CODE_PAGE_ASCII:
                return StandardCharsets.US_ASCII;
            default:
                return Charset.forName("windows-1252");
        }
    }

    // Data1..Data3 little-endian, Data4 as stored.
    private static UUID toGuid(EseBuffer buffer) throws SidrException {
        long data1 = buffer.getUnsignedInt(0);
        long data2 = buffer.getUnsignedShort(4);
        long data3 = buffer.getUnsignedShort(6);
        long most = (data1 << 32) | (data2 << 16) | data3;
        long least = buffer.getBigEndian(8, 8);
        return new UUID(most, least);
    }

    private static void expectSize(ColumnType type, byte[] raw, int size) throws SidrException {
        if (raw.length != size) {
            throw new SidrException(ErrorType.TYPE_MISMATCH,
                    type + " expects " + size + " bytes, got " + raw.length);
        }
    }
}
