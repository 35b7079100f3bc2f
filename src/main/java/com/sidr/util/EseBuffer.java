package com.sidr.util;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;

/**
 * Bounds-checked little-endian view over a byte array.
 * <p>
 * Every read is validated against the view's limit. An out-of-bounds read raises a
 * {@link SidrException} whose type is fixed when the view is created, so a page view
 * reports {@link ErrorType#CORRUPT_PAGE} while a record view reports
 * {@link ErrorType#TRUNCATED_RECORD}.
 */
public final class EseBuffer {

    private final byte[] array;
    private final int baseOffset;
    private final int capacity;
    private final ErrorType underflowError;

    /**
     * Create a view over a whole byte array.
     */
    public EseBuffer(byte[] array, ErrorType underflowError) {
        this(array, 0, array.length, underflowError);
    }

    /**
     * Create a view over a portion of a byte array.
     */
    public EseBuffer(byte[] array, int offset, int length, ErrorType underflowError) {
        if (offset < 0 || length < 0 || offset + length > array.length) {
            throw new IllegalArgumentException("Invalid offset/length: " + offset + "/" + length);
        }
        this.array = array;
        this.baseOffset = offset;
        this.capacity = length;
        this.underflowError = underflowError;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Create a view of {@code length} bytes starting at absolute {@code offset}.
     */
    public EseBuffer slice(int offset, int length) throws SidrException {
        check(offset, length);
        return new EseBuffer(array, baseOffset + offset, length, underflowError);
    }

    public byte getByte(int offset) throws SidrException {
        check(offset, 1);
        return array[baseOffset + offset];
    }

    public int getUnsignedByte(int offset) throws SidrException {
        return getByte(offset) & 0xFF;
    }

    public short getShort(int offset) throws SidrException {
        check(offset, 2);
        int at = baseOffset + offset;
        return (short) ((array[at] & 0xFF) | (array[at + 1] & 0xFF) << 8);
    }

    public int getUnsignedShort(int offset) throws SidrException {
        return getShort(offset) & 0xFFFF;
    }

    public int getInt(int offset) throws SidrException {
        check(offset, 4);
        int at = baseOffset + offset;
        return (array[at] & 0xFF)
                | (array[at + 1] & 0xFF) << 8
                | (array[at + 2] & 0xFF) << 16
                | (array[at + 3] & 0xFF) << 24;
    }

    public long getUnsignedInt(int offset) throws SidrException {
        return getInt(offset) & 0xFFFFFFFFL;
    }

    public long getLong(int offset) throws SidrException {
        check(offset, 8);
        return (getInt(offset) & 0xFFFFFFFFL) | ((long) getInt(offset + 4) << 32);
    }

    /**
     * Read an unsigned big-endian integer of 1 to 8 bytes. Used for B-tree keys,
     * which the engine stores most significant byte first.
     */
    public long getBigEndian(int offset, int width) throws SidrException {
        if (width < 1 || width > 8) {
            throw new IllegalArgumentException("Invalid width: " + width);
        }
        check(offset, width);
        long value = 0;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | (array[baseOffset + offset + i] & 0xFF);
        }
        return value;
    }

    public byte[] getBytes(int offset, int length) throws SidrException {
        check(offset, length);
        byte[] value = new byte[length];
        System.arraycopy(array, baseOffset + offset, value, 0, length);
        return value;
    }

    private void check(int offset, int length) throws SidrException {
        if (offset < 0 || length < 0 || (long) offset + length > capacity) {
            throw underflow(offset, length);
        }
    }

    private SidrException underflow(int offset, int length) {
        return new SidrException(underflowError,
                "Read of " + length + " bytes at offset " + offset + " exceeds " + capacity + " available bytes");
    }

    @Override
    public String toString() {
        return "EseBuffer{capacity=" + capacity + "}";
    }
}
