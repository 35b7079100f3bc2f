package com.sidr.util;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import lombok.experimental.UtilityClass;

/**
 * Decompression of tagged column data stored with the engine's compression flag.
 * <p>
 * The first byte of compressed data carries the scheme in its upper five bits.
 * 7-bit schemes keep the number of significant bits in the final byte, minus one,
 * in the lower three bits.
 */
@UtilityClass
public final class Decompressor {

    public static final int SCHEME_7BIT_ASCII = 1;
    public static final int SCHEME_7BIT_UNICODE = 2;
    public static final int SCHEME_XPRESS = 3;

    public static byte[] decompress(byte[] data) throws SidrException {
        return decompress(data, false);
    }

    /**
     * @param widenAscii emit 7-bit ASCII as UTF-16LE, as binary columns holding text are read
     *                   back as UTF-16LE whatever scheme compressed them
     */
    public static byte[] decompress(byte[] data, boolean widenAscii) throws SidrException {
        if (data.length == 0) {
            return data;
        }
        int scheme = (data[0] & 0xFF) >>> 3;
        switch (scheme) {
            case SCHEME_7BIT_ASCII:
                return decompressSevenBit(data, widenAscii);
            case SCHEME_7BIT_UNICODE:
                return decompressSevenBit(data, true);
            case SCHEME_XPRESS:
                return decompressXpress(data);
            default:
                throw new SidrException(ErrorType.UNSUPPORTED_COMPRESSION,
                        "Unsupported compression scheme: " + scheme);
        }
    }

    static byte[] decompressSevenBit(byte[] data, boolean wide) {
        if (data.length < 2) {
            return new byte[0];
        }
        int finalBits = (data[0] & 0x7) + 1;
        long totalBits = (long) (data.length - 2) * 8 + finalBits;
        int count = (int) (totalBits / 7);

        byte[] out = new byte[wide ? count * 2 : count];
        for (int i = 0; i < count; i++) {
            int bit = i * 7;
            int index = 1 + (bit >>> 3);
            int window = data[index] & 0xFF;
            if (index + 1 < data.length) {
                window |= (data[index + 1] & 0xFF) << 8;
            }
            byte value = (byte) ((window >>> (bit & 7)) & 0x7F);
            if (wide) {
                out[i * 2] = value;
            } else {
                out[i] = value;
            }
        }
        return out;
    }

    /**
     * Plain LZ77 XPRESS, preceded by the scheme byte and a u16 uncompressed size.
     */
    static byte[] decompressXpress(byte[] data) throws SidrException {
        if (data.length < 3) {
            throw new SidrException(ErrorType.TRUNCATED_RECORD, "XPRESS header truncated");
        }
        int size = (data[1] & 0xFF) | (data[2] & 0xFF) << 8;
        byte[] out = new byte[size];
        int in = 3;
        int outPos = 0;
        long flags = 0;
        int flagCount = 0;
        int lastHalfByte = 0;

        while (outPos < size) {
            if (flagCount == 0) {
                if (in + 4 > data.length) {
                    throw truncated();
                }
                flags = readInt(data, in) & 0xFFFFFFFFL;
                in += 4;
                flagCount = 32;
            }
            flagCount--;
            if ((flags & (1L << flagCount)) == 0) {
                if (in >= data.length) {
                    throw truncated();
                }
                out[outPos++] = data[in++];
                continue;
            }
            if (in + 2 > data.length) {
                throw truncated();
            }
            int matchBytes = (data[in] & 0xFF) | (data[in + 1] & 0xFF) << 8;
            in += 2;
            int length = matchBytes & 7;
            int offset = (matchBytes >>> 3) + 1;
            if (length == 7) {
                if (lastHalfByte == 0) {
                    length = byteAt(data, in) & 0x0F;
                    lastHalfByte = in;
                    in++;
                } else {
                    length = (data[lastHalfByte] & 0xFF) >>> 4;
                    lastHalfByte = 0;
                }
                if (length == 15) {
                    length = byteAt(data, in) & 0xFF;
                    in++;
                    if (length == 255) {
                        if (in + 2 > data.length) {
                            throw truncated();
                        }
                        length = (data[in] & 0xFF) | (data[in + 1] & 0xFF) << 8;
                        in += 2;
                        if (length == 0) {
                            if (in + 4 > data.length) {
                                throw truncated();
                            }
                            length = readInt(data, in);
                            in += 4;
                        }
                        if (length < 15 + 7) {
                            throw new SidrException(ErrorType.TRUNCATED_RECORD, "Invalid XPRESS match length");
                        }
                        length -= 15 + 7;
                    }
                    length += 15;
                }
                length += 7;
            }
            length += 3;
            if (offset > outPos) {
                throw new SidrException(ErrorType.TRUNCATED_RECORD,
                        "XPRESS match offset " + offset + " before start of output at " + outPos);
            }
            for (int i = 0; i < length && outPos < size; i++) {
                out[outPos] = out[outPos - offset];
                outPos++;
            }
        }
        return out;
    }

    private static byte byteAt(byte[] data, int index) throws SidrException {
        if (index >= data.length) {
            throw truncated();
        }
        return data[index];
    }

    private static int readInt(byte[] data, int at) {
        return (data[at] & 0xFF)
                | (data[at + 1] & 0xFF) << 8
                | (data[at + 2] & 0xFF) << 16
                | (data[at + 3] & 0xFF) << 24;
    }

    private static SidrException truncated() {
        return new SidrException(ErrorType.TRUNCATED_RECORD, "XPRESS stream truncated");
    }
}
