package com.sidr.util;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Decompressor")
class DecompressorTest {

    /**
     * Pack 7-bit characters little-endian behind a scheme byte.
     */
    private static byte[] sevenBit(int scheme, String text) {
        int bits = text.length() * 7;
        int dataBytes = (bits + 7) / 8;
        byte[] out = new byte[1 + dataBytes];
        int finalBits = bits - (dataBytes - 1) * 8;
        out[0] = (byte) (scheme << 3 | (finalBits - 1));
        for (int i = 0; i < text.length(); i++) {
            int value = text.charAt(i) & 0x7F;
            int bit = i * 7;
            int index = 1 + bit / 8;
            int shift = bit % 8;
            out[index] |= (byte) (value << shift);
            if (shift > 1) {
                out[index + 1] |= (byte) (value >>> (8 - shift));
            }
        }
        return out;
    }

    @Nested
    @DisplayName("7-bit schemes")
    class SevenBit {

        @Test
        @DisplayName("should unpack ASCII text")
        void shouldUnpackAscii() throws SidrException {
            byte[] packed = sevenBit(Decompressor.SCHEME_7BIT_ASCII, "Windows.edb");

            assertThat(new String(Decompressor.decompress(packed), StandardCharsets.US_ASCII))
                    .isEqualTo("Windows.edb");
        }

        @Test
        @DisplayName("should widen unicode text to UTF-16LE")
        void shouldWidenUnicode() throws SidrException {
            byte[] packed = sevenBit(Decompressor.SCHEME_7BIT_UNICODE, "abc");

            assertThat(Decompressor.decompress(packed)).containsExactly('a', 0, 'b', 0, 'c', 0);
        }

        @Test
        @DisplayName("should widen ASCII on request")
        void shouldWidenAsciiOnRequest() throws SidrException {
            byte[] packed = sevenBit(Decompressor.SCHEME_7BIT_ASCII, "abcd");

            assertThat(Decompressor.decompress(packed)).containsExactly('a', 'b', 'c', 'd');
            assertThat(Decompressor.decompress(packed, true)).containsExactly('a', 0, 'b', 0, 'c', 0, 'd', 0);
        }

        @Test
        @DisplayName("should yield nothing for a bare scheme byte")
        void shouldHandleEmptyPayload() throws SidrException {
            assertThat(Decompressor.decompress(new byte[] {0x08})).isEmpty();
        }
    }

    @Nested
    @DisplayName("XPRESS")
    class Xpress {

        @Test
        @DisplayName("should copy literals")
        void shouldCopyLiterals() throws SidrException {
            byte[] data = {0x18, 5, 0, 0, 0, 0, 0, 'h', 'e', 'l', 'l', 'o'};

            assertThat(new String(Decompressor.decompress(data), StandardCharsets.US_ASCII)).isEqualTo("hello");
        }

        @Test
        @DisplayName("should expand back references")
        void shouldExpandMatches() throws SidrException {
            // three literals, then a match of length 6 at distance 3
            byte[] data = {0x18, 9, 0, 0, 0, 0, 0x10, 'a', 'b', 'c', 19, 0};

            assertThat(new String(Decompressor.decompress(data), StandardCharsets.US_ASCII)).isEqualTo("abcabcabc");
        }

        @Test
        @DisplayName("should reject a match before the start of output")
        void shouldRejectBadOffset() {
            byte[] data = {0x18, 4, 0, 0, 0, 0, (byte) 0x80, 19, 0};

            assertThatThrownBy(() -> Decompressor.decompress(data))
                    .isInstanceOf(SidrException.class)
                    .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
        }

        @Test
        @DisplayName("should reject streams that end before the declared size")
        void shouldRejectShortStreams() {
            byte[] noFlags = {0x18, 0x10, 0x00};
            byte[] fewLiterals = {0x18, 0x08, 0x00, 0, 0, 0, 0, 'a', 'b'};
            byte[] noMatch = {0x18, 0x08, 0x00, 0, 0, 0, 0x40, 'a'};

            for (byte[] data : new byte[][] {noFlags, fewLiterals, noMatch}) {
                assertThatThrownBy(() -> Decompressor.decompress(data))
                        .isInstanceOf(SidrException.class)
                        .hasMessageContaining("truncated")
                        .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
            }
        }
    }

    @Test
    @DisplayName("should reject unknown schemes")
    void shouldRejectUnknownScheme() {
        assertThatThrownBy(() -> Decompressor.decompress(new byte[] {0x28, 1, 2}))
                .isInstanceOf(SidrException.class)
                .extracting("errorType").isEqualTo(ErrorType.UNSUPPORTED_COMPRESSION);
    }

    @Test
    @DisplayName("should pass empty input through")
    void shouldPassEmptyInput() throws SidrException {
        assertThat(Decompressor.decompress(new byte[0])).isEmpty();
    }
}
