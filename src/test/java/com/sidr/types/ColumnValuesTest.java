package com.sidr.types;

import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.testing.Bytes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ColumnValues")
class ColumnValuesTest {

    @Nested
    @DisplayName("Numeric types")
    class Numeric {

        @Test
        @DisplayName("should sign-extend signed and zero-extend unsigned integers")
        void shouldDecodeIntegers() throws SidrException {
            assertThat(ColumnValues.decode(ColumnType.SHORT, 0, Bytes.int16(-2))).isEqualTo(Value.fromLong(-2));
            assertThat(ColumnValues.decode(ColumnType.UNSIGNED_SHORT, 0, Bytes.int16(-2))).isEqualTo(Value.fromLong(0xFFFE));
            assertThat(ColumnValues.decode(ColumnType.LONG, 0, Bytes.int32(-1))).isEqualTo(Value.fromLong(-1));
            assertThat(ColumnValues.decode(ColumnType.UNSIGNED_LONG, 0, Bytes.int32(-1))).isEqualTo(Value.fromLong(0xFFFFFFFFL));
            assertThat(ColumnValues.decode(ColumnType.LONG_LONG, 0, Bytes.int64(1L << 40))).isEqualTo(Value.fromLong(1L << 40));
            assertThat(ColumnValues.decode(ColumnType.UNSIGNED_BYTE, 0, new byte[] {(byte) 200})).isEqualTo(Value.fromLong(200));
        }

        @Test
        @DisplayName("should decode bits, floats and currency")
        void shouldDecodeOthers() throws SidrException {
            assertThat(ColumnValues.decode(ColumnType.BIT, 0, new byte[] {1})).isEqualTo(Value.fromBoolean(true));
            assertThat(ColumnValues.decode(ColumnType.IEEE_DOUBLE, 0, Bytes.float64(2.5))).isEqualTo(Value.fromDouble(2.5));
            assertThat(ColumnValues.decode(ColumnType.IEEE_SINGLE, 0, Bytes.int32(Float.floatToIntBits(1.5f))))
                    .isEqualTo(Value.fromDouble(1.5));
            assertThat(ColumnValues.decode(ColumnType.CURRENCY, 0, Bytes.int64(12345)))
                    .isEqualTo(Value.fromCurrency(new BigDecimal("1.2345")));
        }

        @Test
        @DisplayName("should reject a value of the wrong width")
        void shouldRejectWrongWidth() {
            assertThatThrownBy(() -> ColumnValues.decode(ColumnType.LONG, 0, new byte[3]))
                    .isInstanceOf(SidrException.class)
                    .extracting("errorType").isEqualTo(ErrorType.TYPE_MISMATCH);
        }
    }

    @Test
    @DisplayName("should convert OLE automation dates")
    void shouldDecodeDateTime() throws SidrException {
        // 25569.5 days after 1899-12-30 is noon on 1970-01-01
        var value = ColumnValues.decode(ColumnType.DATE_TIME, 0, Bytes.float64(25569.5));

        assertThat(value).isEqualTo(Value.fromDateTime(Instant.parse("1970-01-01T12:00:00Z")));
    }

    @Test
    @DisplayName("should decode mixed-endian GUIDs")
    void shouldDecodeGuid() throws SidrException {
        byte[] raw = {0x33, 0x22, 0x11, 0x00, 0x55, 0x44, 0x77, 0x66,
                (byte) 0x88, (byte) 0x99, (byte) 0xAA, (byte) 0xBB, (byte) 0xCC, (byte) 0xDD, (byte) 0xEE, (byte) 0xFF};

        assertThat(ColumnValues.decode(ColumnType.GUID, 0, raw))
                .isEqualTo(Value.fromGuid(UUID.fromString("00112233-4455-6677-8899-aabbccddeeff")));
    }

    @Nested
    @DisplayName("Text")
    class Text {

        @Test
        @DisplayName("should honour the column code page")
        void shouldUseCodePage() throws SidrException {
            assertThat(ColumnValues.decode(ColumnType.TEXT, ColumnValues.CODE_PAGE_UNICODE, Bytes.utf16("Grüße")))
                    .isEqualTo(Value.fromText("Grüße"));
            assertThat(ColumnValues.decode(ColumnType.LONG_TEXT, ColumnValues.CODE_PAGE_WESTERN, new byte[] {'c', (byte) 0xE9}))
                    .isEqualTo(Value.fromText("cé"));
        }

        @Test
        @DisplayName("should strip trailing NULs")
        void shouldStripTerminators() {
            assertThat(ColumnValues.decodeText(Bytes.utf16("name\0\0"), ColumnValues.CODE_PAGE_UNICODE)).isEqualTo("name");
        }
    }

    @Test
    @DisplayName("should keep binary columns as bytes")
    void shouldKeepBinary() throws SidrException {
        var value = ColumnValues.decode(ColumnType.LONG_BINARY, 0, new byte[] {1, 2, 3});

        assertThat(value.getKind()).isEqualTo(Value.Kind.BINARY);
        assertThat(value).isEqualTo(Value.fromBinary(new byte[] {1, 2, 3}));
    }
}
