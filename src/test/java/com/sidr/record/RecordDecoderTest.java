package com.sidr.record;

import com.sidr.catalog.ColumnDef;
import com.sidr.catalog.TableSchema;
import com.sidr.error.ErrorType;
import com.sidr.error.SidrException;
import com.sidr.mapping.ValueTransform;
import com.sidr.testing.Bytes;
import com.sidr.testing.RecordEncoder;
import com.sidr.types.ColumnType;
import com.sidr.types.ColumnValues;
import com.sidr.types.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecordDecoder")
class RecordDecoderTest {
    private static final int UNICODE = ColumnValues.CODE_PAGE_UNICODE;

    static final TableSchema SCHEMA = TableSchema.builder(10)
            .table("T", 30)
            .column(new ColumnDef(1, "id", ColumnType.LONG, 4, ColumnDef.FLAG_FIXED, 0))
            .column(new ColumnDef(2, "kind", ColumnType.SHORT, 2, ColumnDef.FLAG_FIXED, 0))
            .column(new ColumnDef(128, "name", ColumnType.TEXT, 0, 0, UNICODE))
            .column(new ColumnDef(129, "blob", ColumnType.BINARY, 0, 0, 0))
            .column(new ColumnDef(256, "note", ColumnType.LONG_TEXT, 0, ColumnDef.FLAG_TAGGED, UNICODE))
            .column(new ColumnDef(257, "data", ColumnType.LONG_BINARY, 0, ColumnDef.FLAG_TAGGED, 0))
            .column(new ColumnDef(258, "keywords", ColumnType.LONG_TEXT, 0,
                    ColumnDef.FLAG_TAGGED | ColumnDef.FLAG_MULTI_VALUED, UNICODE))
            .build();

    private static TableRecord decode(byte[] data) throws SidrException {
        return RecordDecoder.decode(SCHEMA, data, false);
    }

    private static RecordEncoder full() {
        return new RecordEncoder()
                .fixed(Bytes.int32(7))
                .fixed(Bytes.int16(3))
                .variable(Bytes.utf16("report.docx"))
                .variable(new byte[] {1, 2})
                .tagged(256, Bytes.utf16("draft"));
    }

    @Nested
    @DisplayName("Column classes")
    class ColumnClasses {

        @Test
        @DisplayName("should decode fixed, variable and tagged columns")
        void shouldDecodeAllClasses() throws SidrException {
            var record = decode(full().encode());

            assertThat(record.columnIds()).containsExactly(1, 2, 128, 129, 256);
            assertThat(record.get(1)).isEqualTo(Value.fromLong(7));
            assertThat(record.get(2)).isEqualTo(Value.fromLong(3));
            assertThat(record.get(128)).isEqualTo(Value.fromText("report.docx"));
            assertThat(record.get(129)).isEqualTo(Value.fromBinary(new byte[] {1, 2}));
            assertThat(record.get(256)).isEqualTo(Value.fromText("draft"));
        }

        @Test
        @DisplayName("should leave null and missing columns absent")
        void shouldOmitAbsentColumns() throws SidrException {
            byte[] data = new RecordEncoder()
                    .fixed(Bytes.int32(7))
                    .fixedNull(2)
                    .variableNull()
                    .variable(new byte[0])
                    .encode();

            var record = decode(data);

            assertThat(record.columnIds()).containsExactly(1);
            assertThat(record.has(2)).isFalse();
            assertThat(record.get(128)).isNull();
        }

        @Test
        @DisplayName("should treat fixed columns beyond the last fixed id as absent")
        void shouldStopAtLastFixed() throws SidrException {
            var record = decode(new RecordEncoder().fixed(Bytes.int32(-5)).variable(Bytes.utf16("x")).encode());

            assertThat(record.asMap()).containsOnlyKeys(1, 128);
            assertThat(record.get(1)).isEqualTo(Value.fromLong(-5));
        }

        @Test
        @DisplayName("should skip tagged columns missing from the schema")
        void shouldSkipUnknownTagged() throws SidrException {
            var record = decode(new RecordEncoder().fixed(Bytes.int32(1)).tagged(300, new byte[] {1}).encode());

            assertThat(record.columnIds()).containsExactly(1);
        }

        @Test
        @DisplayName("should read the large page tagged layout")
        void shouldDecodeLargeLayout() throws SidrException {
            byte[] data = full().tagged(257, new byte[] {9, 9}).encode(true);

            var record = RecordDecoder.decode(SCHEMA, data, true);

            assertThat(record.get(256)).isEqualTo(Value.fromText("draft"));
            assertThat(record.get(257)).isEqualTo(Value.fromBinary(new byte[] {9, 9}));
        }
    }

    @Nested
    @DisplayName("Tagged flags")
    class Flags {

        @Test
        @DisplayName("should split multi-values at their offset table")
        void shouldSplitMultiValue() throws SidrException {
            byte[] first = Bytes.utf16("red");
            byte[] second = Bytes.utf16("green");
            byte[] multi = Bytes.concat(Bytes.int16(4), Bytes.int16(4 + first.length), first, second);

            var record = decode(new RecordEncoder().tagged(258, TaggedFlags.MULTI_VALUE, multi).encode());

            assertThat(record.get(258)).isEqualTo(Value.fromValues(List.of(Value.fromText("red"), Value.fromText("green"))));
        }

        @Test
        @DisplayName("should split size-prefixed two-element values")
        void shouldSplitSizePrefixed() throws SidrException {
            byte[] first = Bytes.utf16("a");
            byte[] data = Bytes.concat(new byte[] {(byte) first.length}, first, Bytes.utf16("bc"));

            var record = decode(new RecordEncoder().tagged(258, TaggedFlags.MULTI_VALUE_SIZE_PREFIX, data).encode());

            assertThat(record.get(258)).isEqualTo(Value.fromValues(List.of(Value.fromText("a"), Value.fromText("bc"))));
        }

        @Test
        @DisplayName("should decompress compressed values")
        void shouldDecompress() throws SidrException {
            // 7-bit unicode packing of "hi"
            byte[] packed = {0x15, (byte) 0xE8, 0x34};

            var record = decode(new RecordEncoder().tagged(256, TaggedFlags.COMPRESSED, packed).encode());

            assertThat(record.get(256)).isEqualTo(Value.fromText("hi"));
        }

        @Test
        @DisplayName("should read 7-bit ASCII in binary columns as UTF-16LE text of any length")
        void shouldWidenAsciiInBinaryColumns() throws SidrException {
            byte[] abcd = {0x0B, 0x61, (byte) 0xF1, (byte) 0x98, 0x0C};
            byte[] abc = {0x0C, 0x61, (byte) 0xF1, 0x18};

            var even = decode(new RecordEncoder().tagged(257, TaggedFlags.COMPRESSED, abcd).encode());
            var odd = decode(new RecordEncoder().tagged(257, TaggedFlags.COMPRESSED, abc).encode());

            assertThat(even.get(257)).isEqualTo(Value.fromBinary(Bytes.utf16("abcd")));
            assertThat(ValueTransform.TEXT.apply(even.get(257))).isEqualTo(Value.fromText("abcd"));
            assertThat(ValueTransform.TEXT.apply(odd.get(257))).isEqualTo(Value.fromText("abc"));
        }

        @Test
        @DisplayName("should turn long-value flags into references")
        void shouldReferenceLongValues() throws SidrException {
            var record = decode(new RecordEncoder()
                    .tagged(256, TaggedFlags.LONG_VALUE | TaggedFlags.COMPRESSED, Bytes.int32(0x42))
                    .tagged(257, TaggedFlags.LONG_VALUE, Bytes.int64(0x1_0000_0001L))
                    .encode());

            assertThat(record.get(256)).isEqualTo(Value.longValueRef(0x42, true));
            assertThat(record.get(257)).isEqualTo(Value.longValueRef(0x1_0000_0001L, false));
        }

        @Test
        @DisplayName("should reject a long-value reference of odd width")
        void shouldRejectBadReference() {
            byte[] data = new RecordEncoder().tagged(257, TaggedFlags.LONG_VALUE, new byte[] {1, 2, 3}).encode();

            assertThatThrownBy(() -> decode(data))
                    .isInstanceOf(SidrException.class)
                    .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
        }
    }

    @Nested
    @DisplayName("Malformed records")
    class Malformed {

        @Test
        @DisplayName("should reject a variable offset outside the record")
        void shouldRejectVariableOffset() {
            assertThatThrownBy(() -> decode(new byte[] {1, (byte) 128, 40, 0, 0, 0}))
                    .isInstanceOf(SidrException.class)
                    .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
        }

        @Test
        @DisplayName("should reject every truncation of a valid record")
        void shouldRejectTruncation() {
            byte[] data = full().encode();
            // cuts inside the tagged data leave a shorter readable value, a cut exactly
            // before the tagged area leaves a record without tagged columns
            int taggedHeader = data.length - Bytes.utf16("draft").length;
            int taggedStart = taggedHeader - 4;

            for (int length = 0; length < taggedHeader; length++) {
                if (length == taggedStart) {
                    continue;
                }
                byte[] cut = Arrays.copyOf(data, length);
                assertThatThrownBy(() -> decode(cut))
                        .as("record cut to %d bytes", length)
                        .isInstanceOf(SidrException.class)
                        .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
            }
        }

        @Test
        @DisplayName("should reject decreasing variable offsets")
        void shouldRejectDecreasingOffsets() {
            byte[] data = Bytes.concat(new byte[] {0, (byte) 129, 4, 0}, Bytes.int16(4), Bytes.int16(2), new byte[4]);

            assertThatThrownBy(() -> decode(data))
                    .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
        }

        @Test
        @DisplayName("should reject tagged columns out of order")
        void shouldRejectTaggedOrder() {
            byte[] data = Bytes.concat(new byte[] {0, 127, 4, 0},
                    Bytes.int16(257), Bytes.int16(8), Bytes.int16(256), Bytes.int16(9), new byte[] {1, 2});

            assertThatThrownBy(() -> decode(data))
                    .hasMessageContaining("follows")
                    .extracting("errorType").isEqualTo(ErrorType.TRUNCATED_RECORD);
        }
    }

    @Test
    @DisplayName("should decode the same bytes to equal records")
    void shouldBeDeterministic() throws SidrException {
        byte[] data = full().tagged(258, TaggedFlags.MULTI_VALUE,
                Bytes.concat(Bytes.int16(2), Bytes.utf16("k"))).encode();

        assertThat(decode(data)).isEqualTo(decode(data.clone()));
    }
}
