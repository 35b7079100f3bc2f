package com.sidr.mapping;

import com.sidr.types.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.StringJoiner;

/**
 * Conversion of a source value into a report value.
 * <p>
 * Every transform yields either a {@link Value.TextValue} or a {@link Value.IntValue},
 * or null when the source holds nothing meaningful (an empty string, a zero timestamp,
 * a value of the wrong shape). A null result leaves the report field unset.
 */
public enum ValueTransform {
    TEXT {
        @Override
        public Value apply(Value value) {
            var text = asText(value);
            return text == null || text.isEmpty() ? null : Value.fromText(text);
        }
    },
    INTEGER {
        @Override
        public Value apply(Value value) {
            var number = asLong(value);
            return number == null ? null : Value.fromLong(number);
        }
    },
    /** Windows FILETIME: 100 ns ticks since 1601-01-01 UTC. */
    FILETIME {
        @Override
        public Value apply(Value value) {
            if (value instanceof Value.DateTimeValue) {
                return formatInstant(((Value.DateTimeValue) value).getValue());
            }
            var ticks = asLong(value);
            if (ticks == null || ticks <= 0) {
                return null;
            }
            long sinceUnixEpoch = ticks - FILETIME_UNIX_EPOCH_TICKS;
            long seconds = Math.floorDiv(sinceUnixEpoch, TICKS_PER_SECOND);
            long nanos = Math.floorMod(sinceUnixEpoch, TICKS_PER_SECOND) * 100;
            return formatInstant(Instant.ofEpochSecond(seconds, nanos));
        }
    };

    private static final long FILETIME_UNIX_EPOCH_TICKS = 116_444_736_000_000_000L;
    private static final long TICKS_PER_SECOND = 10_000_000L;
    private static final String MULTI_VALUE_SEPARATOR = "; ";

    /**
     * @return the report value, or null if there is none
     */
    public abstract Value apply(Value value);

    private static Value formatInstant(Instant instant) {
        return Value.fromText(DateTimeFormatter.ISO_INSTANT.format(instant));
    }

    static String asText(Value value) {
        if (value == null) {
            return null;
        }
        switch (value.getKind()) {
            case TEXT:
                return ((Value.TextValue) value).getValue();
            case BINARY:
                return decodeBinaryText(((Value.BinaryValue) value).getValue());
            case GUID:
            case LONG_VALUE_REF:
                return value.toString();
            case MULTI:
                var joiner = new StringJoiner(MULTI_VALUE_SEPARATOR);
                for (var element : ((Value.MultiValue) value).getValues()) {
                    var text = asText(element);
                    if (text != null && !text.isEmpty()) {
                        joiner.add(text);
                    }
                }
                return joiner.toString();
            default:
                return String.valueOf(value.asObject());
        }
    }

    /**
     * Integers, booleans, numeric text, and little-endian binary of 1, 2, 4 or 8 bytes.
     */
    static Long asLong(Value value) {
        if (value == null) {
            return null;
        }
        switch (value.getKind()) {
            case INTEGER:
                return ((Value.IntValue) value).getValue();
            case BOOLEAN:
                return ((Value.BoolValue) value).getValue() ? 1L : 0L;
            case FLOAT:
                return Math.round(((Value.FloatValue) value).getValue());
            case TEXT:
                try {
                    return Long.parseLong(((Value.TextValue) value).getValue().trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            case BINARY:
                byte[] bytes = ((Value.BinaryValue) value).getValue();
                if (bytes.length != 1 && bytes.length != 2 && bytes.length != 4 && bytes.length != 8) {
                    return null;
                }
                long result = 0;
                for (int i = bytes.length - 1; i >= 0; i--) {
                    result = (result << 8) | (bytes[i] & 0xFF);
                }
                return result;
            case MULTI:
                var values = ((Value.MultiValue) value).getValues();
                return values.isEmpty() ? null : asLong(values.get(0));
            default:
                return null;
        }
    }

    /**
     * Binary property values hold UTF-16LE text, compressed ones included; an odd length
     * can only be single-byte text.
     */
    private static String decodeBinaryText(byte[] bytes) {
        var charset = bytes.length % 2 == 0 ? StandardCharsets.UTF_16LE : StandardCharsets.ISO_8859_1;
        var text = new String(bytes, charset);
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\0') {
            end--;
        }
        return text.substring(0, end);
    }
}
