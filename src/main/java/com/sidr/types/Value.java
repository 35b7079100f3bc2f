package com.sidr.types;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A decoded column value.
 */
public abstract class Value {

    /**
     * Shape of a decoded value, independent of the column type it came from.
     */
    public enum Kind {
        BOOLEAN,
        INTEGER,
        FLOAT,
        DATE_TIME,
        CURRENCY,
        TEXT,
        BINARY,
        GUID,
        LONG_VALUE_REF,
        MULTI
    }

    public abstract Kind getKind();

    /**
     * Plain Java representation used by the artifact mapper.
     */
    public abstract Object asObject();

    public abstract boolean equals(Object obj);
    public abstract int hashCode();
    public abstract String toString();

    // Factory methods
    public static Value fromBoolean(boolean value) {
        return new BoolValue(value);
    }

    public static Value fromLong(long value) {
        return new IntValue(value);
    }

    public static Value fromDouble(double value) {
        return new FloatValue(value);
    }

    public static Value fromDateTime(Instant value) {
        return new DateTimeValue(value);
    }

    public static Value fromCurrency(BigDecimal value) {
        return new CurrencyValue(value);
    }

    public static Value fromText(String value) {
        return new TextValue(value);
    }

    public static Value fromBinary(byte[] value) {
        return new BinaryValue(value);
    }

    public static Value fromGuid(UUID value) {
        return new GuidValue(value);
    }

    public static Value longValueRef(long id, boolean compressed) {
        return new LongValueRef(id, compressed);
    }

    public static Value fromValues(List<Value> values) {
        return new MultiValue(values);
    }

    // Boolean Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class BoolValue extends Value {
        private final boolean value;

        public BoolValue(boolean value) {
            this.value = value;
        }

        public boolean getValue() { return value; }

        @Override
        public Kind getKind() { return Kind.BOOLEAN; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // Integer Value, signed or unsigned up to 64 bits
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class IntValue extends Value {
        private final long value;

        public IntValue(long value) {
            this.value = value;
        }

        @Override
        public Kind getKind() { return Kind.INTEGER; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class FloatValue extends Value {
        private final double value;

        public FloatValue(double value) {
            this.value = value;
        }

        @Override
        public Kind getKind() { return Kind.FLOAT; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class DateTimeValue extends Value {
        private final Instant value;

        public DateTimeValue(Instant value) {
            this.value = Objects.requireNonNull(value, "Instant cannot be null");
        }

        @Override
        public Kind getKind() { return Kind.DATE_TIME; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class CurrencyValue extends Value {
        private final BigDecimal value;

        public CurrencyValue(BigDecimal value) {
            this.value = Objects.requireNonNull(value, "Amount cannot be null");
        }

        @Override
        public Kind getKind() { return Kind.CURRENCY; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class TextValue extends Value {
        private final String value;

        public TextValue(String value) {
            this.value = Objects.requireNonNull(value, "String cannot be null");
        }

        @Override
        public Kind getKind() { return Kind.TEXT; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    @Getter
    public static class BinaryValue extends Value {
        /**
         *  Returns internal array. MUST NOT be modified by caller.
         */
        private final byte[] value;

        /**
         * Takes ownership of the byte array. Caller must not modify after construction.
         */
        public BinaryValue(byte[] value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public Kind getKind() { return Kind.BINARY; }

        @Override
        public Object asObject() { return value; }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof BinaryValue)) return false;
            return Arrays.equals(value, ((BinaryValue) obj).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "bytes[" + value.length + "]";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class GuidValue extends Value {
        private final UUID value;

        public GuidValue(UUID value) {
            this.value = Objects.requireNonNull(value, "GUID cannot be null");
        }

        @Override
        public Kind getKind() { return Kind.GUID; }

        @Override
        public Object asObject() { return value; }

        @Override
        public String toString() {
            return "{" + value + "}";
        }
    }

    /**
     * Pointer into the table's long-value tree; replaced by the resolved value before mapping.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class LongValueRef extends Value {
        private final long id;
        private final boolean compressed;

        public LongValueRef(long id, boolean compressed) {
            this.id = id;
            this.compressed = compressed;
        }

        @Override
        public Kind getKind() { return Kind.LONG_VALUE_REF; }

        @Override
        public Object asObject() { return id; }

        @Override
        public String toString() {
            return "lv#" + Long.toHexString(id);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class MultiValue extends Value {
        private final List<Value> values;

        public MultiValue(List<Value> values) {
            this.values = List.copyOf(Objects.requireNonNull(values, "Values cannot be null"));
        }

        @Override
        public Kind getKind() { return Kind.MULTI; }

        @Override
        public Object asObject() {
            return values.stream().map(Value::asObject).collect(Collectors.toList());
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
