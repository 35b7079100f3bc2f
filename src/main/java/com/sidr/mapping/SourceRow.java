package com.sidr.mapping;

import com.sidr.catalog.TableSchema;
import com.sidr.record.TableRecord;
import com.sidr.types.Value;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A source row addressed by normalized column name, independent of the store it came from.
 */
@EqualsAndHashCode
public final class SourceRow {
    // "4447-System_ItemPathDisplay" -> "System_ItemPathDisplay"
    private static final Pattern PROPERTY_PREFIX = Pattern.compile("^\\d+-");

    private final Map<String, Value> values;

    private SourceRow(Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static String normalizeColumnName(String name) {
        return PROPERTY_PREFIX.matcher(name).replaceFirst("");
    }

    /**
     * Name the present columns of a decoded ESE record.
     */
    public static SourceRow fromRecord(TableSchema schema, TableRecord record) {
        var builder = builder();
        for (var entry : record.asMap().int2ObjectEntrySet()) {
            var column = schema.getColumn(entry.getIntKey());
            if (column != null) {
                builder.put(column.getName(), entry.getValue());
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the value, or null if the row has no such column
     */
    public Value get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "SourceRow" + values;
    }

    public static final class Builder {
        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Add a column under its normalized name; a later value for the same name replaces the earlier one.
         */
        public Builder put(String column, Value value) {
            if (value != null) {
                values.put(normalizeColumnName(column), value);
            }
            return this;
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }

        public SourceRow build() {
            return new SourceRow(new LinkedHashMap<>(values));
        }
    }
}
