package com.sidr.record;

import com.sidr.types.Value;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMaps;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.EqualsAndHashCode;

/**
 * One decoded table row: column identifier to value, in identifier order.
 * <p>
 * A column without an entry is absent from the row (null, empty, or beyond the row's
 * stored column range). Records are immutable; {@link #with(int, Value)} and
 * {@link #without(int)} return modified copies.
 */
@EqualsAndHashCode
public final class TableRecord {
    private final Int2ObjectSortedMap<Value> values;

    TableRecord(Int2ObjectSortedMap<Value> values) {
        this.values = Int2ObjectSortedMaps.unmodifiable(values);
    }

    public static TableRecord empty() {
        return new TableRecord(new Int2ObjectAVLTreeMap<>());
    }

    public static TableRecord of(Int2ObjectSortedMap<Value> values) {
        return new TableRecord(new Int2ObjectAVLTreeMap<>(values));
    }

    /**
     * @return the column value, or null if the column is absent
     */
    public Value get(int columnId) {
        return values.get(columnId);
    }

    public boolean has(int columnId) {
        return values.containsKey(columnId);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public IntSortedSet columnIds() {
        return values.keySet();
    }

    public Int2ObjectSortedMap<Value> asMap() {
        return values;
    }

    public TableRecord with(int columnId, Value value) {
        var copy = new Int2ObjectAVLTreeMap<>(values);
        copy.put(columnId, value);
        return new TableRecord(copy);
    }

    public TableRecord without(int columnId) {
        if (!values.containsKey(columnId)) {
            return this;
        }
        var copy = new Int2ObjectAVLTreeMap<>(values);
        copy.remove(columnId);
        return new TableRecord(copy);
    }

    /**
     * Copy holding only the given columns.
     */
    public TableRecord retain(IntSet columnIds) {
        var copy = new Int2ObjectAVLTreeMap<>(values);
        copy.keySet().retainAll(columnIds);
        return copy.size() == values.size() ? this : new TableRecord(copy);
    }

    @Override
    public String toString() {
        return "TableRecord" + values;
    }
}
