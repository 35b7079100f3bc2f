package com.sidr.mapping;

import com.sidr.types.Value;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named report fields of one artifact, in declaration order. Values are text or integers.
 */
@Getter
public final class ReportRecord {
    private final ReportKind kind;
    private final Map<String, Value> fields;

    ReportRecord(ReportKind kind, Map<String, Value> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Value get(String field) {
        return fields.get(field);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public String toString() {
        return kind + fields.toString();
    }
}
