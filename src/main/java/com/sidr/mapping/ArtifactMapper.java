package com.sidr.mapping;

import com.sidr.types.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interprets a set of {@link TableMapping}s: turns source rows into report records and
 * recovers the host name the store was indexed on.
 */
public final class ArtifactMapper {
    public static final String HOSTNAME_COLUMN = "System_ComputerName";

    private final Map<String, TableMapping> tables;
    private final Map<ReportKind, List<String>> fieldsByKind;

    public ArtifactMapper(List<TableMapping> mappings) {
        var byName = new LinkedHashMap<String, TableMapping>();
        var fields = new EnumMap<ReportKind, Set<String>>(ReportKind.class);
        for (var mapping : mappings) {
            if (byName.putIfAbsent(mapping.getTableName(), mapping) != null) {
                throw new IllegalArgumentException("Duplicate mapping for table " + mapping.getTableName());
            }
            for (var rule : mapping.getRules()) {
                var kindFields = fields.computeIfAbsent(rule.getKind(), kind -> new LinkedHashSet<>());
                for (var field : rule.getFields()) {
                    kindFields.add(field.getField());
                }
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
        var declared = new EnumMap<ReportKind, List<String>>(ReportKind.class);
        fields.forEach((kind, names) -> declared.put(kind, List.copyOf(names)));
        this.fieldsByKind = Collections.unmodifiableMap(declared);
    }

    public boolean handles(String tableName) {
        return tables.containsKey(tableName);
    }

    public Set<String> getTableNames() {
        return tables.keySet();
    }

    /**
     * Report kinds some rule can produce, in enum order.
     */
    public Set<ReportKind> getReportKinds() {
        return fieldsByKind.keySet();
    }

    /**
     * Every field any rule of the given kind can set, in first-declared order.
     */
    public List<String> declaredFields(ReportKind kind) {
        return fieldsByKind.getOrDefault(kind, List.of());
    }

    /**
     * Map one row. The first rule of the table whose predicate accepts the row decides the
     * report kind; fields whose transform yields nothing are left out.
     *
     * @return the report record, or null if the table is unknown or no rule matches
     */
    public ReportRecord map(String tableName, SourceRow row) {
        var mapping = tables.get(tableName);
        if (mapping == null) {
            return null;
        }
        for (var rule : mapping.getRules()) {
            if (rule.getPredicate().test(row)) {
                return apply(rule, row);
            }
        }
        return null;
    }

    private static ReportRecord apply(MappingRule rule, SourceRow row) {
        var fields = new LinkedHashMap<String, Value>();
        for (var field : rule.getFields()) {
            var source = row.get(field.getColumn());
            if (source == null) {
                continue;
            }
            var value = field.getTransform().apply(source);
            if (value != null) {
                fields.put(field.getField(), value);
            }
        }
        return new ReportRecord(rule.getKind(), fields);
    }

    /**
     * @return the host name recorded in the row, or null if it has none
     */
    public static String hostname(SourceRow row) {
        var value = ValueTransform.TEXT.apply(row.get(HOSTNAME_COLUMN));
        if (value == null) {
            return null;
        }
        var name = value.asObject().toString().trim();
        return name.isEmpty() ? null : name;
    }
}
