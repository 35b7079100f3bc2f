package com.sidr.mapping;

import lombok.Value;

import java.util.List;

/**
 * Rows of a table matching {@link #getPredicate()} become records of {@link #getKind()}
 * carrying the listed fields, in order.
 */
@Value
public class MappingRule {
    ReportKind kind;
    RowPredicate predicate;
    List<FieldMapping> fields;

    public MappingRule(ReportKind kind, RowPredicate predicate, List<FieldMapping> fields) {
        this.kind = kind;
        this.predicate = predicate;
        this.fields = List.copyOf(fields);
    }
}
