package com.sidr.mapping;

import lombok.Value;

import java.util.List;

/**
 * Mapping rules of one source table; the first rule whose predicate matches a row wins.
 */
@Value
public class TableMapping {
    String tableName;
    List<MappingRule> rules;

    public TableMapping(String tableName, List<MappingRule> rules) {
        this.tableName = tableName;
        this.rules = List.copyOf(rules);
    }

    public static TableMapping of(String tableName, MappingRule... rules) {
        return new TableMapping(tableName, List.of(rules));
    }
}
