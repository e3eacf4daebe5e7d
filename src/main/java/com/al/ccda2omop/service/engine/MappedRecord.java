package com.al.ccda2omop.service.engine;

import com.al.ccda2omop.model.omop.OmopTable;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One output record of a rule, keyed by OMOP column name.
 */
public final class MappedRecord {

    private final OmopTable table;
    private final String ruleName;
    private final Map<String, FieldValue> values = new LinkedHashMap<>();

    public MappedRecord(OmopTable table, String ruleName) {
        this.table = table;
        this.ruleName = ruleName;
    }

    public OmopTable getTable() {
        return table;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void put(String column, FieldValue value) {
        values.put(column, value);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public FieldValue get(String column) {
        return values.get(column);
    }

    public Long getLong(String column) {
        FieldValue value = values.get(column);
        return value == null ? null : value.asLong();
    }

    public Double getDouble(String column) {
        FieldValue value = values.get(column);
        return value == null ? null : value.asDouble();
    }

    public LocalDateTime getDateTime(String column) {
        FieldValue value = values.get(column);
        return value == null ? null : value.asDateTime();
    }

    /**
     * String view of the column, or null when absent.
     */
    public String getString(String column) {
        FieldValue value = values.get(column);
        return value == null ? null : value.asString();
    }

    public Map<String, FieldValue> getValues() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "MappedRecord{" + table.tableName() + ", " + values + "}";
    }
}
