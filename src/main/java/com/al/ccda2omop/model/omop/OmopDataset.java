package com.al.ccda2omop.model.omop;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rows for every OMOP table, each list in insertion order.
 */
public class OmopDataset {

    private final Map<OmopTable, List<OmopRow>> rows = new EnumMap<>(OmopTable.class);

    public OmopDataset() {
        for (OmopTable table : OmopTable.values()) {
            rows.put(table, new ArrayList<>());
        }
    }

    public void add(OmopRow row) {
        rows.get(row.table()).add(row);
    }

    /**
     * Append all rows of another dataset, table by table.
     */
    public void addAll(OmopDataset other) {
        for (OmopTable table : OmopTable.values()) {
            rows.get(table).addAll(other.rows.get(table));
        }
    }

    public List<OmopRow> rows(OmopTable table) {
        return Collections.unmodifiableList(rows.get(table));
    }

    /**
     * Typed view of one table's rows.
     */
    public <T extends OmopRow> List<T> rows(OmopTable table, Class<T> type) {
        List<T> typed = new ArrayList<>();
        for (OmopRow row : rows.get(table)) {
            typed.add(type.cast(row));
        }
        return typed;
    }

    public int count(OmopTable table) {
        return rows.get(table).size();
    }

    public int totalCount() {
        return rows.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Stamp every row with the document it came from.
     */
    public OmopDataset withSourceFile(String sourceFile) {
        rows.values().forEach(list -> list.forEach(row -> row.setSourceFile(sourceFile)));
        return this;
    }
}
