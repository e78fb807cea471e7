package com.fleet.anomaly.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The input feature table: column names in file order and the rows in file order.
 */
public class FeatureTable {

    private final List<String> columns;
    private final List<FeatureRecord> records;

    public FeatureTable(List<String> columns, List<FeatureRecord> records) {
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<FeatureRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    /**
     * Rows per unit, units in order of first appearance, each unit's rows ordered by time bucket.
     */
    public Map<String, List<FeatureRecord>> groupByUnit() {
        Map<String, List<FeatureRecord>> byUnit = new LinkedHashMap<>();
        for (FeatureRecord record : records) {
            byUnit.computeIfAbsent(record.getUnitId(), k -> new ArrayList<>()).add(record);
        }
        byUnit.values().forEach(rows -> rows.sort(Comparator.comparing(FeatureRecord::getTimeBucket)));
        return byUnit;
    }
}
