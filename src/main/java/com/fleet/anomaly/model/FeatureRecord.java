package com.fleet.anomaly.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * One row of the input feature table: the aggregates of one unit over one time bucket.
 *
 * {@code columns} keeps every raw cell in input column order so the row can be written back
 * unchanged; {@code values} holds the parsed numeric cells, with missing cells stored as NaN.
 */
@Getter
@Builder
@ToString(of = {"unitId", "timeBucket"})
@EqualsAndHashCode
public class FeatureRecord {

    private final String unitId;

    private final Instant timeBucket;

    @Singular
    private final Map<String, String> columns;

    @Singular
    private final Map<String, Double> values;

    public RecordKey getKey() {
        return new RecordKey(unitId, timeBucket);
    }

    /**
     * Numeric value of a feature, or NaN when the cell is missing or the column is absent.
     */
    public double get(String feature) {
        Double value = values.get(feature);
        return value == null ? Double.NaN : value;
    }

    public boolean isMissing(String feature) {
        return Double.isNaN(get(feature));
    }
}
