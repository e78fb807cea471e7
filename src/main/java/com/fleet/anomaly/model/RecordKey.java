package com.fleet.anomaly.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Stable identity of a feature row: one unit, one time bucket.
 * Every detection layer reports its findings against this key, never against a row position.
 */
public record RecordKey(String unitId, Instant timeBucket) implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER = Comparator
            .comparing(RecordKey::unitId)
            .thenComparing(RecordKey::timeBucket);

    public RecordKey {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(timeBucket, "timeBucket");
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return unitId + "@" + timeBucket;
    }
}
