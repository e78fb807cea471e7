package com.fleet.anomaly.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A feature row augmented with the fused verdict of all detection layers.
 * Built fresh for every run; never updated in place.
 */
@Getter
@Builder
@ToString(exclude = "feature")
public class AnomalyRecord {

    private final FeatureRecord feature;

    // |avg_speed - previous avg_speed| for the unit, NaN for its first bucket
    private final double speedChange;

    private final int flagRule;

    private final int flagMad;

    private final int flagMl;

    private final List<AnomalyTag> tags;

    private final int score;

    private final boolean anomaly;

    public RecordKey getKey() {
        return feature.getKey();
    }

    public String tagString(String delimiter) {
        return tags.stream()
                .map(AnomalyTag::getLabel)
                .collect(Collectors.joining(delimiter));
    }
}
