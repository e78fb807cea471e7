package com.fleet.anomaly.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Label attached to a row for one triggered condition. Tags are kept as typed values while
 * the layers run and only turn into a delimited string when the output table is written.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AnomalyTag {

    public static final AnomalyTag ML_ISOLATION = new AnomalyTag(DetectionLayer.ML, "ML_ISOLATION");

    private final DetectionLayer layer;

    private final String label;

    public static AnomalyTag forRule(RuleType ruleType) {
        return new AnomalyTag(DetectionLayer.RULE, ruleType.name());
    }

    public static AnomalyTag forStatisticalFeature(String feature) {
        return new AnomalyTag(DetectionLayer.STATISTICAL, "MAD_" + feature.toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return label;
    }
}
