package com.fleet.anomaly.engine;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;

/**
 * A single threshold predicate over one feature row.
 * Each implementation handles one {@link RuleType} and contributes at most one tag.
 */
public interface ThresholdRule {

    /**
     * The rule type this predicate implements.
     */
    RuleType getSupportedRuleType();

    /**
     * Evaluate the predicate. Missing (NaN) inputs must never trigger.
     *
     * @param record     the row being evaluated
     * @param previous   the same unit's temporally previous row, or null for its first bucket
     * @param thresholds configured limits
     * @return true when the row violates the limit
     */
    boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds);
}
