package com.fleet.anomaly.engine.rules;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.ThresholdRule;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Flags a rapid motor temperature change between consecutive buckets of a unit.
 *
 * The rate column is derived upstream as the difference to the previous bucket, so it is
 * missing for a unit's first bucket and that bucket never triggers.
 */
@Component
public class TemperatureSpikeRule implements ThresholdRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.TEMP_SPIKE;
    }

    @Override
    public boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds) {
        if (previous == null) {
            return false;
        }
        return Math.abs(record.get(FeatureColumns.TEMP_MOTOR_RATE)) > thresholds.getTemperatureRateMax();
    }
}
