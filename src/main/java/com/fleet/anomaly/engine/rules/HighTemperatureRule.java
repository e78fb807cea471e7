package com.fleet.anomaly.engine.rules;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.ThresholdRule;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Flags a bucket whose peak motor temperature exceeds the configured maximum.
 */
@Component
public class HighTemperatureRule implements ThresholdRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.HIGH_TEMP;
    }

    @Override
    public boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds) {
        return record.get(FeatureColumns.TEMP_MOTOR_MAX) > thresholds.getTemperatureMax();
    }
}
