package com.fleet.anomaly.engine.rules;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.ThresholdRule;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Flags a bucket whose battery voltage dropped below the configured minimum.
 */
@Component
public class LowBatteryRule implements ThresholdRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.LOW_BATTERY;
    }

    @Override
    public boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds) {
        return record.get(FeatureColumns.BATTERY_VOLT_MIN) < thresholds.getBatteryMin();
    }
}
