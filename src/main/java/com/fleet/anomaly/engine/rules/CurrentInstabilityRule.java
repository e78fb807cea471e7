package com.fleet.anomaly.engine.rules;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.ThresholdRule;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Flags a bucket whose primary current fluctuates more than the configured standard deviation.
 */
@Component
public class CurrentInstabilityRule implements ThresholdRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.CURRENT_UNSTABLE;
    }

    @Override
    public boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds) {
        return record.get(FeatureColumns.CURRENT_STD) > thresholds.getCurrentStdMax();
    }
}
