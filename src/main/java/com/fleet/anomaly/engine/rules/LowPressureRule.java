package com.fleet.anomaly.engine.rules;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.ThresholdRule;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

@Component
public class LowPressureRule implements ThresholdRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.LOW_PRESSURE;
    }

    @Override
    public boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds) {
        return record.get(FeatureColumns.PRESSURE_MIN) < thresholds.getPressureMin();
    }
}
