package com.fleet.anomaly.engine.rules;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.engine.ThresholdRule;
import com.fleet.anomaly.engine.ThresholdRuleEngine;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Flags a sudden change of mean speed against the unit's previous bucket.
 * The first bucket of a unit has nothing to compare with and never triggers.
 */
@Component
public class SpeedJumpRule implements ThresholdRule {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.SPEED_JUMP;
    }

    @Override
    public boolean isTriggered(FeatureRecord record, FeatureRecord previous, DetectionConfig.Rules thresholds) {
        return ThresholdRuleEngine.speedChange(record, previous) > thresholds.getSpeedJumpMax();
    }
}
