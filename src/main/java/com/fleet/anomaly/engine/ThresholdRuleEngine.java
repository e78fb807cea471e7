package com.fleet.anomaly.engine;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.AnomalyTag;
import com.fleet.anomaly.model.DetectionLayer;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.LayerFindings;
import com.fleet.anomaly.model.RuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layer 1: deterministic threshold rules.
 * Uses the Strategy pattern: each RuleType is handled by a registered ThresholdRule.
 * Rules are evaluated in RuleType declaration order, which is also the order of their tags.
 */
@Component
public class ThresholdRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(ThresholdRuleEngine.class);

    private final Map<RuleType, ThresholdRule> ruleMap;

    public ThresholdRuleEngine(List<ThresholdRule> rules) {
        this.ruleMap = new EnumMap<>(RuleType.class);

        for (ThresholdRule rule : rules) {
            ruleMap.put(rule.getSupportedRuleType(), rule);
            log.info("Registered threshold rule: {} -> {}",
                    rule.getSupportedRuleType(), rule.getClass().getSimpleName());
        }
        for (RuleType type : RuleType.values()) {
            if (!ruleMap.containsKey(type)) {
                log.warn("No threshold rule registered for rule type: {}", type);
            }
        }
    }

    /**
     * Evaluate all rules against one row.
     *
     * @param record     the row
     * @param previous   the unit's previous row in time, or null for its first bucket
     * @param thresholds configured limits
     * @return tags of the triggered rules, in rule order; empty when no rule fires
     */
    public Set<AnomalyTag> evaluate(FeatureRecord record, FeatureRecord previous,
                                    DetectionConfig.Rules thresholds) {
        Set<AnomalyTag> tags = new LinkedHashSet<>();
        for (ThresholdRule rule : ruleMap.values()) {
            if (rule.isTriggered(record, previous, thresholds)) {
                tags.add(AnomalyTag.forRule(rule.getSupportedRuleType()));
            }
        }
        return tags;
    }

    /**
     * Evaluate all rules over one unit's rows.
     *
     * @param unitRows rows of a single unit, ordered by time bucket
     */
    public LayerFindings evaluateUnit(List<FeatureRecord> unitRows, DetectionConfig.Rules thresholds) {
        LayerFindings findings = new LayerFindings(DetectionLayer.RULE);
        FeatureRecord previous = null;
        for (FeatureRecord record : unitRows) {
            for (AnomalyTag tag : evaluate(record, previous, thresholds)) {
                findings.addTag(record.getKey(), tag);
            }
            previous = record;
        }
        return findings;
    }

    public List<RuleType> registeredRuleTypes() {
        return new ArrayList<>(ruleMap.keySet());
    }

    /**
     * Absolute change of mean speed against the unit's previous bucket; NaN without a previous
     * bucket or when either value is missing.
     */
    public static double speedChange(FeatureRecord record, FeatureRecord previous) {
        if (previous == null) {
            return Double.NaN;
        }
        return Math.abs(record.get(FeatureColumns.AVG_SPEED) - previous.get(FeatureColumns.AVG_SPEED));
    }
}
