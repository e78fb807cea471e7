package com.fleet.anomaly.engine.statistical;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.AnomalyTag;
import com.fleet.anomaly.model.DetectionLayer;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.LayerFindings;
import com.fleet.anomaly.model.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 2: per-unit, per-feature robust outlier test on the modified z-score.
 *
 * For each configured feature of a unit:
 *   - groups with minSamples or fewer non-missing values are skipped (insufficient data)
 *   - groups with MAD = 0 are skipped (degenerate distribution)
 *   - otherwise rows with z > threshold are tagged MAD_&lt;FEATURE&gt;
 * Rows with a missing value are never flagged.
 */
@Component
public class RobustStatisticalDetector {

    private static final Logger log = LoggerFactory.getLogger(RobustStatisticalDetector.class);

    /**
     * @param unitId   unit the rows belong to, for logging
     * @param unitRows all rows of that unit
     */
    public LayerFindings detectUnit(String unitId, List<FeatureRecord> unitRows, DetectionConfig.Mad settings) {
        LayerFindings findings = new LayerFindings(DetectionLayer.STATISTICAL);

        for (String feature : settings.getFeatures()) {
            double[] present = unitRows.stream()
                    .mapToDouble(r -> r.get(feature))
                    .filter(Double::isFinite)
                    .toArray();

            if (present.length <= settings.getMinSamples()) {
                log.debug("Unit {} feature {}: {} samples (need > {}). Skipping MAD test.",
                        unitId, feature, present.length, settings.getMinSamples());
                findings.recordSkip(SkipReason.INSUFFICIENT_DATA);
                continue;
            }

            RobustStatistics stats = RobustStatistics.of(present);
            if (stats.isDegenerate()) {
                log.debug("Unit {} feature {}: MAD is 0 (median={}). Skipping MAD test.",
                        unitId, feature, stats.getMedian());
                findings.recordSkip(SkipReason.NUMERIC_DEGENERACY);
                continue;
            }

            AnomalyTag tag = AnomalyTag.forStatisticalFeature(feature);
            int flagged = 0;
            for (FeatureRecord record : unitRows) {
                double value = record.get(feature);
                if (!Double.isFinite(value)) {
                    continue;
                }
                if (stats.modifiedZScore(value) > settings.getZScoreThreshold()) {
                    findings.addTag(record.getKey(), tag);
                    flagged++;
                }
            }

            if (flagged > 0) {
                log.debug("Unit {} feature {}: median={}, MAD={}, {} rows above z={}",
                        unitId, feature, stats.getMedian(), stats.getMad(), flagged,
                        settings.getZScoreThreshold());
            }
        }

        return findings;
    }
}
