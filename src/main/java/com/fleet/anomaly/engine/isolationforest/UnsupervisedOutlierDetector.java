package com.fleet.anomaly.engine.isolationforest;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.AnomalyTag;
import com.fleet.anomaly.model.DetectionLayer;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.LayerFindings;
import com.fleet.anomaly.model.RecordKey;
import com.fleet.anomaly.model.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3: per-unit Isolation Forest over the unit's moving intervals.
 *
 * The IF model catches multi-dimensional anomalies, where each feature is individually
 * borderline-normal but the combination is rare. Stationary intervals are excluded from
 * both fitting and scoring, so they never receive an ML flag.
 *
 * A model is trained per unit on that unit's standardized data, used to score the same rows,
 * and discarded. A failure for one unit is logged and only removes that unit's ML findings.
 */
@Component
public class UnsupervisedOutlierDetector {

    private static final Logger log = LoggerFactory.getLogger(UnsupervisedOutlierDetector.class);

    public LayerFindings detectUnit(String unitId, List<FeatureRecord> unitRows, DetectionConfig.Ml settings) {
        LayerFindings findings = new LayerFindings(DetectionLayer.ML);

        List<FeatureRecord> moving = unitRows.stream()
                .filter(r -> r.get(FeatureColumns.PCT_MOVING) > settings.getMovingCutoff())
                .toList();

        if (moving.size() <= settings.getMinSamples()) {
            log.debug("Unit {} has {} moving intervals (need > {}). Skipping IF layer.",
                    unitId, moving.size(), settings.getMinSamples());
            findings.recordSkip(SkipReason.INSUFFICIENT_DATA);
            return findings;
        }

        List<RecordKey> outliers;
        try {
            outliers = fitAndPredict(moving, settings);
        } catch (RuntimeException e) {
            log.error("Isolation Forest failed for unit {}: {}. Skipping IF layer for this unit.",
                    unitId, e.getMessage(), e);
            findings.recordSkip(SkipReason.MODEL_FIT_FAILURE);
            return findings;
        }

        for (RecordKey key : outliers) {
            findings.addTag(key, AnomalyTag.ML_ISOLATION);
        }
        log.debug("Unit {}: IF flagged {} of {} moving intervals", unitId, outliers.size(), moving.size());
        return findings;
    }

    private List<RecordKey> fitAndPredict(List<FeatureRecord> moving, DetectionConfig.Ml settings) {
        double[][] data = FeatureExtractor.extract(moving, settings.getFeatures());

        IsolationForest forest = new IsolationForest();
        forest.train(data, settings.getNumTrees(), settings.getMaxSamples(), settings.getSeed());

        double[] scores = forest.anomalyScores(data);
        double cutoff = IsolationForest.scoreCutoff(scores, settings.getContamination());

        List<RecordKey> outliers = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (!Double.isFinite(scores[i])) {
                throw new IllegalStateException("Non-finite anomaly score at moving row " + i);
            }
            if (scores[i] > cutoff) {
                outliers.add(moving.get(i).getKey());
            }
        }
        return outliers;
    }
}
