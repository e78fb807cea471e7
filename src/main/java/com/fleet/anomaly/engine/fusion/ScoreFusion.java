package com.fleet.anomaly.engine.fusion;

import com.fleet.anomaly.model.AnomalyRecord;
import com.fleet.anomaly.model.AnomalyTag;
import com.fleet.anomaly.model.DetectionLayer;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.LayerFindings;
import com.fleet.anomaly.model.RecordKey;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces the three layers' findings for a row into the final verdict.
 *
 * score      = 3 * flag_rule + 2 * flag_mad + 1 * flag_ml   (0..6)
 * is_anomaly = score >= 2
 *
 * So a rule hit or a MAD hit is enough on its own, while an ML hit only counts when
 * corroborated by another layer. Tags are merged rule, statistical, ML; duplicates dropped.
 */
@Component
public class ScoreFusion {

    public static final int ANOMALY_SCORE_THRESHOLD = 2;

    public static int score(int flagRule, int flagMad, int flagMl) {
        return DetectionLayer.RULE.getWeight() * flagRule
                + DetectionLayer.STATISTICAL.getWeight() * flagMad
                + DetectionLayer.ML.getWeight() * flagMl;
    }

    public static boolean isAnomaly(int score) {
        return score >= ANOMALY_SCORE_THRESHOLD;
    }

    /**
     * Fuse the findings of all layers for one row. Findings are looked up by the row's key,
     * so the layers may have processed rows in any order or subset.
     */
    public AnomalyRecord fuse(FeatureRecord record, double speedChange,
                              LayerFindings rule, LayerFindings statistical, LayerFindings ml) {
        RecordKey key = record.getKey();

        Set<AnomalyTag> tags = new LinkedHashSet<>();
        tags.addAll(rule.tagsFor(key));
        tags.addAll(statistical.tagsFor(key));
        tags.addAll(ml.tagsFor(key));

        int flagRule = rule.isFlagged(key) ? 1 : 0;
        int flagMad = statistical.isFlagged(key) ? 1 : 0;
        int flagMl = ml.isFlagged(key) ? 1 : 0;
        int score = score(flagRule, flagMad, flagMl);

        return AnomalyRecord.builder()
                .feature(record)
                .speedChange(speedChange)
                .flagRule(flagRule)
                .flagMad(flagMad)
                .flagMl(flagMl)
                .tags(List.copyOf(tags))
                .score(score)
                .anomaly(isAnomaly(score))
                .build();
    }
}
