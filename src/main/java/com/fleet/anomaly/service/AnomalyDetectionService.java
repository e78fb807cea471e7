package com.fleet.anomaly.service;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.engine.ThresholdRuleEngine;
import com.fleet.anomaly.engine.fusion.ScoreFusion;
import com.fleet.anomaly.engine.isolationforest.UnsupervisedOutlierDetector;
import com.fleet.anomaly.engine.statistical.RobustStatisticalDetector;
import com.fleet.anomaly.model.AnomalyRecord;
import com.fleet.anomaly.model.AnomalyTag;
import com.fleet.anomaly.model.DetectionLayer;
import com.fleet.anomaly.model.DetectionSummary;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.model.FeatureTable;
import com.fleet.anomaly.model.LayerFindings;
import com.fleet.anomaly.model.RecordKey;
import com.fleet.anomaly.model.SkipReason;
import com.fleet.anomaly.repository.AnomalyStoreRepository;
import com.fleet.anomaly.repository.FeatureTableRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main orchestrator for a detection run.
 *
 * Flow:
 * 1. Load and validate the feature table (schema errors abort here, before any layer runs)
 * 2. Split rows by unit and run the three layers for each unit on the worker pool
 * 3. Wait for every unit, then merge findings by record key
 * 4. Fuse flags into score / verdict / tags, in input row order
 * 5. Persist the augmented table (all-or-nothing) and the run summary
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionConfig config;
    private final FeatureTableRepository featureTableRepository;
    private final AnomalyStoreRepository anomalyStoreRepository;
    private final ThresholdRuleEngine ruleEngine;
    private final RobustStatisticalDetector statisticalDetector;
    private final UnsupervisedOutlierDetector outlierDetector;
    private final ScoreFusion scoreFusion;
    private final ExecutorService detectionExecutor;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<DetectionSummary> latestSummary = new AtomicReference<>();

    public AnomalyDetectionService(DetectionConfig config,
                                   FeatureTableRepository featureTableRepository,
                                   AnomalyStoreRepository anomalyStoreRepository,
                                   ThresholdRuleEngine ruleEngine,
                                   RobustStatisticalDetector statisticalDetector,
                                   UnsupervisedOutlierDetector outlierDetector,
                                   ScoreFusion scoreFusion,
                                   @Qualifier("detectionExecutor") ExecutorService detectionExecutor,
                                   MetricsConfig metricsConfig) {
        this.config = config;
        this.featureTableRepository = featureTableRepository;
        this.anomalyStoreRepository = anomalyStoreRepository;
        this.ruleEngine = ruleEngine;
        this.statisticalDetector = statisticalDetector;
        this.outlierDetector = outlierDetector;
        this.scoreFusion = scoreFusion;
        this.detectionExecutor = detectionExecutor;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run detection with the configured input and output paths.
     */
    @Observed(name = "detection.run", contextualName = "detect-anomalies")
    public DetectionSummary detect() {
        return detect(Path.of(config.getInput().getPath()), Path.of(config.getOutput().getPath()));
    }

    /**
     * Run detection over one feature table and overwrite the anomaly table at {@code output}.
     * Runs are serialized because they replace the same artifact.
     */
    @Observed(name = "detection.run", contextualName = "detect-anomalies")
    public synchronized DetectionSummary detect(Path input, Path output) {
        long startedAt = System.currentTimeMillis();
        long startNanos = System.nanoTime();
        log.info("=== Starting anomaly detection: input={}, output={} ===", input, output);

        try {
            validateSettings();

            FeatureTable table = featureTableRepository.load(input,
                    config.getInput().getUnitColumn(), config.getInput().getTimeColumn(), requiredColumns());
            Map<String, List<FeatureRecord>> rowsByUnit = table.groupByUnit();

            List<UnitResult> unitResults = detectAllUnits(rowsByUnit);

            // Merge barrier: every unit has finished; combine by record key
            LayerFindings rule = new LayerFindings(DetectionLayer.RULE);
            LayerFindings statistical = new LayerFindings(DetectionLayer.STATISTICAL);
            LayerFindings ml = new LayerFindings(DetectionLayer.ML);
            Map<RecordKey, Double> speedChanges = new HashMap<>(table.size() * 2);
            for (UnitResult result : unitResults) {
                rule.mergeFrom(result.rule());
                statistical.mergeFrom(result.statistical());
                ml.mergeFrom(result.ml());
                speedChanges.putAll(result.speedChanges());
            }

            List<AnomalyRecord> fused = new ArrayList<>(table.size());
            for (FeatureRecord record : table.getRecords()) {
                double speedChange = speedChanges.getOrDefault(record.getKey(), Double.NaN);
                fused.add(scoreFusion.fuse(record, speedChange, rule, statistical, ml));
            }

            anomalyStoreRepository.save(output, table.getColumns(), fused, config.getTagDelimiter());

            long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
            DetectionSummary summary = summarize(input, output, rowsByUnit.size(), fused,
                    List.of(rule, statistical, ml), startedAt, durationMs);

            String summaryPath = config.getOutput().getSummaryPath();
            if (summaryPath != null && !summaryPath.isBlank()) {
                anomalyStoreRepository.saveSummary(Path.of(summaryPath), summary);
            }

            recordMetrics(summary, List.of(rule, statistical, ml));
            metricsConfig.recordRun("success", Duration.ofMillis(durationMs));
            latestSummary.set(summary);
            logSummary(summary);
            return summary;
        } catch (RuntimeException e) {
            metricsConfig.recordRun("failure", Duration.ofNanos(System.nanoTime() - startNanos));
            log.error("Anomaly detection failed for input {}: {}", input, e.getMessage());
            throw e;
        }
    }

    public Optional<DetectionSummary> getLatestSummary() {
        return Optional.ofNullable(latestSummary.get());
    }

    private List<UnitResult> detectAllUnits(Map<String, List<FeatureRecord>> rowsByUnit) {
        List<Callable<UnitResult>> tasks = new ArrayList<>(rowsByUnit.size());
        rowsByUnit.forEach((unitId, rows) -> tasks.add(() -> detectUnit(unitId, rows)));

        List<UnitResult> results = new ArrayList<>(tasks.size());
        try {
            for (Future<UnitResult> future : detectionExecutor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Anomaly detection interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Per-unit detection failed", cause);
        }
        return results;
    }

    /**
     * All three layers for one unit. Runs on a worker thread and touches only this unit's rows.
     */
    private UnitResult detectUnit(String unitId, List<FeatureRecord> unitRows) {
        Map<RecordKey, Double> speedChanges = new HashMap<>();
        FeatureRecord previous = null;
        for (FeatureRecord record : unitRows) {
            speedChanges.put(record.getKey(), ThresholdRuleEngine.speedChange(record, previous));
            previous = record;
        }

        LayerFindings rule = ruleEngine.evaluateUnit(unitRows, config.getRules());
        LayerFindings statistical = statisticalDetector.detectUnit(unitId, unitRows, config.getMad());
        LayerFindings ml = outlierDetector.detectUnit(unitId, unitRows, config.getMl());

        log.debug("Unit {}: {} rows, rule={}, mad={}, ml={}", unitId, unitRows.size(),
                rule.flaggedCount(), statistical.flaggedCount(), ml.flaggedCount());
        return new UnitResult(rule, statistical, ml, speedChanges);
    }

    private Set<String> requiredColumns() {
        Set<String> required = new LinkedHashSet<>(FeatureColumns.RULE_INPUTS);
        required.add(FeatureColumns.PCT_MOVING);
        required.addAll(config.getMad().getFeatures());
        required.addAll(config.getMl().getFeatures());
        return required;
    }

    private void validateSettings() {
        DetectionConfig.Ml ml = config.getMl();
        if (ml.getContamination() <= 0.0 || ml.getContamination() > 0.5) {
            throw new IllegalStateException("detection.ml.contamination must be in (0, 0.5], got "
                    + ml.getContamination());
        }
        if (ml.getNumTrees() <= 0 || ml.getMaxSamples() <= 0) {
            throw new IllegalStateException("detection.ml.num-trees and max-samples must be > 0");
        }
        if (ml.getMinSamples() < 0 || config.getMad().getMinSamples() < 0) {
            throw new IllegalStateException("Minimum sample sizes must be >= 0");
        }
        if (config.getTagDelimiter() == null || config.getTagDelimiter().isEmpty()) {
            throw new IllegalStateException("detection.tag-delimiter must not be empty");
        }
    }

    private DetectionSummary summarize(Path input, Path output, int unitCount, List<AnomalyRecord> fused,
                                       List<LayerFindings> layers, long startedAt, long durationMs) {
        long anomalies = 0;
        Map<String, Long> tagCounts = new TreeMap<>();
        for (AnomalyRecord record : fused) {
            if (record.isAnomaly()) anomalies++;
            for (AnomalyTag tag : record.getTags()) {
                tagCounts.merge(tag.getLabel(), 1L, Long::sum);
            }
        }

        Map<String, Integer> skipped = new LinkedHashMap<>();
        for (LayerFindings layer : layers) {
            for (SkipReason reason : SkipReason.values()) {
                int count = layer.skipCount(reason);
                if (count > 0) {
                    skipped.put(layer.getLayer().name() + "." + reason.name(), count);
                }
            }
        }

        double pct = fused.isEmpty() ? 0.0 : anomalies * 100.0 / fused.size();

        return DetectionSummary.builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .totalRecords(fused.size())
                .unitCount(unitCount)
                .anomalyCount(anomalies)
                .anomalyPct(Math.round(pct * 100.0) / 100.0)
                .ruleFlagged(layers.get(0).flaggedCount())
                .madFlagged(layers.get(1).flaggedCount())
                .mlFlagged(layers.get(2).flaggedCount())
                .tagCounts(tagCounts)
                .skippedScopes(skipped)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .build();
    }

    private void recordMetrics(DetectionSummary summary, List<LayerFindings> layers) {
        metricsConfig.recordRecords(summary.getTotalRecords(), summary.getAnomalyCount());
        for (LayerFindings layer : layers) {
            metricsConfig.recordLayerFlags(layer.getLayer(), layer.flaggedCount());
            for (SkipReason reason : SkipReason.values()) {
                int count = layer.skipCount(reason);
                if (count > 0) {
                    metricsConfig.recordSkips(layer.getLayer(), reason, count);
                }
            }
        }
    }

    private void logSummary(DetectionSummary summary) {
        log.info("=== Anomaly detection complete in {} ms ===", summary.getDurationMs());
        log.info("  Total records:      {}", summary.getTotalRecords());
        log.info("  Units:              {}", summary.getUnitCount());
        log.info("  Anomalies detected: {} ({}%)", summary.getAnomalyCount(), summary.getAnomalyPct());
        log.info("  Rule-based:         {}", summary.getRuleFlagged());
        log.info("  Statistical (MAD):  {}", summary.getMadFlagged());
        log.info("  ML (Isolation):     {}", summary.getMlFlagged());
        summary.getTagCounts().forEach((tag, count) -> log.info("    {}: {}", tag, count));
        if (!summary.getSkippedScopes().isEmpty()) {
            log.info("  Skipped scopes:     {}", summary.getSkippedScopes());
        }
    }

    private record UnitResult(LayerFindings rule, LayerFindings statistical, LayerFindings ml,
                              Map<RecordKey, Double> speedChanges) {}
}
