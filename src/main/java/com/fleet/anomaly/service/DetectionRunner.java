package com.fleet.anomaly.service;

import com.fleet.anomaly.model.DetectionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch entry point: runs one detection over the configured paths at startup.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=batch
 *
 * A failed run propagates out of {@link #run}, so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(prefix = "detection", name = "run-on-startup", havingValue = "true")
public class DetectionRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunner.class);

    private final AnomalyDetectionService detectionService;

    public DetectionRunner(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Override
    public void run(String... args) {
        log.info("Running startup anomaly detection");
        DetectionSummary summary = detectionService.detect();
        log.info("Startup detection wrote {} ({} anomalies in {} records)",
                summary.getOutputPath(), summary.getAnomalyCount(), summary.getTotalRecords());
    }
}
