package com.fleet.anomaly.controller;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.exception.InvalidDetectionRequestException;
import com.fleet.anomaly.model.DetectionSummary;
import com.fleet.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Run multi-layer anomaly detection over a feature table")
public class DetectionController {

    private final AnomalyDetectionService detectionService;
    private final DetectionConfig config;

    public DetectionController(AnomalyDetectionService detectionService, DetectionConfig config) {
        this.detectionService = detectionService;
        this.config = config;
    }

    @Operation(summary = "Run detection",
            description = "Reads the feature table, runs threshold rules, the per-unit MAD test and the per-unit " +
                    "isolation forest, fuses the flags and overwrites the anomaly table. Paths default to the configured ones.")
    @PostMapping("/run")
    public ResponseEntity<DetectionSummary> run(
            @Parameter(description = "Feature table to read, relative to detection.input.base-dir",
                    example = "features_1min.csv.gz")
            @RequestParam(required = false) String input,
            @Parameter(description = "Anomaly table to write, relative to detection.output.base-dir",
                    example = "anomalies.csv.gz")
            @RequestParam(required = false) String output) {

        Path inputPath = input != null
                ? confine(config.getInput().getBaseDir(), input, "input")
                : Path.of(config.getInput().getPath());
        Path outputPath = output != null
                ? confine(config.getOutput().getBaseDir(), output, "output")
                : Path.of(config.getOutput().getPath());
        return ResponseEntity.ok(detectionService.detect(inputPath, outputPath));
    }

    /**
     * Resolve a caller-supplied path below {@code baseDir}; anything escaping it is rejected.
     */
    private static Path confine(String baseDir, String requested, String name) {
        Path base = Path.of(baseDir).toAbsolutePath().normalize();
        Path resolved;
        try {
            resolved = base.resolve(requested).normalize();
        } catch (InvalidPathException e) {
            throw new InvalidDetectionRequestException("Invalid " + name + " path: " + requested);
        }
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new InvalidDetectionRequestException(
                    "The " + name + " path must stay inside " + baseDir + ": " + requested);
        }
        return resolved;
    }

    @Operation(summary = "Get latest run summary",
            description = "Returns the summary of the most recent successful run in this process.")
    @GetMapping("/latest")
    public ResponseEntity<DetectionSummary> latest() {
        return detectionService.getLatestSummary()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
