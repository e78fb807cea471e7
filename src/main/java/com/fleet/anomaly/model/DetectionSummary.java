package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of one detection run over a feature table")
public class DetectionSummary {

    @Schema(description = "Input feature table", example = "data/features/features_1min.csv.gz")
    private String inputPath;

    @Schema(description = "Written anomaly table", example = "data/anomalies/anomalies.csv.gz")
    private String outputPath;

    @Schema(description = "Number of feature rows processed", example = "125000")
    private long totalRecords;

    @Schema(description = "Number of distinct units in the table", example = "12")
    private int unitCount;

    @Schema(description = "Rows with is_anomaly = 1", example = "842")
    private long anomalyCount;

    @Schema(description = "Anomalous rows as a percentage of all rows", example = "0.67")
    private double anomalyPct;

    @Schema(description = "Rows flagged by the threshold rules", example = "510")
    private long ruleFlagged;

    @Schema(description = "Rows flagged by the MAD test", example = "402")
    private long madFlagged;

    @Schema(description = "Rows flagged by the isolation forest", example = "1180")
    private long mlFlagged;

    @Schema(description = "Row count per tag", example = "{\"HIGH_TEMP\": 120, \"ML_ISOLATION\": 1180}")
    private Map<String, Long> tagCounts;

    @Schema(description = "Skipped scopes per layer and reason",
            example = "{\"STATISTICAL.NUMERIC_DEGENERACY\": 2, \"ML.INSUFFICIENT_DATA\": 1}")
    private Map<String, Integer> skippedScopes;

    @Schema(description = "Run start in epoch milliseconds", example = "1739886764000")
    private long startedAt;

    @Schema(description = "Run duration in milliseconds", example = "5230")
    private long durationMs;
}
