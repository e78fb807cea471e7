package com.fleet.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Run one detection at application startup (batch mode) instead of waiting for the API.
    private boolean runOnStartup = false;

    // Size of the per-unit worker pool. 0 or less = number of available processors.
    private int workerThreads = 0;

    // Separator used when the tag set is written to the output table.
    private String tagDelimiter = ";";

    private Input input = new Input();

    private Output output = new Output();

    private Rules rules = new Rules();

    private Mad mad = new Mad();

    private Ml ml = new Ml();

    public int resolveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Input {
        // CSV feature table, gzip when the name ends in .gz
        private String path = "data/features/features_1min.csv.gz";
        // API callers may only name inputs below this directory
        private String baseDir = "data/features";
        private String unitColumn = "unit_id";
        private String timeColumn = "time_bucket";
    }

    @Data
    public static class Output {
        private String path = "data/anomalies/anomalies.csv.gz";
        // API callers may only name outputs below this directory
        private String baseDir = "data/anomalies";
        // JSON run summary; blank disables it
        private String summaryPath = "data/anomalies/summary.json";
    }

    @Data
    public static class Rules {
        // Motor temperature maximum, degrees C
        private double temperatureMax = 120.0;
        // Absolute motor temperature change per bucket, degrees C
        private double temperatureRateMax = 10.0;
        // Primary current standard deviation within a bucket, A
        private double currentStdMax = 50.0;
        // Battery voltage minimum, V
        private double batteryMin = 90.0;
        // Absolute change of mean speed between consecutive buckets, km/h
        private double speedJumpMax = 30.0;
        // Transformer pressure minimum, bar
        private double pressureMin = 2.0;
    }

    @Data
    public static class Mad {
        private List<String> features = new ArrayList<>(List.of(
                "temp_motor1_1_mean", "current_u_mean", "pressure_tr1_mean"));
        private double zScoreThreshold = 3.5;
        // A (unit, feature) group needs strictly more non-missing values than this
        private int minSamples = 10;
    }

    @Data
    public static class Ml {
        private List<String> features = new ArrayList<>(List.of(
                "temp_motor1_1_mean", "temp_motor2_1_mean", "current_u_mean", "current_i_mean",
                "pressure_tr1_mean", "battery_volt_mean", "avg_speed"));
        // Expected share of outliers among a unit's moving intervals, in (0, 0.5]
        private double contamination = 0.01;
        // Intervals with pct_moving strictly above this are modelled
        private double movingCutoff = 0.5;
        // A unit needs strictly more moving intervals than this
        private int minSamples = 50;
        private int numTrees = 100;
        private int maxSamples = 256;
        private long seed = 42L;
    }
}
