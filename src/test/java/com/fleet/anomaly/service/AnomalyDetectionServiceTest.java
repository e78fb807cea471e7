package com.fleet.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.engine.ThresholdRuleEngine;
import com.fleet.anomaly.engine.fusion.ScoreFusion;
import com.fleet.anomaly.engine.isolationforest.UnsupervisedOutlierDetector;
import com.fleet.anomaly.engine.rules.*;
import com.fleet.anomaly.engine.statistical.RobustStatisticalDetector;
import com.fleet.anomaly.exception.FeatureSchemaException;
import com.fleet.anomaly.model.DetectionSummary;
import com.fleet.anomaly.model.FeatureColumns;
import com.fleet.anomaly.model.FeatureRecord;
import com.fleet.anomaly.repository.AnomalyStoreRepository;
import com.fleet.anomaly.repository.FeatureTableRepository;
import com.fleet.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class AnomalyDetectionServiceTest {

    @TempDir
    Path dir;

    private DetectionConfig config;
    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private Path input;
    private Path output;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        input = dir.resolve("features.csv.gz");
        output = dir.resolve("anomalies/anomalies.csv.gz");
        config.getOutput().setSummaryPath(dir.resolve("anomalies/summary.json").toString());
        executor = Executors.newFixedThreadPool(3);
        registry = new SimpleMeterRegistry();
        service = newService(new FeatureTableRepository(), new AnomalyStoreRepository(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AnomalyDetectionService newService(FeatureTableRepository features, AnomalyStoreRepository store) {
        ThresholdRuleEngine ruleEngine = new ThresholdRuleEngine(List.of(
                new HighTemperatureRule(), new TemperatureSpikeRule(), new CurrentInstabilityRule(),
                new LowBatteryRule(), new SpeedJumpRule(), new LowPressureRule()));
        return new AnomalyDetectionService(config, features, store, ruleEngine,
                new RobustStatisticalDetector(), new UnsupervisedOutlierDetector(), new ScoreFusion(),
                executor, new MetricsConfig(registry));
    }

    /**
     * Three units interleaved by time. U1 overheats at minute 10, U2 reports an extreme mean
     * motor temperature at minute 20, U3 has too few moving intervals for the ML layer.
     */
    private List<FeatureRecord> fleet() {
        List<FeatureRecord> u1 = new ArrayList<>(TestDataFactory.unitSeries("U1", 80, 10, 1L));
        List<FeatureRecord> u2 = new ArrayList<>(TestDataFactory.unitSeries("U2", 80, 10, 2L));
        List<FeatureRecord> u3 = TestDataFactory.unitSeries("U3", 40, 10, 3L);
        u1.set(10, TestDataFactory.normalRow("U1", 10, Map.of("temp_motor1_1_max", 130.0)));
        u2.set(20, TestDataFactory.normalRow("U2", 20, Map.of("temp_motor1_1_mean", 200.0)));

        List<FeatureRecord> rows = new ArrayList<>();
        for (int minute = 0; minute < 90; minute++) {
            rows.add(u1.get(minute));
            rows.add(u2.get(minute));
            if (minute < u3.size()) {
                rows.add(u3.get(minute));
            }
        }
        return rows;
    }

    private static List<Map<String, String>> readOutput(Path file) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8))) {
            List<String> lines = reader.lines().collect(Collectors.toList());
            String[] header = lines.get(0).split(",", -1);
            List<Map<String, String>> rows = new ArrayList<>();
            for (String line : lines.subList(1, lines.size())) {
                String[] cells = line.split(",", -1);
                Map<String, String> row = new HashMap<>();
                for (int i = 0; i < header.length; i++) {
                    row.put(header[i], cells[i]);
                }
                rows.add(row);
            }
            return rows;
        }
    }

    private static List<String> readHeader(Path file) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8))) {
            return List.of(reader.readLine().split(",", -1));
        }
    }

    private static Map<String, String> find(List<Map<String, String>> rows, String unitId, int minute) {
        String time = TestDataFactory.bucket(minute).toString();
        return rows.stream()
                .filter(r -> r.get("unit_id").equals(unitId) && r.get("time_bucket").equals(time))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void detect_writesFusedTableInInputOrder() throws Exception {
        List<FeatureRecord> inputRows = fleet();
        TestDataFactory.writeCsv(input, inputRows);

        DetectionSummary summary = service.detect(input, output);

        assertThat(summary.getTotalRecords()).isEqualTo(230);
        assertThat(summary.getUnitCount()).isEqualTo(3);
        assertThat(summary.getSkippedScopes()).containsEntry("ML.INSUFFICIENT_DATA", 1);
        assertThat(summary.getTagCounts()).containsKeys("HIGH_TEMP", "MAD_TEMP_MOTOR1_1_MEAN");
        assertThat(Files.exists(dir.resolve("anomalies/summary.json"))).isTrue();

        List<Map<String, String>> rows = readOutput(output);
        assertThat(rows).hasSize(inputRows.size());
        for (int i = 0; i < rows.size(); i++) {
            assertThat(rows.get(i).get("unit_id")).isEqualTo(inputRows.get(i).getUnitId());
            assertThat(rows.get(i).get("time_bucket")).isEqualTo(inputRows.get(i).getTimeBucket().toString());
        }

        long anomalies = 0;
        for (Map<String, String> row : rows) {
            int flagRule = Integer.parseInt(row.get("flag_rule"));
            int flagMad = Integer.parseInt(row.get("flag_mad"));
            int flagMl = Integer.parseInt(row.get("flag_ml"));
            int score = Integer.parseInt(row.get("score"));
            assertThat(score).isEqualTo(3 * flagRule + 2 * flagMad + flagMl);
            assertThat(row.get("is_anomaly")).isEqualTo(score >= 2 ? "1" : "0");
            assertThat(row.get("tags").isEmpty()).isEqualTo(flagRule + flagMad + flagMl == 0);
            assertThat(row.get("tags")).doesNotStartWith(";").doesNotEndWith(";");
            if (row.get("unit_id").equals("U3") || row.get("pct_moving").startsWith("0")) {
                assertThat(row.get("flag_ml")).isEqualTo("0");
            }
            if (score >= 2) anomalies++;
        }
        assertThat(summary.getAnomalyCount()).isEqualTo(anomalies);

        Map<String, String> overheated = find(rows, "U1", 10);
        assertThat(overheated.get("flag_rule")).isEqualTo("1");
        assertThat(overheated.get("tags")).startsWith("HIGH_TEMP");
        assertThat(overheated.get("is_anomaly")).isEqualTo("1");

        Map<String, String> outlier = find(rows, "U2", 20);
        assertThat(outlier.get("flag_mad")).isEqualTo("1");
        assertThat(outlier.get("tags").split(";")).contains("MAD_TEMP_MOTOR1_1_MEAN");
        assertThat(outlier.get("is_anomaly")).isEqualTo("1");

        assertThat(find(rows, "U1", 0).get("speed_change")).isEmpty();
        assertThat(find(rows, "U1", 1).get("speed_change")).isNotEmpty();

        assertThat(registry.get("detection.records.count").counter().count()).isEqualTo(230.0);
    }

    @Test
    void detect_previousOutputAsInput_columnsNotRepeated() throws Exception {
        TestDataFactory.writeCsv(input, fleet());
        service.detect(input, output);
        Path rerun = dir.resolve("anomalies/rerun.csv.gz");

        service.detect(output, rerun);

        List<String> expected = new ArrayList<>(TestDataFactory.COLUMNS);
        expected.addAll(FeatureColumns.OUTPUT_COLUMNS);
        assertThat(readHeader(rerun)).containsExactlyElementsOf(expected);
        assertThat(readOutput(rerun)).isEqualTo(readOutput(output));
    }

    @Test
    void modelFitFailure_onlyAffectsThatUnit() throws Exception {
        List<FeatureRecord> healthy = new ArrayList<>(TestDataFactory.unitSeries("U1", 80, 0, 7L));
        healthy.add(TestDataFactory.normalRow("U1", 80, Map.of(
                "temp_motor1_1_mean", 140.0,
                "temp_motor2_1_mean", 20.0,
                "current_u_mean", 420.0,
                "current_i_mean", 30.0,
                "battery_volt_mean", 60.0)));
        List<FeatureRecord> rows = new ArrayList<>(healthy);
        // U2 never reports the second motor temperature
        for (FeatureRecord record : TestDataFactory.unitSeries("U2", 80, 0, 8L)) {
            Map<String, Double> values = new LinkedHashMap<>(record.getValues());
            values.put("temp_motor2_1_mean", Double.NaN);
            rows.add(TestDataFactory.row("U2", rows.size() - healthy.size(), values));
        }
        TestDataFactory.writeCsv(input, rows);

        DetectionSummary summary = service.detect(input, output);

        assertThat(summary.getSkippedScopes()).containsEntry("ML.MODEL_FIT_FAILURE", 1);
        List<Map<String, String>> written = readOutput(output);
        assertThat(written).filteredOn(r -> r.get("unit_id").equals("U2"))
                .hasSize(80)
                .allSatisfy(r -> assertThat(r.get("flag_ml")).isEqualTo("0"));
        Map<String, String> outlier = find(written, "U1", 80);
        assertThat(outlier.get("flag_ml")).isEqualTo("1");
        assertThat(outlier.get("tags").split(";")).contains("ML_ISOLATION");
    }

    @Test
    void detect_rerunProducesIdenticalArtifact() throws Exception {
        TestDataFactory.writeCsv(input, fleet());

        service.detect(input, output);
        byte[] first = Files.readAllBytes(output);
        service.detect(input, output);
        byte[] second = Files.readAllBytes(output);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void detect_usesConfiguredPaths() throws Exception {
        TestDataFactory.writeCsv(input, TestDataFactory.unitSeries("U1", 20, 0, 4L));
        config.getInput().setPath(input.toString());
        config.getOutput().setPath(output.toString());

        DetectionSummary summary = service.detect();

        assertThat(summary.getOutputPath()).isEqualTo(output.toString());
        assertThat(readOutput(output)).hasSize(20);
        assertThat(service.getLatestSummary()).contains(summary);
    }

    @Test
    void detect_emptyTableWritesHeaderOnly() throws Exception {
        TestDataFactory.writeCsv(input, List.of());

        DetectionSummary summary = service.detect(input, output);

        assertThat(summary.getTotalRecords()).isZero();
        assertThat(summary.getAnomalyPct()).isZero();
        assertThat(readOutput(output)).isEmpty();
    }

    @Test
    void schemaError_nothingWritten() throws Exception {
        List<String> columns = new ArrayList<>(TestDataFactory.COLUMNS);
        columns.remove("pct_moving");
        TestDataFactory.writeCsv(input, columns, TestDataFactory.unitSeries("U1", 20, 0, 4L));
        AnomalyStoreRepository store = mock(AnomalyStoreRepository.class);
        AnomalyDetectionService withMockStore = newService(new FeatureTableRepository(), store);

        assertThatThrownBy(() -> withMockStore.detect(input, output))
                .isInstanceOf(FeatureSchemaException.class)
                .hasMessageContaining("pct_moving");

        verifyNoInteractions(store);
        assertThat(withMockStore.getLatestSummary()).isEmpty();
    }

    @Test
    void schemaError_previousArtifactKept() throws Exception {
        Files.createDirectories(output.getParent());
        Files.writeString(output, "previous run");
        TestDataFactory.writeText(input, "unit_id,time_bucket\nU1,2024-03-01 08:00:00\n");

        assertThatThrownBy(() -> service.detect(input, output)).isInstanceOf(FeatureSchemaException.class);

        assertThat(Files.readString(output)).isEqualTo("previous run");
    }

    @Test
    void invalidContamination_rejectedBeforeReading() {
        config.getMl().setContamination(0.0);
        FeatureTableRepository features = mock(FeatureTableRepository.class);
        AnomalyDetectionService withMockReader = newService(features, mock(AnomalyStoreRepository.class));

        assertThatThrownBy(() -> withMockReader.detect(input, output))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contamination");

        verifyNoInteractions(features);
    }
}
