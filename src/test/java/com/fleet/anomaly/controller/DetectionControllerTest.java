package com.fleet.anomaly.controller;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.exception.AnomalyStoreException;
import com.fleet.anomaly.exception.FeatureSchemaException;
import com.fleet.anomaly.model.DetectionSummary;
import com.fleet.anomaly.service.AnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectionController.class)
@Import(DetectionConfig.class)
class DetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    private static DetectionSummary summary() {
        return DetectionSummary.builder()
                .inputPath("in.csv.gz")
                .outputPath("out.csv.gz")
                .totalRecords(1200)
                .unitCount(4)
                .anomalyCount(18)
                .anomalyPct(1.5)
                .tagCounts(Map.of("HIGH_TEMP", 6L))
                .skippedScopes(Map.of())
                .build();
    }

    @Test
    void run_defaultPaths() throws Exception {
        when(detectionService.detect(any(Path.class), any(Path.class))).thenReturn(summary());

        mockMvc.perform(post("/api/v1/detections/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(1200))
                .andExpect(jsonPath("$.anomalyCount").value(18))
                .andExpect(jsonPath("$.tagCounts.HIGH_TEMP").value(6));

        verify(detectionService).detect(
                Path.of("data/features/features_1min.csv.gz"), Path.of("data/anomalies/anomalies.csv.gz"));
    }

    @Test
    void run_explicitPaths() throws Exception {
        when(detectionService.detect(any(Path.class), any(Path.class))).thenReturn(summary());

        mockMvc.perform(post("/api/v1/detections/run")
                        .param("input", "2024-03/features.csv")
                        .param("output", "rerun.csv.gz"))
                .andExpect(status().isOk());

        Path inputBase = Path.of("data/features").toAbsolutePath().normalize();
        Path outputBase = Path.of("data/anomalies").toAbsolutePath().normalize();
        verify(detectionService).detect(
                inputBase.resolve("2024-03/features.csv"), outputBase.resolve("rerun.csv.gz"));
    }

    @Test
    void run_outputEscapingBaseDir_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/detections/run")
                        .param("output", "../../home/app/.profile"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("output")));

        verifyNoInteractions(detectionService);
    }

    @Test
    void run_absoluteInputOutsideBaseDir_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/detections/run")
                        .param("input", "/etc/passwd"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(detectionService);
    }

    @Test
    void run_misconfiguredService_serverError() throws Exception {
        when(detectionService.detect(any(Path.class), any(Path.class)))
                .thenThrow(new IllegalStateException("detection.ml.contamination must be in (0, 0.5], got 0.0"));

        mockMvc.perform(post("/api/v1/detections/run"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value(containsString("contamination")));
    }

    @Test
    void run_schemaError_badRequest() throws Exception {
        when(detectionService.detect(any(Path.class), any(Path.class)))
                .thenThrow(new FeatureSchemaException("Feature table is missing required columns: [pct_moving]"));

        mockMvc.perform(post("/api/v1/detections/run"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists())
                .andExpect(jsonPath("$.message").value("Feature table is missing required columns: [pct_moving]"));
    }

    @Test
    void run_storeFailure_serverError() throws Exception {
        when(detectionService.detect(any(Path.class), any(Path.class)))
                .thenThrow(new AnomalyStoreException("Failed to write out.csv.gz", new IOException("disk full")));

        mockMvc.perform(post("/api/v1/detections/run"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void latest_found() throws Exception {
        when(detectionService.getLatestSummary()).thenReturn(Optional.of(summary()));

        mockMvc.perform(get("/api/v1/detections/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unitCount").value(4));
    }

    @Test
    void latest_noRunYet() throws Exception {
        when(detectionService.getLatestSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/detections/latest"))
                .andExpect(status().isNotFound());
    }
}
