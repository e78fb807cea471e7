package com.fleet.anomaly.service;

import com.fleet.anomaly.exception.FeatureSchemaException;
import com.fleet.anomaly.model.DetectionSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionRunnerTest {

    @Mock
    private AnomalyDetectionService detectionService;

    @InjectMocks
    private DetectionRunner runner;

    @Test
    void run_detectsWithConfiguredPaths() {
        when(detectionService.detect()).thenReturn(DetectionSummary.builder().outputPath("out.csv.gz").build());

        runner.run();

        verify(detectionService).detect();
    }

    @Test
    void run_failurePropagates() {
        when(detectionService.detect()).thenThrow(new FeatureSchemaException("bad table"));

        assertThatThrownBy(() -> runner.run()).isInstanceOf(FeatureSchemaException.class);
    }
}
