package com.fleet.anomaly.config;

import com.fleet.anomaly.model.DetectionLayer;
import com.fleet.anomaly.model.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong lastRunAnomalies;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunAnomalies = registry.gauge("detection.last_run.anomalies", new AtomicLong(0));
    }

    public void recordRun(String outcome, Duration duration) {
        Timer.builder("detection.run.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordRecords(long total, long anomalies) {
        Counter.builder("detection.records.count")
                .register(registry)
                .increment(total);
        Counter.builder("detection.anomalies.count")
                .register(registry)
                .increment(anomalies);
        lastRunAnomalies.set(anomalies);
    }

    public void recordLayerFlags(DetectionLayer layer, long flaggedRows) {
        Counter.builder("detection.layer.flagged.count")
                .tag("layer", layer.name())
                .register(registry)
                .increment(flaggedRows);
    }

    public void recordSkips(DetectionLayer layer, SkipReason reason, long count) {
        Counter.builder("detection.layer.skipped.count")
                .tag("layer", layer.name())
                .tag("reason", reason.name())
                .register(registry)
                .increment(count);
    }
}
