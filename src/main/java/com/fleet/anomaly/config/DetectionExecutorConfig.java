package com.fleet.anomaly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DetectionExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(DetectionExecutorConfig.class);

    /**
     * Bounded pool for per-unit detection work. Each task owns one unit's rows.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionConfig config) {
        int threads = config.resolveWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        log.info("Detection worker pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "detection-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
