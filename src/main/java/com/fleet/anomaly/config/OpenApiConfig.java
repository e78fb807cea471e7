package com.fleet.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fleetAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fleet Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection over time-bucketed locomotive sensor aggregates.\n\n" +
                                "**Detection Layers:**\n" +
                                "1. Threshold rules (weight 3): `HIGH_TEMP`, `TEMP_SPIKE`, `CURRENT_UNSTABLE`, " +
                                "`LOW_BATTERY`, `SPEED_JUMP`, `LOW_PRESSURE`\n" +
                                "2. Per-unit robust z-score on median/MAD (weight 2): `MAD_<FEATURE>`\n" +
                                "3. Per-unit Isolation Forest over moving intervals (weight 1): `ML_ISOLATION`\n\n" +
                                "**Verdict:** `score = 3*flag_rule + 2*flag_mad + flag_ml`, anomaly when score >= 2. " +
                                "The ML layer alone never marks a row as anomalous.\n\n" +
                                "Trigger a run with `POST /api/v1/detections/run`; the augmented table is written " +
                                "as gzip CSV to the configured output path.")
                        .contact(new Contact().name("Fleet Analytics Team")));
    }
}
