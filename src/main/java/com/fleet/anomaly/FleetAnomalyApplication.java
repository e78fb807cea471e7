package com.fleet.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FleetAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetAnomalyApplication.class, args);
    }
}
