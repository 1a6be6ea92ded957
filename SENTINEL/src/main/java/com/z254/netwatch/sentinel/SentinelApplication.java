package com.z254.netwatch.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SENTINEL: multi-modal network anomaly correlation and alerting.
 * <p>
 * Consumes routing feature bins, device-health samples and pre-scored anomaly events,
 * correlates them per device across modalities and emits prioritized, topology-aware alerts.
 */
@SpringBootApplication
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
