package com.z254.netwatch.sentinel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the SENTINEL service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Discord detection and multi-series fusion</li>
 *     <li>Cross-modal correlation windows</li>
 *     <li>Topology tables and triage scoring</li>
 *     <li>Alert journal and ingestion loop</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private final Detector detector = new Detector();
    private final Fusion fusion = new Fusion();
    private final Correlation correlation = new Correlation();
    private final Topology topology = new Topology();
    private final Triage triage = new Triage();
    private final Alerting alerting = new Alerting();
    private final Pipeline pipeline = new Pipeline();

    /**
     * Per-series discord detection.
     */
    @Data
    public static class Detector {
        /** Subsequence length in bins */
        @Min(4)
        private int windowSize = 32;

        /** Buffer capacity multiplier; capacity never drops below 2 * windowSize + 2 */
        @Min(2)
        private int bufferFactor = 3;

        /** Score above which a window is a discord */
        @Positive
        private double threshold = 2.5;

        private StrategyMode strategy = StrategyMode.AUTO;

        /** Upper bound on distinct series tracked by one detector */
        @Positive
        private int maxSeries = 64;

        /** Routing series fed from every feature bin */
        private List<String> seriesKeys = new ArrayList<>(List.of("wdr_total", "ann_total", "as_path_churn"));

        /** Device reported when a bin carries no per-peer breakdown */
        @NotBlank
        private String collectorDevice = "bgp-collector";
    }

    /**
     * Weighted fusion of discord scores.
     */
    @Data
    public static class Fusion {
        private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
                "wdr_total", 0.5,
                "ann_total", 0.3,
                "as_path_churn", 0.2));

        /** Weight of series missing from the table */
        private double defaultWeight = 0.1;

        @Positive
        private double threshold = 1.0;
    }

    /**
     * Cross-modal correlation.
     */
    @Data
    public static class Correlation {
        private Duration window = Duration.ofSeconds(60);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minCorrelationConfidence = 0.5;

        /** Applied to the best confidence of a window without cross-modal agreement */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double singleModalityDiscount = 0.6;

        @Positive
        private int maxEventsPerDevice = 256;

        @Positive
        private int maxTrackedDevices = 10_000;

        @Positive
        private int maxPendingEmissions = 1_000;
    }

    /**
     * Static topology tables, loaded once at startup.
     */
    @Data
    public static class Topology {
        /** device name -> role name */
        private Map<String, String> devices = new LinkedHashMap<>();

        /** role name -> policy; roles missing here use built-in defaults */
        private Map<String, RolePolicyProperties> rolePolicies = new HashMap<>();
    }

    @Data
    public static class RolePolicyProperties {
        private double criticalityBase;
        private double blastRadiusMultiplier = 1.0;
        private List<String> affectedServices = new ArrayList<>();
    }

    /**
     * Triage scoring.
     */
    @Data
    public static class Triage {
        /** Affected-device count at which a multi-role blast radius becomes network impacting */
        @Positive
        private int networkImpactingDeviceThreshold = 10;

        private Duration p1SlaWindow = Duration.ofMinutes(15);

        private Duration p2SlaWindow = Duration.ofMinutes(60);

        @Min(1)
        private int maxRankedPredictions = 5;
    }

    /**
     * Alert output.
     */
    @Data
    public static class Alerting {
        private boolean journalEnabled = false;

        private String journalPath = "data/alerts/alerts_log.jsonl";

        @Positive
        private int historySize = 1_000;
    }

    /**
     * Stream ingestion loop.
     */
    @Data
    public static class Pipeline {
        private boolean autoStart = true;

        @Positive
        private int queueCapacity = 10_000;

        /** Interval of the window-expiry tick */
        private Duration sweepInterval = Duration.ofSeconds(5);

        /** Upper bound on draining the queue at shutdown */
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    /**
     * Discord algorithm selection.
     */
    public enum StrategyMode {
        /** Matrix profile with z-score fallback */
        AUTO,
        /** Same as AUTO, named explicitly */
        MATRIX_PROFILE,
        /** Z-score only */
        ROLLING_ZSCORE
    }
}
