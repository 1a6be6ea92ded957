package com.z254.netwatch.sentinel.health;

import com.z254.netwatch.sentinel.alerting.AlertHistory;
import com.z254.netwatch.sentinel.alerting.AlertJournal;
import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.correlation.CorrelationStatistics;
import com.z254.netwatch.sentinel.pipeline.AnomalyPipeline;
import com.z254.netwatch.sentinel.pipeline.SignalIngestionLoop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for SENTINEL.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Ingestion loop state and queue fill</li>
 *     <li>Correlation counters and open windows</li>
 *     <li>Active (unacknowledged) alerts and journal status</li>
 * </ul>
 */
@Slf4j
@Component
public class SentinelHealthIndicator implements ReactiveHealthIndicator {

    private static final double QUEUE_WARNING_RATIO = 0.9;

    private final AnomalyPipeline pipeline;
    private final SignalIngestionLoop ingestionLoop;
    private final AlertHistory alertHistory;
    private final AlertJournal alertJournal;
    private final SentinelProperties properties;

    public SentinelHealthIndicator(AnomalyPipeline pipeline,
                                   SignalIngestionLoop ingestionLoop,
                                   AlertHistory alertHistory,
                                   AlertJournal alertJournal,
                                   SentinelProperties properties) {
        this.pipeline = pipeline;
        this.ingestionLoop = ingestionLoop;
        this.alertHistory = alertHistory;
        this.alertJournal = alertJournal;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean healthy = true;

        // Ingestion loop
        details.put("ingestion.running", ingestionLoop.isRunning());
        int queued = ingestionLoop.getQueuedCount();
        int capacity = properties.getPipeline().getQueueCapacity();
        details.put("ingestion.queued", queued);
        details.put("ingestion.capacity", capacity);
        if (properties.getPipeline().isAutoStart() && !ingestionLoop.isRunning()) {
            healthy = false;
            details.put("ingestion.error", "Ingestion loop not running");
        }
        if (queued >= capacity * QUEUE_WARNING_RATIO) {
            details.put("ingestion.warning", "Inbound queue nearly full");
        }

        // Correlation
        CorrelationStatistics stats = pipeline.getCorrelationStatistics();
        details.put("correlation.openWindows", stats.getOpenWindows());
        details.put("correlation.totalEvents", stats.getTotalEvents());
        details.put("correlation.correlated", stats.getCorrelated());
        details.put("correlation.rate", stats.getCorrelationRate());
        details.put("correlation.multiModalRate", stats.getMultiModalRate());
        details.put("correlation.rejected", stats.getRejected());
        details.put("correlation.lateDropped", stats.getLateDropped());
        details.put("correlation.pendingDropped", stats.getPendingDropped());

        // Alerts
        details.put("alerts.active", alertHistory.getActiveAlerts().size());
        details.put("alerts.journalEnabled", alertJournal.isEnabled());
        details.put("healthModel.available", pipeline.isHealthModelAvailable());

        return healthy
                ? Health.up().withDetails(details).build()
                : Health.down().withDetails(details).build();
    }
}
