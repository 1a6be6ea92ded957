package com.z254.netwatch.sentinel.observability;

import com.z254.netwatch.sentinel.domain.model.Modality;
import com.z254.netwatch.sentinel.domain.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for SENTINEL.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Signal intake per modality and rejected input</li>
 *     <li>Correlation outcomes (correlated, multi-modal, suppressed)</li>
 *     <li>Alerts by severity, escalations and journal failures</li>
 *     <li>Ingestion loop queue depth and processing latency</li>
 * </ul>
 */
@Component
public class SentinelMetrics {

    private final MeterRegistry meterRegistry;

    // Intake metrics
    @Getter
    private final Counter signalsRejected;
    @Getter
    private final Counter signalsDropped;
    private final Map<Modality, Counter> eventsByModality = new ConcurrentHashMap<>();

    // Correlation metrics
    @Getter
    private final Counter correlatedEvents;
    @Getter
    private final Counter multiModalEvents;
    private final DistributionSummary correlationConfidence;

    // Alert metrics
    @Getter
    private final Counter alertsEscalated;
    @Getter
    private final Counter journalFailures;
    private final Map<Severity, Counter> alertsBySeverity = new ConcurrentHashMap<>();

    // Pipeline metrics
    private final Timer processingLatency;
    private final AtomicInteger queueDepth;

    public SentinelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize intake metrics
        this.signalsRejected = Counter.builder("sentinel.pipeline.rejected")
                .description("Malformed bins and events skipped")
                .register(meterRegistry);
        this.signalsDropped = Counter.builder("sentinel.pipeline.dropped")
                .description("Signals dropped because the inbound queue was full")
                .register(meterRegistry);

        // Initialize correlation metrics
        this.correlatedEvents = Counter.builder("sentinel.correlation.events")
                .description("Correlated events emitted")
                .register(meterRegistry);
        this.multiModalEvents = Counter.builder("sentinel.correlation.multimodal")
                .description("Correlated events confirmed by more than one modality")
                .register(meterRegistry);
        this.correlationConfidence = DistributionSummary.builder("sentinel.correlation.confidence")
                .description("Combined confidence of correlated events")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        // Initialize alert metrics
        this.alertsEscalated = Counter.builder("sentinel.alerts.escalated")
                .description("Alerts requiring escalation")
                .register(meterRegistry);
        this.journalFailures = Counter.builder("sentinel.alerts.journal.failures")
                .description("Alerts that could not be written to the journal")
                .register(meterRegistry);

        // Initialize pipeline metrics
        this.processingLatency = Timer.builder("sentinel.pipeline.latency")
                .description("Time from signal intake to alert decision")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.queueDepth = meterRegistry.gauge("sentinel.pipeline.queue.depth", new AtomicInteger(0));
    }

    // ========== Intake Methods ==========

    public void recordEventIngested(Modality modality) {
        eventsByModality.computeIfAbsent(modality, m ->
                Counter.builder("sentinel.events.ingested")
                        .tag("modality", m.getWireName())
                        .description("Anomaly events ingested by modality")
                        .register(meterRegistry))
                .increment();
    }

    public void recordRejected(String signalType) {
        signalsRejected.increment();
        Counter.builder("sentinel.pipeline.rejected.by_type")
                .tag("signal_type", signalType)
                .register(meterRegistry)
                .increment();
    }

    public void recordDropped() {
        signalsDropped.increment();
    }

    // ========== Correlation Methods ==========

    public void recordCorrelated(boolean multiModal, double combinedConfidence) {
        correlatedEvents.increment();
        if (multiModal) {
            multiModalEvents.increment();
        }
        correlationConfidence.record(combinedConfidence);
    }

    // ========== Alert Methods ==========

    public void recordAlert(Severity severity, boolean escalated) {
        alertsBySeverity.computeIfAbsent(severity, s ->
                Counter.builder("sentinel.alerts.emitted")
                        .tag("severity", s.wireName())
                        .description("Alerts emitted by severity")
                        .register(meterRegistry))
                .increment();
        if (escalated) {
            alertsEscalated.increment();
        }
    }

    public void recordJournalFailure() {
        journalFailures.increment();
    }

    // ========== Pipeline Methods ==========

    public Timer.Sample startProcessingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordProcessed(Timer.Sample sample) {
        sample.stop(processingLatency);
    }

    public void setQueueDepth(int depth) {
        if (queueDepth != null) {
            queueDepth.set(depth);
        }
    }

    public int getQueueDepth() {
        return queueDepth != null ? queueDepth.get() : 0;
    }
}
