package com.z254.netwatch.sentinel.pipeline;

import com.z254.netwatch.sentinel.alerting.AlertAssembler;
import com.z254.netwatch.sentinel.alerting.AlertHistory;
import com.z254.netwatch.sentinel.alerting.AlertJournal;
import com.z254.netwatch.sentinel.correlation.CorrelationStatistics;
import com.z254.netwatch.sentinel.correlation.EventCorrelator;
import com.z254.netwatch.sentinel.detection.HealthAnomalyAdapter;
import com.z254.netwatch.sentinel.detection.OutlierClassifier;
import com.z254.netwatch.sentinel.detection.RoutingAnomalyDetector;
import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import com.z254.netwatch.sentinel.domain.model.FeatureBin;
import com.z254.netwatch.sentinel.domain.model.FeatureVector;
import com.z254.netwatch.sentinel.domain.model.TriageResult;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import com.z254.netwatch.sentinel.observability.SentinelMetrics;
import com.z254.netwatch.sentinel.observability.SentinelStructuredLogger;
import com.z254.netwatch.sentinel.triage.TopologyTriage;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates detection, correlation, triage and alert assembly.
 * <p>
 * Every entry point returns the alerts it produced. Alerts are also recorded in the
 * {@link AlertHistory}, appended to the {@link AlertJournal} and published on {@link #alerts()}.
 * Malformed input is logged, counted and skipped.
 */
@Slf4j
@Component
public class AnomalyPipeline {

    private final RoutingAnomalyDetector routingDetector;
    private final HealthAnomalyAdapter healthAdapter;
    private final EventCorrelator correlator;
    private final TopologyTriage triage;
    private final AlertAssembler assembler;
    private final AlertHistory history;
    private final AlertJournal journal;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger logger;

    private final Sinks.Many<Alert> alertSink = Sinks.many().multicast().directBestEffort();

    public AnomalyPipeline(RoutingAnomalyDetector routingDetector,
                           ObjectProvider<OutlierClassifier> outlierClassifier,
                           EventCorrelator correlator,
                           TopologyTriage triage,
                           AlertAssembler assembler,
                           AlertHistory history,
                           AlertJournal journal,
                           SentinelMetrics metrics,
                           SentinelStructuredLogger logger) {
        this.routingDetector = routingDetector;
        OutlierClassifier classifier = outlierClassifier.getIfAvailable();
        this.healthAdapter = classifier != null ? new HealthAnomalyAdapter(classifier) : null;
        this.correlator = correlator;
        this.triage = triage;
        this.assembler = assembler;
        this.history = history;
        this.journal = journal;
        this.metrics = metrics;
        this.logger = logger;
        if (healthAdapter == null) {
            log.info("No OutlierClassifier bean present; health samples will be ignored");
        }
    }

    /**
     * Correlate a pre-scored anomaly event.
     */
    public synchronized List<Alert> process(AnomalyEvent event) {
        Timer.Sample sample = metrics.startProcessingTimer();
        try {
            Optional<CorrelatedEvent> confirmed = correlator.ingest(event);
            metrics.recordEventIngested(event.getModality());

            List<CorrelatedEvent> emitted = new ArrayList<>(correlator.drainClosed());
            confirmed.ifPresent(emitted::add);
            return publish(emitted);
        } catch (InvalidSignalException e) {
            reject(e);
            return List.of();
        } finally {
            metrics.recordProcessed(sample);
        }
    }

    /**
     * Run a routing feature bin through discord detection and correlate the resulting event.
     */
    public synchronized List<Alert> processRoutingBin(FeatureBin bin) {
        Optional<AnomalyEvent> event;
        try {
            event = routingDetector.process(bin);
        } catch (InvalidSignalException e) {
            correlator.recordRejected();
            reject(e);
            return List.of();
        }
        return event.map(this::process).orElseGet(List::of);
    }

    /**
     * Score a device-health sample with the outlier model and correlate the resulting event.
     */
    public synchronized List<Alert> processHealthSample(FeatureVector sample) {
        if (healthAdapter == null) {
            log.debug("Ignoring health sample for {}: no outlier classifier configured",
                    sample != null ? sample.getDevice() : null);
            return List.of();
        }
        Optional<AnomalyEvent> event;
        try {
            event = healthAdapter.adapt(sample);
        } catch (InvalidSignalException e) {
            correlator.recordRejected();
            reject(e);
            return List.of();
        }
        return event.map(this::process).orElseGet(List::of);
    }

    /**
     * Close correlation windows that ended before {@code now} (epoch seconds).
     */
    public synchronized List<Alert> expire(double now) {
        List<CorrelatedEvent> emitted = new ArrayList<>(correlator.drainClosed());
        emitted.addAll(correlator.expire(now));
        return publish(emitted);
    }

    /**
     * Close every open window; called on shutdown.
     */
    public synchronized List<Alert> flush() {
        return publish(correlator.flush());
    }

    /**
     * Hot stream of alerts; subscribers only see alerts emitted after subscribing.
     */
    public Flux<Alert> alerts() {
        return alertSink.asFlux();
    }

    public CorrelationStatistics getCorrelationStatistics() {
        return correlator.getStatistics();
    }

    public boolean isHealthModelAvailable() {
        return healthAdapter != null;
    }

    // ========== Private Methods ==========

    private List<Alert> publish(List<CorrelatedEvent> events) {
        List<Alert> alerts = new ArrayList<>();
        for (CorrelatedEvent event : events) {
            try {
                alerts.add(toAlert(event));
            } catch (RuntimeException e) {
                log.error("Failed to build alert for correlation {}: {}", event.getId(), e.getMessage(), e);
            }
        }
        return alerts;
    }

    private Alert toAlert(CorrelatedEvent event) {
        metrics.recordCorrelated(event.isMultiModal(), event.getCombinedConfidence());
        logger.logCorrelation(event, correlationEventType(event));

        TriageResult result = triage.analyze(event);
        Alert alert = assembler.assemble(event, result);

        history.record(alert);
        journal.append(alert);
        metrics.recordAlert(alert.getSeverity(), alert.isEscalationRequired());
        logger.logAlert(alert);

        Sinks.EmitResult emitResult = alertSink.tryEmitNext(alert);
        if (emitResult.isFailure() && emitResult != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Alert {} not delivered to stream subscribers: {}", alert.getAlertId(), emitResult);
        }
        return alert;
    }

    private static SentinelStructuredLogger.CorrelationEventType correlationEventType(CorrelatedEvent event) {
        if (!event.isMultiModal()) {
            return SentinelStructuredLogger.CorrelationEventType.CLOSED;
        }
        return event.getRevision() > 1
                ? SentinelStructuredLogger.CorrelationEventType.REVISED
                : SentinelStructuredLogger.CorrelationEventType.CONFIRMED;
    }

    private void reject(InvalidSignalException e) {
        metrics.recordRejected(e.getSignalType());
        logger.logRejected(e.getSignalType(), e.getMessage());
    }
}
