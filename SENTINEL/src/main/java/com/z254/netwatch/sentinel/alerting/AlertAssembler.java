package com.z254.netwatch.sentinel.alerting;

import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.BlastRadius;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import com.z254.netwatch.sentinel.domain.model.Location;
import com.z254.netwatch.sentinel.domain.model.Modality;
import com.z254.netwatch.sentinel.domain.model.Priority;
import com.z254.netwatch.sentinel.domain.model.RecommendedAction;
import com.z254.netwatch.sentinel.domain.model.Severity;
import com.z254.netwatch.sentinel.domain.model.TriageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the final operator alert from a correlated event and its triage.
 * <p>
 * Everything except the alert id is a pure function of the two inputs.
 */
@Slf4j
@Component
public class AlertAssembler {

    private static final int MAX_FEATURES_PER_LINE = 3;
    private static final int MAX_DOWNSTREAM_LISTED = 3;

    private final AlertIdGenerator idGenerator;
    private final RootCauseCatalog rootCauseCatalog;
    private final ActionPlaybook actionPlaybook;

    public AlertAssembler(AlertIdGenerator idGenerator,
                          RootCauseCatalog rootCauseCatalog,
                          ActionPlaybook actionPlaybook) {
        this.idGenerator = idGenerator;
        this.rootCauseCatalog = rootCauseCatalog;
        this.actionPlaybook = actionPlaybook;
    }

    public Alert assemble(CorrelatedEvent event, TriageResult triage) {
        Location location = triage.getLocation();
        Priority priority = triage.getCriticality().getPriority();
        Severity severity = triage.getSeverity();

        FailureCategory category = rootCauseCatalog.classify(event, location.getTopologyRole());
        String rootCause = rootCauseCatalog.describe(category, location, event.isMultiModal());
        List<RecommendedAction> actions = actionPlaybook.actionsFor(category, location, priority);

        Instant timestamp = toInstant(event.getWindowEnd());
        boolean escalation = severity == Severity.CRITICAL || priority == Priority.P1;

        Alert alert = Alert.builder()
                .alertId(idGenerator.nextId(timestamp))
                .timestamp(timestamp)
                .severity(severity)
                .priority(priority)
                .confidence(location.getConfidence())
                .alertType(category.alertType())
                .location(location)
                .blastRadius(triage.getBlastRadius())
                .criticality(triage.getCriticality())
                .probableRootCause(rootCause)
                .supportingEvidence(gatherEvidence(event, triage.getBlastRadius()))
                .recommendedActions(actions)
                .escalationRequired(escalation)
                .estimatedResolution(estimateResolution(category, priority))
                .affectedDevices(affectedDevices(location, triage.getBlastRadius()))
                .correlationId(event.getId())
                .multiModal(event.isMultiModal())
                .build();

        log.debug("Assembled alert {} for {} ({}, {})", alert.getAlertId(), location.getDevice(),
                severity.wireName(), priority);
        return alert;
    }

    // ========== Private Methods ==========

    List<String> gatherEvidence(CorrelatedEvent event, BlastRadius blastRadius) {
        List<String> evidence = new ArrayList<>();

        // One line per modality
        for (Modality modality : Modality.values()) {
            List<AnomalyEvent> events = event.getEvents().stream()
                    .filter(e -> e.getModality() == modality)
                    .collect(Collectors.toList());
            if (events.isEmpty()) {
                continue;
            }
            TreeSet<String> series = new TreeSet<>();
            events.forEach(e -> series.addAll(e.getDetectedSeries()));
            double best = events.stream().mapToDouble(AnomalyEvent::getConfidence).max().orElse(0.0);
            String signals = series.isEmpty()
                    ? "anomaly"
                    : series.stream().limit(MAX_FEATURES_PER_LINE).collect(Collectors.joining(", "));
            Optional<Severity> hint = events.stream()
                    .map(AnomalyEvent::getSeverityHint)
                    .filter(Objects::nonNull)
                    .max(Comparator.naturalOrder());
            evidence.add(hint
                    .map(h -> String.format(Locale.ROOT, "%s: %s (confidence: %.2f, severity hint: %s)",
                            modality.name(), signals, best, h.wireName()))
                    .orElseGet(() -> String.format(Locale.ROOT, "%s: %s (confidence: %.2f)",
                            modality.name(), signals, best)));
        }

        // Correlation
        if (event.isMultiModal()) {
            evidence.add(String.format(Locale.ROOT, "Multi-modal confirmation (correlation: %.2f)",
                    event.getCorrelationStrength()));
        } else {
            evidence.add(String.format(Locale.ROOT, "Single-modality detection (correlation: %.2f)",
                    event.getCorrelationStrength()));
        }

        // Blast radius
        String radius = String.format(Locale.ROOT, "Blast radius: %d downstream devices, %s failure domain",
                blastRadius.getAffectedDevices(),
                blastRadius.getFailureDomain().name().toLowerCase(Locale.ROOT));
        if (blastRadius.isSpof()) {
            radius += ", single point of failure";
        }
        evidence.add(radius);

        return List.copyOf(evidence);
    }

    private static String estimateResolution(FailureCategory category, Priority priority) {
        String base = category.getTypicalResolution();
        return priority == Priority.P1 ? base + " (URGENT)" : base;
    }

    private static List<String> affectedDevices(Location location, BlastRadius blastRadius) {
        List<String> devices = new ArrayList<>();
        devices.add(location.getDevice());
        blastRadius.getDownstreamDevices().stream()
                .limit(MAX_DOWNSTREAM_LISTED)
                .forEach(devices::add);
        return List.copyOf(devices);
    }

    private static Instant toInstant(double epochSeconds) {
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1000.0));
    }
}
