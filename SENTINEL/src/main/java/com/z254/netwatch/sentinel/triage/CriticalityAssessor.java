package com.z254.netwatch.sentinel.triage;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.BlastRadius;
import com.z254.netwatch.sentinel.domain.model.Criticality;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.Priority;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores how urgent an anomaly is on a 0-10 scale and maps the score to a priority.
 */
@Component
public class CriticalityAssessor {

    private static final double CONFIDENCE_WEIGHT = 2.0;
    private static final double MULTI_MODAL_BONUS = 1.5;
    private static final double NO_REDUNDANCY_BONUS = 1.0;
    private static final double SLA_CONFIDENCE_FLOOR = 0.7;

    private final TopologyRegistry topology;
    private final Duration p1SlaWindow;
    private final Duration p2SlaWindow;

    public CriticalityAssessor(TopologyRegistry topology, SentinelProperties properties) {
        this.topology = topology;
        this.p1SlaWindow = properties.getTriage().getP1SlaWindow();
        this.p2SlaWindow = properties.getTriage().getP2SlaWindow();
    }

    public Criticality assess(DeviceRole role, AnomalyContext context, double confidence, BlastRadius blastRadius) {
        List<String> factors = new ArrayList<>();

        double base = topology.policyFor(role).getCriticalityBase();
        double score = base;
        factors.add(String.format(Locale.ROOT, "%s role base %.1f", role.configName(), base));

        double confidenceContribution = CONFIDENCE_WEIGHT * confidence;
        score += confidenceContribution;
        factors.add(String.format(Locale.ROOT, "confidence %.2f (+%.2f)", confidence, confidenceContribution));

        if (context.isMultiModal()) {
            score += MULTI_MODAL_BONUS;
            factors.add("multi-modal confirmation (+1.5)");
        }
        if (!blastRadius.isRedundancyAvailable()) {
            score += NO_REDUNDANCY_BONUS;
            factors.add("no redundant path (+1.0)");
        }

        score = Math.max(0.0, Math.min(10.0, score));
        Priority priority = Priority.fromScore(score);
        boolean slaBreachLikely = priority.isUrgent() && confidence >= SLA_CONFIDENCE_FLOOR;

        return Criticality.builder()
                .score(score)
                .priority(priority)
                .factors(List.copyOf(factors))
                .slaBreachLikely(slaBreachLikely)
                .timeToBreachMin(timeToBreach(priority, context))
                .build();
    }

    /**
     * Minutes left in the SLA window of the priority; null for P3 or an unknown start.
     */
    Double timeToBreach(Priority priority, AnomalyContext context) {
        if (!priority.isUrgent() || context.getAnomalyStartedAt() == null) {
            return null;
        }
        Duration window = priority == Priority.P1 ? p1SlaWindow : p2SlaWindow;
        double elapsedMinutes = Math.max(0.0, context.getObservedAt() - context.getAnomalyStartedAt()) / 60.0;
        return Math.max(0.0, window.toSeconds() / 60.0 - elapsedMinutes);
    }
}
