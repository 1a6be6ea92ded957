package com.z254.netwatch.sentinel.alerting;

import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.Location;
import com.z254.netwatch.sentinel.domain.model.Modality;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Decision table from detected signals to a probable root cause.
 * <p>
 * Health features and routing series are first mapped to signal categories. Combinations
 * that only make sense with cross-modal agreement (a withdrawal seen together with link
 * errors, a thermal or power signal) are promoted to a stronger category; otherwise the first
 * signal found wins, health signals ahead of routing ones.
 */
@Component
public class RootCauseCatalog {

    public FailureCategory classify(CorrelatedEvent event, DeviceRole role) {
        Set<FailureCategory> signals = signals(event);

        if (event.isMultiModal()) {
            if (signals.contains(FailureCategory.LINK_DEGRADATION)
                    && signals.contains(FailureCategory.ROUTE_WITHDRAWAL)) {
                return FailureCategory.LINK_FAILURE;
            }
            if (signals.contains(FailureCategory.THERMAL_ISSUE) || signals.contains(FailureCategory.POWER_ISSUE)) {
                return FailureCategory.HARDWARE_FAILURE;
            }
            if (signals.contains(FailureCategory.RESOURCE_EXHAUSTION)
                    && signals.contains(FailureCategory.ROUTING_INSTABILITY)) {
                return FailureCategory.BGP_PROCESS_ISSUE;
            }
            // Withdrawals confirmed by device health on a switching tier point at the link
            if (signals.contains(FailureCategory.ROUTE_WITHDRAWAL) && isSwitchingTier(role)) {
                return FailureCategory.LINK_FAILURE;
            }
        }

        return signals.stream().findFirst().orElse(FailureCategory.UNKNOWN_ANOMALY);
    }

    /**
     * Operator-facing narrative for a category at a location.
     */
    public String describe(FailureCategory category, Location location, boolean multiModal) {
        String device = location.getDevice();
        String target = location.getInterfaceName() != null
                ? device + " " + location.getInterfaceName()
                : device;
        return switch (category) {
            case LINK_FAILURE -> "Physical link failure on " + device;
            case HARDWARE_FAILURE -> "Hardware failure on " + device;
            case BGP_PROCESS_ISSUE -> "BGP process issue on " + device;
            case LINK_DEGRADATION -> multiModal
                    ? "Link degradation on " + target
                    : "Interface degradation on " + target + " (unconfirmed)";
            case THERMAL_ISSUE -> "Thermal shutdown imminent on " + device;
            case POWER_ISSUE -> "Power supply failure on " + device;
            case RESOURCE_EXHAUSTION -> "Resource exhaustion on " + device;
            case ROUTE_WITHDRAWAL -> "Route withdrawal from "
                    + (location.getBgpPeer() != null ? location.getBgpPeer() : device);
            case ROUTING_INSTABILITY -> "Routing instability at " + device;
            case UNKNOWN_ANOMALY -> "Anomaly detected at " + device;
        };
    }

    Set<FailureCategory> signals(CorrelatedEvent event) {
        Set<FailureCategory> health = new LinkedHashSet<>();
        Set<FailureCategory> routing = new LinkedHashSet<>();

        for (AnomalyEvent e : event.getEvents()) {
            for (String series : e.getDetectedSeries()) {
                String name = series.toLowerCase(Locale.ROOT);
                if (e.getModality() == Modality.BGP) {
                    if (name.startsWith("wdr")) {
                        routing.add(FailureCategory.ROUTE_WITHDRAWAL);
                    }
                    if (name.contains("churn") || name.contains("flap")) {
                        routing.add(FailureCategory.ROUTING_INSTABILITY);
                    }
                } else {
                    if (name.contains("error") || name.contains("link_down") || name.contains("flap")) {
                        health.add(FailureCategory.LINK_DEGRADATION);
                    }
                    if (name.contains("temperature")) {
                        health.add(FailureCategory.THERMAL_ISSUE);
                    }
                    if (name.contains("power")) {
                        health.add(FailureCategory.POWER_ISSUE);
                    }
                    if (name.contains("cpu") || name.contains("memory")) {
                        health.add(FailureCategory.RESOURCE_EXHAUSTION);
                    }
                }
            }
        }

        Set<FailureCategory> ordered = new LinkedHashSet<>();
        for (FailureCategory category : FailureCategory.values()) {
            if (health.contains(category)) {
                ordered.add(category);
            }
        }
        for (FailureCategory category : FailureCategory.values()) {
            if (routing.contains(category)) {
                ordered.add(category);
            }
        }
        return ordered;
    }

    private static boolean isSwitchingTier(DeviceRole role) {
        return role == DeviceRole.SPINE || role == DeviceRole.EDGE
                || role == DeviceRole.TOR || role == DeviceRole.LEAF;
    }
}
