package com.z254.netwatch.sentinel.alerting;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory history of recent alerts with operator acknowledgments.
 * <p>
 * Alerts stay immutable; acknowledgments live in a side table keyed by alert id and are
 * evicted together with their alert.
 */
@Slf4j
@Component
public class AlertHistory {

    private final int capacity;
    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final Map<String, AlertAcknowledgement> acknowledgements = new HashMap<>();

    public AlertHistory(SentinelProperties properties) {
        this.capacity = properties.getAlerting().getHistorySize();
    }

    public synchronized void record(Alert alert) {
        alerts.addLast(alert);
        while (alerts.size() > capacity) {
            Alert evicted = alerts.pollFirst();
            acknowledgements.remove(evicted.getAlertId());
        }
    }

    /**
     * Mark an alert as acknowledged.
     *
     * @return false if the alert is unknown or already acknowledged
     */
    public synchronized boolean acknowledge(String alertId, String acknowledgedBy) {
        if (find(alertId).isEmpty() || acknowledgements.containsKey(alertId)) {
            return false;
        }
        acknowledgements.put(alertId, AlertAcknowledgement.builder()
                .alertId(alertId)
                .acknowledgedBy(acknowledgedBy)
                .acknowledgedAt(Instant.now())
                .build());
        log.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
        return true;
    }

    public synchronized Optional<Alert> find(String alertId) {
        return alerts.stream().filter(a -> a.getAlertId().equals(alertId)).findFirst();
    }

    public synchronized Optional<AlertAcknowledgement> getAcknowledgement(String alertId) {
        return Optional.ofNullable(acknowledgements.get(alertId));
    }

    public synchronized boolean isAcknowledged(String alertId) {
        return acknowledgements.containsKey(alertId);
    }

    /**
     * Most recent alerts, newest first.
     */
    public synchronized List<Alert> getRecent(int limit) {
        List<Alert> recent = new ArrayList<>();
        Iterator<Alert> it = alerts.descendingIterator();
        while (it.hasNext() && recent.size() < limit) {
            recent.add(it.next());
        }
        return recent;
    }

    /**
     * Unacknowledged alerts, oldest first.
     */
    public synchronized List<Alert> getActiveAlerts() {
        List<Alert> active = new ArrayList<>();
        for (Alert alert : alerts) {
            if (!acknowledgements.containsKey(alert.getAlertId())) {
                active.add(alert);
            }
        }
        return active;
    }

    public synchronized Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        alerts.forEach(a -> counts.merge(a.getSeverity(), 1L, Long::sum));
        return counts;
    }

    public synchronized int size() {
        return alerts.size();
    }

    public synchronized void clear() {
        alerts.clear();
        acknowledgements.clear();
    }
}
