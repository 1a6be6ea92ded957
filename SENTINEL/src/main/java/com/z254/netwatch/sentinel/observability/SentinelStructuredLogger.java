package com.z254.netwatch.sentinel.observability;

import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structured logging for correlation and alert lifecycle events.
 * <p>
 * Lines read {@code message | data={...}} with the correlation id, device and alert id
 * placed in the MDC for the duration of the call.
 */
@Slf4j
@Component
public class SentinelStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_DEVICE = "device";
    public static final String MDC_ALERT_ID = "alertId";

    public void logCorrelation(CorrelatedEvent event, CorrelationEventType eventType) {
        try (var scope = withContext(Map.of(
                MDC_CORRELATION_ID, event.getId(),
                MDC_DEVICE, event.getPrimaryDevice()))) {

            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("revision", event.getRevision());
            logData.put("modalities", event.getModalities());
            logData.put("strength", event.getCorrelationStrength());
            logData.put("combinedConfidence", event.getCombinedConfidence());
            logData.put("eventCount", event.getEventCount());

            switch (eventType) {
                case REVISED -> log.debug("Correlation revised | data={}", formatLogData(logData));
                default -> log.info("Correlation {} | data={}",
                        eventType.name().toLowerCase(Locale.ROOT), formatLogData(logData));
            }
        }
    }

    public void logAlert(Alert alert) {
        try (var scope = withContext(Map.of(
                MDC_ALERT_ID, alert.getAlertId(),
                MDC_CORRELATION_ID, alert.getCorrelationId() != null ? alert.getCorrelationId() : "",
                MDC_DEVICE, alert.getLocation().getDevice()))) {

            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("severity", alert.getSeverity().wireName());
            logData.put("priority", alert.getPriority().name());
            logData.put("alertType", alert.getAlertType());
            logData.put("confidence", alert.getConfidence());
            logData.put("escalation", alert.isEscalationRequired());
            logData.put("affectedDevices", alert.getBlastRadius().getAffectedDevices());

            if (alert.isEscalationRequired()) {
                log.warn("{} | data={}", alert.getProbableRootCause(), formatLogData(logData));
            } else {
                log.info("{} | data={}", alert.getProbableRootCause(), formatLogData(logData));
            }
        }
    }

    public void logRejected(String signalType, String reason) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "REJECTED");
        logData.put("signalType", signalType);
        logData.put("reason", reason);
        log.warn("Signal rejected | data={}", formatLogData(logData));
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum CorrelationEventType {
        CONFIRMED, REVISED, CLOSED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
