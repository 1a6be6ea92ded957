package com.z254.netwatch.sentinel.alerting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Append-only JSON Lines journal of emitted alerts.
 * <p>
 * A write failure is logged and counted; the alert still reaches every other sink.
 */
@Slf4j
@Component
public class AlertJournal {

    private final boolean enabled;
    private final Path path;
    private final ObjectMapper objectMapper;
    private final SentinelMetrics metrics;

    public AlertJournal(SentinelProperties properties, SentinelMetrics metrics) {
        this.enabled = properties.getAlerting().isJournalEnabled();
        this.path = Paths.get(properties.getAlerting().getJournalPath());
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (enabled) {
            log.info("Alert journal enabled at {}", path.toAbsolutePath());
        }
    }

    /**
     * Append one alert as a single line.
     *
     * @return true if the line was written
     */
    public synchronized boolean append(Alert alert) {
        if (!enabled) {
            return false;
        }
        try {
            String line = objectMapper.writeValueAsString(alert);
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert {}: {}", alert.getAlertId(), e.getMessage());
            metrics.recordJournalFailure();
            return false;
        } catch (IOException e) {
            log.error("Failed to append alert {} to {}: {}", alert.getAlertId(), path, e.getMessage());
            metrics.recordJournalFailure();
            return false;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path getPath() {
        return path;
    }
}
