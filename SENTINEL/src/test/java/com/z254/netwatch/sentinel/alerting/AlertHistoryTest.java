package com.z254.netwatch.sentinel.alerting;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.domain.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertHistoryTest {

    private AlertHistory history;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        properties.getAlerting().setHistorySize(3);
        history = new AlertHistory(properties);
    }

    private static Alert alert(String id, Severity severity) {
        return Alert.builder().alertId(id).severity(severity).build();
    }

    @Test
    void keepsMostRecentAlertsNewestFirst() {
        history.record(alert("a1", Severity.INFO));
        history.record(alert("a2", Severity.ERROR));
        history.record(alert("a3", Severity.CRITICAL));
        history.record(alert("a4", Severity.CRITICAL));

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.find("a1")).isEmpty();
        assertThat(history.getRecent(2)).extracting(Alert::getAlertId).containsExactly("a4", "a3");
        assertThat(history.countBySeverity())
                .containsEntry(Severity.CRITICAL, 2L)
                .containsEntry(Severity.ERROR, 1L)
                .containsEntry(Severity.INFO, 0L);
    }

    @Test
    void acknowledgementRemovesAlertFromActiveSet() {
        history.record(alert("a1", Severity.ERROR));
        history.record(alert("a2", Severity.WARNING));

        assertThat(history.acknowledge("a1", "noc-operator")).isTrue();
        assertThat(history.acknowledge("a1", "someone-else")).isFalse();
        assertThat(history.acknowledge("missing", "noc-operator")).isFalse();

        assertThat(history.isAcknowledged("a1")).isTrue();
        assertThat(history.getAcknowledgement("a1"))
                .hasValueSatisfying(ack -> assertThat(ack.getAcknowledgedBy()).isEqualTo("noc-operator"));
        assertThat(history.getActiveAlerts()).extracting(Alert::getAlertId).containsExactly("a2");
    }

    @Test
    void evictionDropsAcknowledgement() {
        history.record(alert("a1", Severity.ERROR));
        history.acknowledge("a1", "noc-operator");

        history.record(alert("a2", Severity.ERROR));
        history.record(alert("a3", Severity.ERROR));
        history.record(alert("a4", Severity.ERROR));

        assertThat(history.isAcknowledged("a1")).isFalse();
        history.clear();
        assertThat(history.size()).isZero();
    }
}
