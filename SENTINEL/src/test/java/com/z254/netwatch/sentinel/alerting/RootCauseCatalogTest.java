package com.z254.netwatch.sentinel.alerting;

import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.Location;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.z254.netwatch.sentinel.support.SentinelFixtures.bgp;
import static com.z254.netwatch.sentinel.support.SentinelFixtures.snmp;
import static com.z254.netwatch.sentinel.support.SentinelFixtures.trap;
import static org.assertj.core.api.Assertions.assertThat;

class RootCauseCatalogTest {

    private final RootCauseCatalog catalog = new RootCauseCatalog();

    private static CorrelatedEvent correlated(boolean multiModal, AnomalyEvent... events) {
        return CorrelatedEvent.builder()
                .id("corr-test")
                .multiModal(multiModal)
                .events(List.of(events))
                .build();
    }

    @Test
    void withdrawalWithInterfaceErrorsIsLinkFailure() {
        CorrelatedEvent event = correlated(true,
                bgp("spine-01", 1_000, 0.85, "wdr_total"),
                snmp("spine-01", "Ethernet1/1", 1_005, 0.9, "interface_error_rate"));

        assertThat(catalog.classify(event, DeviceRole.SPINE)).isEqualTo(FailureCategory.LINK_FAILURE);
    }

    @Test
    void withdrawalWithLinkDownTrapIsLinkFailure() {
        CorrelatedEvent event = correlated(true,
                bgp("server-01", 1_000, 0.85, "wdr_total"),
                trap("server-01", 1_002, 0.9));

        assertThat(catalog.classify(event, DeviceRole.SERVER)).isEqualTo(FailureCategory.LINK_FAILURE);
    }

    @Test
    void confirmedThermalSignalIsHardwareFailure() {
        CorrelatedEvent event = correlated(true,
                bgp("tor-01", 1_000, 0.7, "ann_total"),
                snmp("tor-01", null, 1_005, 0.9, "temperature_max"));

        assertThat(catalog.classify(event, DeviceRole.TOR)).isEqualTo(FailureCategory.HARDWARE_FAILURE);
    }

    @Test
    void resourcePressureWithChurnIsBgpProcessIssue() {
        CorrelatedEvent event = correlated(true,
                bgp("edge-01", 1_000, 0.7, "as_path_churn"),
                snmp("edge-01", null, 1_005, 0.8, "cpu_util"));

        assertThat(catalog.classify(event, DeviceRole.EDGE)).isEqualTo(FailureCategory.BGP_PROCESS_ISSUE);
    }

    @Test
    void withdrawalOnSwitchingTierIsLinkFailureButNotOnServer() {
        AnomalyEvent withdrawal = bgp("x", 1_000, 0.8, "wdr_total");
        AnomalyEvent memory = snmp("x", null, 1_005, 0.8, "memory_util");

        assertThat(catalog.classify(correlated(true, withdrawal, memory), DeviceRole.TOR))
                .isEqualTo(FailureCategory.LINK_FAILURE);
        assertThat(catalog.classify(correlated(true, withdrawal, memory), DeviceRole.SERVER))
                .isEqualTo(FailureCategory.RESOURCE_EXHAUSTION);
    }

    @Test
    void singleModalitySignalsAreNotPromoted() {
        CorrelatedEvent errors = correlated(false, snmp("tor-01", "Ethernet1/1", 1_005, 0.9, "interface_error_rate"));
        CorrelatedEvent withdrawals = correlated(false, bgp("spine-01", 1_000, 0.9, "wdr_total"));
        CorrelatedEvent nothing = correlated(false, bgp("spine-01", 1_000, 0.9));

        assertThat(catalog.classify(errors, DeviceRole.TOR)).isEqualTo(FailureCategory.LINK_DEGRADATION);
        assertThat(catalog.classify(withdrawals, DeviceRole.SPINE)).isEqualTo(FailureCategory.ROUTE_WITHDRAWAL);
        assertThat(catalog.classify(nothing, DeviceRole.SPINE)).isEqualTo(FailureCategory.UNKNOWN_ANOMALY);
    }

    @Test
    void describesLocation() {
        Location tor = Location.builder().device("tor-01").interfaceName("Ethernet1/1").build();
        Location spine = Location.builder().device("spine-01").bgpPeer("10.0.0.2").build();

        assertThat(catalog.describe(FailureCategory.LINK_DEGRADATION, tor, false))
                .isEqualTo("Interface degradation on tor-01 Ethernet1/1 (unconfirmed)");
        assertThat(catalog.describe(FailureCategory.LINK_FAILURE, spine, true))
                .isEqualTo("Physical link failure on spine-01");
        assertThat(catalog.describe(FailureCategory.ROUTE_WITHDRAWAL, spine, false))
                .isEqualTo("Route withdrawal from 10.0.0.2");
    }
}
