package com.z254.netwatch.sentinel.triage;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.BlastRadius;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.FailureDomain;
import com.z254.netwatch.sentinel.domain.model.ImpactClass;
import com.z254.netwatch.sentinel.support.SentinelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BlastRadiusEvaluatorTest {

    private BlastRadiusEvaluator evaluator;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = SentinelFixtures.properties();
        evaluator = new BlastRadiusEvaluator(SentinelFixtures.registry(properties), properties);
    }

    @Test
    void spineFailureReachesRacksAndServers() {
        BlastRadius radius = evaluator.evaluate("spine-01", DeviceRole.SPINE);

        assertThat(radius.getAffectedDevices()).isEqualTo(10);
        assertThat(radius.getDownstreamDevices()).contains("tor-01", "tor-02", "server-08")
                .doesNotContain("spine-02", "edge-01");
        assertThat(radius.isSpof()).isTrue();
        assertThat(radius.isRedundancyAvailable()).isTrue();
        assertThat(radius.getFailureDomain()).isEqualTo(FailureDomain.DATACENTER);
        assertThat(radius.getImpactClass()).isEqualTo(ImpactClass.NETWORK_IMPACTING);
        assertThat(radius.getImpactScore()).isEqualTo(40.0);
        assertThat(radius.getAffectedServices()).contains("east_west_traffic");
    }

    @Test
    void torFailureStaysInRack() {
        BlastRadius radius = evaluator.evaluate("tor-01", DeviceRole.TOR);

        assertThat(radius.getAffectedDevices()).isEqualTo(8);
        assertThat(radius.isSpof()).isFalse();
        assertThat(radius.getFailureDomain()).isEqualTo(FailureDomain.RACK);
        assertThat(radius.getImpactClass()).isEqualTo(ImpactClass.EDGE_LOCAL);
        assertThat(radius.getImpactScore()).isEqualTo(12.0);
    }

    @Test
    void serverHasNoDownstream() {
        BlastRadius radius = evaluator.evaluate("server-01", DeviceRole.SERVER);

        assertThat(radius.getAffectedDevices()).isZero();
        assertThat(radius.getDownstreamDevices()).isEmpty();
        assertThat(radius.isSpof()).isFalse();
        assertThat(radius.getImpactClass()).isEqualTo(ImpactClass.EDGE_LOCAL);
    }

    @Test
    void unknownDeviceHasMinimalRadius() {
        assertThat(evaluator.evaluate("mystery-01", DeviceRole.UNKNOWN)).isEqualTo(BlastRadius.none());
    }
}
