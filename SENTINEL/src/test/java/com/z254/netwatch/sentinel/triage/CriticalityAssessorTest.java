package com.z254.netwatch.sentinel.triage;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.BlastRadius;
import com.z254.netwatch.sentinel.domain.model.Criticality;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.FailureDomain;
import com.z254.netwatch.sentinel.domain.model.ImpactClass;
import com.z254.netwatch.sentinel.domain.model.Priority;
import com.z254.netwatch.sentinel.support.SentinelFixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CriticalityAssessorTest {

    private static final BlastRadius REDUNDANT = BlastRadius.none();

    private static final BlastRadius NO_REDUNDANCY = BlastRadius.builder()
            .affectedDevices(4)
            .redundancyAvailable(false)
            .failureDomain(FailureDomain.RACK)
            .impactClass(ImpactClass.EDGE_LOCAL)
            .build();

    private static CriticalityAssessor assessor(SentinelProperties properties) {
        return new CriticalityAssessor(SentinelFixtures.registry(properties), properties);
    }

    private static AnomalyContext context(double confidence, boolean multiModal) {
        return AnomalyContext.builder()
                .confidence(confidence)
                .multiModal(multiModal)
                .anomalyStartedAt(1_000.0)
                .observedAt(1_005.0)
                .build();
    }

    @Test
    void confirmedSpineAnomalyIsP1() {
        Criticality criticality = assessor(SentinelFixtures.properties())
                .assess(DeviceRole.SPINE, context(1.0, true), 1.0, REDUNDANT);

        assertThat(criticality.getScore()).isCloseTo(8.5, within(1e-9));
        assertThat(criticality.getPriority()).isEqualTo(Priority.P1);
        assertThat(criticality.isSlaBreachLikely()).isTrue();
        assertThat(criticality.getTimeToBreachMin()).isCloseTo(15.0 - 5.0 / 60.0, within(1e-9));
        assertThat(criticality.getFactors()).contains("multi-modal confirmation (+1.5)");
    }

    @Test
    void singleModalityTorAnomalyIsP2() {
        Criticality criticality = assessor(SentinelFixtures.properties())
                .assess(DeviceRole.TOR, context(0.9, false), 0.9, REDUNDANT);

        assertThat(criticality.getScore()).isCloseTo(5.3, within(1e-9));
        assertThat(criticality.getPriority()).isEqualTo(Priority.P2);
        assertThat(criticality.getTimeToBreachMin()).isCloseTo(60.0 - 5.0 / 60.0, within(1e-9));
    }

    @Test
    void missingRedundancyAddsToScore() {
        Criticality criticality = assessor(SentinelFixtures.properties())
                .assess(DeviceRole.TOR, context(0.5, false), 0.5, NO_REDUNDANCY);

        assertThat(criticality.getScore()).isCloseTo(5.5, within(1e-9));
        assertThat(criticality.isSlaBreachLikely()).isFalse();
        assertThat(criticality.getFactors()).contains("no redundant path (+1.0)");
    }

    @Test
    void lowScoreIsP3WithoutBreachEstimate() {
        Criticality criticality = assessor(SentinelFixtures.properties())
                .assess(DeviceRole.SERVER, context(0.5, false), 0.5, REDUNDANT);

        assertThat(criticality.getPriority()).isEqualTo(Priority.P3);
        assertThat(criticality.getTimeToBreachMin()).isNull();
        assertThat(criticality.isSlaBreachLikely()).isFalse();
    }

    @Test
    void scoreIsClippedToTen() {
        SentinelProperties properties = SentinelFixtures.properties();
        SentinelProperties.RolePolicyProperties spine = new SentinelProperties.RolePolicyProperties();
        spine.setCriticalityBase(9.5);
        properties.getTopology().setRolePolicies(Map.of("spine", spine));

        Criticality criticality = assessor(properties)
                .assess(DeviceRole.SPINE, context(1.0, true), 1.0, NO_REDUNDANCY);

        assertThat(criticality.getScore()).isEqualTo(10.0);
    }

    @Test
    void breachEstimateNeverGoesNegative() {
        AnomalyContext stale = AnomalyContext.builder()
                .confidence(1.0)
                .anomalyStartedAt(0.0)
                .observedAt(7_200.0)
                .build();

        Double minutes = assessor(SentinelFixtures.properties()).timeToBreach(Priority.P1, stale);

        assertThat(minutes).isZero();
    }
}
