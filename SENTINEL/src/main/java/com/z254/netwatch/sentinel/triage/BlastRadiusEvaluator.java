package com.z254.netwatch.sentinel.triage;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.BlastRadius;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.FailureDomain;
import com.z254.netwatch.sentinel.domain.model.ImpactClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Estimates the blast radius of a failing device from its role.
 * <p>
 * Role heuristic, no path computation:
 * <ul>
 *     <li>spine and edge devices reach every ToR and server</li>
 *     <li>ToR devices reach every server</li>
 *     <li>all other roles reach nothing downstream</li>
 * </ul>
 */
@Slf4j
@Component
public class BlastRadiusEvaluator {

    private static final double SPOF_FACTOR = 2.0;

    private final TopologyRegistry topology;
    private final int networkImpactingThreshold;

    public BlastRadiusEvaluator(TopologyRegistry topology, SentinelProperties properties) {
        this.topology = topology;
        this.networkImpactingThreshold = properties.getTriage().getNetworkImpactingDeviceThreshold();
    }

    public BlastRadius evaluate(String device, DeviceRole role) {
        if (role == DeviceRole.UNKNOWN) {
            return BlastRadius.none();
        }

        // Collect downstream devices
        List<String> downstream = new ArrayList<>();
        for (DeviceRole downstreamRole : downstreamRoles(role)) {
            topology.devicesWithRole(downstreamRole).stream()
                    .filter(d -> !d.equals(device))
                    .forEach(downstream::add);
        }
        int affected = downstream.size();

        // Involved roles: the failing device plus everything it reaches
        Set<DeviceRole> involved = EnumSet.of(role);
        downstream.forEach(d -> involved.add(topology.roleOf(d)));

        boolean spof = role.isSinglePointOfFailure();
        RolePolicy policy = topology.policyFor(role);
        double impactScore = affected * policy.getBlastRadiusMultiplier() * (spof ? SPOF_FACTOR : 1.0);

        ImpactClass impactClass = spof || (involved.size() >= 2 && affected >= networkImpactingThreshold)
                ? ImpactClass.NETWORK_IMPACTING
                : ImpactClass.EDGE_LOCAL;

        BlastRadius radius = BlastRadius.builder()
                .affectedDevices(affected)
                .affectedServices(policy.getAffectedServices())
                .downstreamDevices(List.copyOf(downstream))
                .redundancyAvailable(affected < topology.totalDevices())
                .spof(spof)
                .failureDomain(spof ? FailureDomain.DATACENTER : FailureDomain.RACK)
                .impactScore(impactScore)
                .impactClass(impactClass)
                .build();

        log.debug("Blast radius for {} ({}): affected={}, spof={}, class={}",
                device, role, affected, spof, impactClass);
        return radius;
    }

    private static Set<DeviceRole> downstreamRoles(DeviceRole role) {
        return switch (role) {
            case SPINE, EDGE -> EnumSet.of(DeviceRole.TOR, DeviceRole.SERVER);
            case TOR -> EnumSet.of(DeviceRole.SERVER);
            default -> EnumSet.noneOf(DeviceRole.class);
        };
    }
}
