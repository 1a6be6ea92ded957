package com.z254.netwatch.sentinel.triage;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.exception.TopologyConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only device and role tables.
 * <p>
 * Built once at startup; role names are validated while loading, so every lookup afterwards
 * works on {@link DeviceRole} values only.
 */
@Slf4j
public class TopologyRegistry {

    private static final Map<DeviceRole, RolePolicy> DEFAULT_POLICIES = defaultPolicies();

    private final Map<String, DeviceRole> devices;
    private final Map<DeviceRole, RolePolicy> policies;

    public TopologyRegistry(Map<String, DeviceRole> devices, Map<DeviceRole, RolePolicy> policies) {
        this.devices = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
        Map<DeviceRole, RolePolicy> merged = new EnumMap<>(DEFAULT_POLICIES);
        merged.putAll(policies);
        this.policies = Collections.unmodifiableMap(merged);
    }

    /**
     * Load the tables bound under {@code sentinel.topology}.
     *
     * @throws TopologyConfigurationException on an unknown role name or a blank device name
     */
    public static TopologyRegistry fromProperties(SentinelProperties.Topology topology) {
        Map<String, DeviceRole> devices = new LinkedHashMap<>();
        topology.getDevices().forEach((device, roleName) -> {
            if (device == null || device.isBlank()) {
                throw new TopologyConfigurationException("Blank device name in topology table");
            }
            DeviceRole role = DeviceRole.fromConfigName(roleName)
                    .orElseThrow(() -> new TopologyConfigurationException(
                            "Unknown role '" + roleName + "' for device " + device));
            devices.put(device, role);
        });

        Map<DeviceRole, RolePolicy> policies = new EnumMap<>(DeviceRole.class);
        topology.getRolePolicies().forEach((roleName, policy) -> {
            DeviceRole role = DeviceRole.fromConfigName(roleName)
                    .orElseThrow(() -> new TopologyConfigurationException(
                            "Unknown role '" + roleName + "' in role policies"));
            if (policy.getCriticalityBase() < 0 || policy.getCriticalityBase() > 10) {
                throw new TopologyConfigurationException(
                        "Criticality base for " + roleName + " must be within [0, 10]");
            }
            policies.put(role, RolePolicy.builder()
                    .criticalityBase(policy.getCriticalityBase())
                    .blastRadiusMultiplier(policy.getBlastRadiusMultiplier())
                    .affectedServices(List.copyOf(policy.getAffectedServices()))
                    .build());
        });

        TopologyRegistry registry = new TopologyRegistry(devices, policies);
        log.info("Topology loaded: {} devices, roles={}", devices.size(), registry.roleCounts());
        return registry;
    }

    /**
     * Role of a device; {@link DeviceRole#UNKNOWN} when the device is not in the table.
     */
    public DeviceRole roleOf(String device) {
        if (device == null) {
            return DeviceRole.UNKNOWN;
        }
        return devices.getOrDefault(device, DeviceRole.UNKNOWN);
    }

    public boolean isKnown(String device) {
        return device != null && devices.containsKey(device);
    }

    /**
     * Devices of one role, sorted by name.
     */
    public List<String> devicesWithRole(DeviceRole role) {
        return devices.entrySet().stream()
                .filter(e -> e.getValue() == role)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    public RolePolicy policyFor(DeviceRole role) {
        return policies.get(role);
    }

    public int totalDevices() {
        return devices.size();
    }

    public Map<DeviceRole, Long> roleCounts() {
        Map<DeviceRole, Long> counts = new EnumMap<>(DeviceRole.class);
        devices.values().forEach(role -> counts.merge(role, 1L, Long::sum));
        return counts;
    }

    private static Map<DeviceRole, RolePolicy> defaultPolicies() {
        Map<DeviceRole, RolePolicy> defaults = new EnumMap<>(DeviceRole.class);
        defaults.put(DeviceRole.SPINE, policy(5.0, 2.0, "east_west_traffic", "inter_rack_connectivity"));
        defaults.put(DeviceRole.EDGE, policy(5.0, 2.0, "external_connectivity", "internet_egress"));
        defaults.put(DeviceRole.TOR, policy(3.5, 1.5, "rack_connectivity"));
        defaults.put(DeviceRole.LEAF, policy(2.5, 1.2, "pod_connectivity"));
        defaults.put(DeviceRole.SERVER, policy(1.0, 1.0, "hosted_workloads"));
        defaults.put(DeviceRole.UNKNOWN, policy(0.5, 1.0));
        return defaults;
    }

    private static RolePolicy policy(double base, double multiplier, String... services) {
        return RolePolicy.builder()
                .criticalityBase(base)
                .blastRadiusMultiplier(multiplier)
                .affectedServices(List.of(services))
                .build();
    }
}
