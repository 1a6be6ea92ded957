package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Derived fault location, not authoritative network state.
 */
@Value
@Builder(toBuilder = true)
public class Location {
    String device;
    String interfaceName;
    String bgpPeer;
    @Builder.Default
    DeviceRole topologyRole = DeviceRole.UNKNOWN;
    double confidence;
}
