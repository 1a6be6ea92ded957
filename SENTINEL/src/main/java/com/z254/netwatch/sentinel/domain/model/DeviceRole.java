package com.z254.netwatch.sentinel.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Topology role of a network device.
 * <p>
 * The rank orders roles when two location candidates carry the same confidence:
 * SPINE &gt; EDGE &gt; TOR &gt; LEAF &gt; SERVER &gt; UNKNOWN.
 */
public enum DeviceRole {
    SPINE(5),
    EDGE(4),
    TOR(3),
    LEAF(2),
    SERVER(1),
    UNKNOWN(0);

    private final int rank;

    DeviceRole(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isSinglePointOfFailure() {
        return this == SPINE || this == EDGE;
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DeviceRole> fromConfigName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.name().equals(normalized))
                .findFirst();
    }
}
