package com.z254.netwatch.sentinel.config;

import com.z254.netwatch.sentinel.triage.TopologyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans built from configuration rather than discovered by component scan.
 */
@Configuration
public class SentinelConfiguration {

    /**
     * Topology tables; an unknown role name fails startup here.
     */
    @Bean
    public TopologyRegistry topologyRegistry(SentinelProperties properties) {
        return TopologyRegistry.fromProperties(properties.getTopology());
    }

    @Bean
    public Clock sentinelClock() {
        return Clock.systemUTC();
    }
}
