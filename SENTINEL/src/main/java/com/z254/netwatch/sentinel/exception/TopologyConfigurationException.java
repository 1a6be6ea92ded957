package com.z254.netwatch.sentinel.exception;

/**
 * Static topology tables could not be loaded; fails application startup.
 */
public class TopologyConfigurationException extends RuntimeException {

    public TopologyConfigurationException(String message) {
        super(message);
    }
}
