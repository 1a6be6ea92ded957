package com.z254.netwatch.sentinel.exception;

/**
 * Raised when an inbound feature bin or anomaly event is missing required fields
 * or carries values outside their domain.
 */
public class InvalidSignalException extends RuntimeException {

    private final String signalType;

    public InvalidSignalException(String signalType, String message) {
        super(signalType + " rejected: " + message);
        this.signalType = signalType;
    }

    public String getSignalType() {
        return signalType;
    }
}
