package com.z254.netwatch.sentinel.domain.model;

/**
 * Operational urgency tier derived from the criticality score.
 */
public enum Priority {
    P1,
    P2,
    P3;

    public static Priority fromScore(double score) {
        if (score >= 8.0) {
            return P1;
        }
        if (score >= 5.0) {
            return P2;
        }
        return P3;
    }

    public boolean isUrgent() {
        return this == P1 || this == P2;
    }
}
