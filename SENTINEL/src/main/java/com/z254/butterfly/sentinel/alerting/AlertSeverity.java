package com.z254.butterfly.sentinel.alerting;

/**
 * Alert severity, ordered from least to most severe.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    EMERGENCY;

    /**
     * Map an anomaly score to a base severity: {@code >=0.95} critical, {@code >=0.85} high,
     * {@code >=0.75} medium, otherwise low.
     */
    public static AlertSeverity fromScore(double score) {
        if (score >= 0.95) {
            return CRITICAL;
        }
        if (score >= 0.85) {
            return HIGH;
        }
        if (score >= 0.75) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * One level up, saturating at {@link #EMERGENCY}.
     */
    public AlertSeverity escalate() {
        return this == EMERGENCY ? EMERGENCY : values()[ordinal() + 1];
    }

    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }

    public boolean isCriticalOrAbove() {
        return isAtLeast(CRITICAL);
    }
}
