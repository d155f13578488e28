package com.z254.butterfly.sentinel.domain.model;

import com.z254.butterfly.sentinel.alerting.AlertSeverity;

/**
 * Incident severity levels for triage and escalation.
 */
public enum IncidentSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Alert severities above {@link #CRITICAL} saturate at critical.
     */
    public static IncidentSeverity fromAlert(AlertSeverity severity) {
        return switch (severity) {
            case LOW -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH -> HIGH;
            case CRITICAL, EMERGENCY -> CRITICAL;
        };
    }

    public AlertSeverity toAlertSeverity() {
        return AlertSeverity.valueOf(name());
    }

    public boolean isAtLeast(IncidentSeverity other) {
        return compareTo(other) >= 0;
    }
}
