package com.z254.butterfly.sentinel.domain.model;

/**
 * Incident lifecycle. {@link #RESOLVED}, {@link #ESCALATED} and {@link #FAILED} are terminal.
 */
public enum IncidentStatus {
    DETECTED,
    CLASSIFYING,
    RESOLVING,
    RESOLVED,
    ESCALATED,
    FAILED;

    public boolean isTerminal() {
        return this == RESOLVED || this == ESCALATED || this == FAILED;
    }
}
