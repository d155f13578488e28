package com.z254.butterfly.sentinel.common;

/**
 * Expected, non-exceptional outcomes that stop a computation from producing a value.
 */
public enum ErrorKind {
    /** Fewer samples than the model requires; callers treat it as "no signal" */
    INSUFFICIENT_DATA,
    /** Trained model missing; a statistical fallback always exists */
    MODEL_UNAVAILABLE,
    /** A remediation action failed */
    ACTION_EXECUTION,
    /** Terminal routing decision that hands the incident to a human */
    ESCALATION_REQUIRED,
    /** Detection matched an already open incident and was merged into it */
    DUPLICATE_INCIDENT
}
