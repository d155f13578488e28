package com.z254.butterfly.sentinel.domain.model;

public enum ClassificationMethod {
    /** Threshold detection conditions */
    RULES,
    /** Trained nearest-centroid classifier */
    MODEL
}
