package com.z254.butterfly.sentinel.detection;

public enum DetectionMethod {
    ENSEMBLE,
    STATISTICAL,
    NONE
}
