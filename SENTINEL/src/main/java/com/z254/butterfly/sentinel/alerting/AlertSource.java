package com.z254.butterfly.sentinel.alerting;

public enum AlertSource {
    /** Raised from an anomalous sample */
    ANOMALY,
    /** Raised from a capacity forecast crossing its limit */
    FORECAST
}
