package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.telemetry.MetricWindow;

/**
 * Decides whether the newest sample of a window is anomalous. Implementations are pure
 * functions of the window and may run in parallel across series.
 */
public interface Detector {

    AnomalyResult detect(MetricWindow window);

    /**
     * Short name used in logs and metrics.
     */
    String name();
}
