package com.z254.butterfly.sentinel.engine;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.domain.model.Incident;

import java.util.List;

/**
 * What one detection or forecast pass surfaced, alerts most severe first.
 */
public record DetectionCycleResult(int seriesExamined,
                                   List<Alert> alerts,
                                   List<Incident> incidents) {

    public static DetectionCycleResult empty() {
        return new DetectionCycleResult(0, List.of(), List.of());
    }
}
