package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.domain.model.ClassificationMethod;
import com.z254.butterfly.sentinel.domain.model.IncidentSeverity;
import com.z254.butterfly.sentinel.domain.model.IncidentType;

/**
 * Incident type and severity decided for a detection.
 *
 * @param condition threshold that opened the incident
 */
public record Classification(IncidentType type,
                             IncidentSeverity severity,
                             double confidence,
                             ClassificationMethod method,
                             DetectionCondition condition) {
}
