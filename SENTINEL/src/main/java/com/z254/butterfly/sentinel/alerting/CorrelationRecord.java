package com.z254.butterfly.sentinel.alerting;

import com.z254.butterfly.sentinel.detection.AnomalyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Group of concurrent alerts on one service that likely share a root cause.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationRecord {

    private String id;

    private String serviceName;

    @Builder.Default
    private Set<String> alertIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> incidentIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<AnomalyType> alertTypes = new LinkedHashSet<>();

    private AlertSeverity maxSeverity;

    private String rootCause;

    private double correlationScore;

    private Instant createdAt;

    private Instant updatedAt;

    public boolean hasIncident() {
        return !incidentIds.isEmpty();
    }
}
