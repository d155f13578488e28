package com.z254.butterfly.sentinel.alerting;

import com.z254.butterfly.sentinel.detection.AnomalyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Actionable, severity-ranked signal about one service.
 * <p>
 * Content is fixed at creation; only the suppression flag and the incident link change
 * afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;

    private String serviceName;

    private String metricName;

    private AnomalyType type;

    private AlertSeverity severity;

    private AlertSource source;

    private double anomalyScore;

    private double confidence;

    private String predictedImpact;

    private Duration timeToImpact;

    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    private boolean autoResolvable;

    private RootCause rootCause;

    /** Overall health score of the service when the alert was raised, if known */
    private Double serviceHealthScore;

    private Instant createdAt;

    /** Set when the alert repeated one already surfaced inside the dedup window */
    private volatile boolean suppressed;

    /** Incident this alert was promoted to */
    private volatile String incidentId;

    public boolean isPromoted() {
        return incidentId != null;
    }
}
