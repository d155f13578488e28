package com.z254.butterfly.sentinel.notification;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import com.z254.butterfly.sentinel.domain.model.Incident;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message handed to notification sinks: either a surfaced alert or an incident escalation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private Kind kind;

    private AlertSeverity severity;

    private String serviceName;

    private String title;

    private String message;

    private String alertId;

    private String incidentId;

    /** Why a human is needed; set for escalations */
    private String reason;

    private Instant createdAt;

    public static Notification forAlert(Alert alert) {
        return Notification.builder()
                .kind(Kind.ALERT)
                .severity(alert.getSeverity())
                .serviceName(alert.getServiceName())
                .title(alert.getSeverity() + " " + alert.getType().getDisplayName() + " on " + alert.getServiceName())
                .message(alert.getPredictedImpact())
                .alertId(alert.getId())
                .incidentId(alert.getIncidentId())
                .createdAt(alert.getCreatedAt())
                .build();
    }

    public static Notification forEscalation(Incident incident, String reason, Instant at) {
        return Notification.builder()
                .kind(Kind.ESCALATION)
                .severity(incident.notificationSeverity())
                .serviceName(incident.getServiceName())
                .title("Incident " + incident.getId() + " escalated: " + incident.getType().code())
                .message(incident.getDescription())
                .incidentId(incident.getId())
                .reason(reason)
                .createdAt(at)
                .build();
    }

    public enum Kind {
        ALERT,
        ESCALATION
    }
}
