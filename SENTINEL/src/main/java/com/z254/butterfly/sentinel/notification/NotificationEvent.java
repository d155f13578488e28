package com.z254.butterfly.sentinel.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire form of a notification published to Kafka as JSON.
 */
public record NotificationEvent(String eventId,
                                String kind,
                                String channel,
                                String severity,
                                String serviceName,
                                String title,
                                String message,
                                String alertId,
                                String incidentId,
                                String reason,
                                Instant createdAt) {

    public static NotificationEvent from(Notification notification, NotificationChannel channel) {
        return new NotificationEvent(
                UUID.randomUUID().toString(),
                notification.getKind().name(),
                channel.name(),
                notification.getSeverity().name(),
                notification.getServiceName(),
                notification.getTitle(),
                notification.getMessage(),
                notification.getAlertId(),
                notification.getIncidentId(),
                notification.getReason(),
                notification.getCreatedAt());
    }
}
