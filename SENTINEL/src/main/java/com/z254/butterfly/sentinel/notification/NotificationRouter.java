package com.z254.butterfly.sentinel.notification;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fans notifications out to the channels of their severity tier.
 * <ul>
 *     <li>LOW: log</li>
 *     <li>MEDIUM: log, chat, email</li>
 *     <li>HIGH: log, chat, pager, email</li>
 *     <li>CRITICAL and EMERGENCY: log, chat, pager, email, sms</li>
 * </ul>
 * A channel counts as delivered when any sink supporting it delivered.
 */
@Slf4j
@Component
public class NotificationRouter {

    private final List<NotificationSink> sinks;
    private final SentinelMetrics metrics;
    private final Clock clock;

    public NotificationRouter(List<NotificationSink> sinks, SentinelMetrics metrics, Clock clock) {
        this.sinks = sinks;
        this.metrics = metrics;
        this.clock = clock;
    }

    public static List<NotificationChannel> channelsFor(AlertSeverity severity) {
        return switch (severity) {
            case LOW -> List.of(NotificationChannel.LOG);
            case MEDIUM -> List.of(NotificationChannel.LOG, NotificationChannel.CHAT, NotificationChannel.EMAIL);
            case HIGH -> List.of(NotificationChannel.LOG, NotificationChannel.CHAT, NotificationChannel.PAGER,
                    NotificationChannel.EMAIL);
            case CRITICAL, EMERGENCY -> List.of(NotificationChannel.LOG, NotificationChannel.CHAT,
                    NotificationChannel.PAGER, NotificationChannel.EMAIL, NotificationChannel.SMS);
        };
    }

    public Map<NotificationChannel, Boolean> notifyAlert(Alert alert) {
        return dispatch(Notification.forAlert(alert));
    }

    /**
     * Route an escalation; the reason is mandatory.
     */
    public Map<NotificationChannel, Boolean> notifyEscalation(Incident incident, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Escalation of " + incident.getId() + " requires a reason");
        }
        return dispatch(Notification.forEscalation(incident, reason, clock.instant()));
    }

    Map<NotificationChannel, Boolean> dispatch(Notification notification) {
        Map<NotificationChannel, Boolean> outcome = new EnumMap<>(NotificationChannel.class);
        for (NotificationChannel channel : channelsFor(notification.getSeverity())) {
            boolean delivered = false;
            for (NotificationSink sink : sinks) {
                if (!sink.supports(channel)) {
                    continue;
                }
                try {
                    delivered |= sink.send(notification, channel);
                } catch (NotificationDeliveryException e) {
                    log.warn("Notification delivery failed: channel={}, sink={}, error={}",
                            channel, sink.getClass().getSimpleName(), e.getMessage());
                }
            }
            if (!delivered) {
                log.debug("No sink delivered {} notification on {}", notification.getKind(), channel);
            }
            metrics.recordNotification(channel.name(), delivered);
            outcome.put(channel, delivered);
        }
        return outcome;
    }
}
