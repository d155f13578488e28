package com.z254.butterfly.sentinel.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Synchronous log channel; always present.
 */
@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public boolean supports(NotificationChannel channel) {
        return channel == NotificationChannel.LOG;
    }

    @Override
    public boolean send(Notification notification, NotificationChannel channel) {
        if (notification.getKind() == Notification.Kind.ESCALATION) {
            log.error("ESCALATION [{}] {} | reason={}", notification.getSeverity(), notification.getTitle(),
                    notification.getReason());
        } else if (notification.getSeverity().isCriticalOrAbove()) {
            log.error("ALERT [{}] {} | {}", notification.getSeverity(), notification.getTitle(),
                    notification.getMessage());
        } else {
            log.warn("ALERT [{}] {} | {}", notification.getSeverity(), notification.getTitle(),
                    notification.getMessage());
        }
        return true;
    }
}
