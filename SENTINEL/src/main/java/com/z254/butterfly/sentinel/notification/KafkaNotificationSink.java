package com.z254.butterfly.sentinel.notification;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Publishes human-facing notifications (email, chat, pager, sms) to a Kafka topic consumed
 * by the delivery gateway. Keyed by service so one service's notifications stay ordered.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.notification.kafka", name = "enabled", havingValue = "true")
public class KafkaNotificationSink implements NotificationSink {

    private static final Set<NotificationChannel> CHANNELS = EnumSet.of(
            NotificationChannel.EMAIL, NotificationChannel.CHAT, NotificationChannel.PAGER, NotificationChannel.SMS);

    private final KafkaTemplate<String, NotificationEvent> kafkaTemplate;
    private final SentinelMetrics metrics;
    private final String topic;

    public KafkaNotificationSink(KafkaTemplate<String, NotificationEvent> kafkaTemplate,
                                 SentinelProperties properties,
                                 SentinelMetrics metrics) {
        this.kafkaTemplate = kafkaTemplate;
        this.metrics = metrics;
        this.topic = properties.getNotification().getKafka().getTopic();
    }

    @Override
    public boolean supports(NotificationChannel channel) {
        return CHANNELS.contains(channel);
    }

    @Override
    public boolean send(Notification notification, NotificationChannel channel) {
        NotificationEvent event = NotificationEvent.from(notification, channel);
        try {
            kafkaTemplate.send(topic, notification.getServiceName(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            metrics.recordNotification(channel.name(), false);
                            log.error("Failed to publish notification: eventId={}, channel={}, error={}",
                                    event.eventId(), channel, ex.getMessage());
                        } else {
                            log.debug("Published notification: eventId={}, topic={}, partition={}",
                                    event.eventId(), topic, result.getRecordMetadata().partition());
                        }
                    });
            return true;
        } catch (RuntimeException e) {
            throw new NotificationDeliveryException(channel, "Kafka publish rejected: " + e.getMessage(), e);
        }
    }
}
