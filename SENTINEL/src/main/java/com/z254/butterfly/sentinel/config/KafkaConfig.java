package com.z254.butterfly.sentinel.config;

import com.z254.butterfly.sentinel.notification.NotificationEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for the notification topic. Only active when Kafka notifications are
 * enabled.
 */
@Configuration
@ConditionalOnProperty(prefix = "sentinel.notification.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final SentinelProperties sentinelProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, SentinelProperties sentinelProperties) {
        this.kafkaProperties = kafkaProperties;
        this.sentinelProperties = sentinelProperties;
    }

    /**
     * JSON producer factory with idempotent configuration.
     */
    @Bean
    public ProducerFactory<String, NotificationEvent> notificationProducerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        // Idempotent producer configuration
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRIES_CONFIG, Integer.MAX_VALUE);
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 100);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, NotificationEvent> notificationKafkaTemplate(
            ProducerFactory<String, NotificationEvent> notificationProducerFactory) {
        KafkaTemplate<String, NotificationEvent> template = new KafkaTemplate<>(notificationProducerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(sentinelProperties.getNotification().getKafka().getTopic())
                .partitions(6)
                .replicas(3)
                .build();
    }
}
