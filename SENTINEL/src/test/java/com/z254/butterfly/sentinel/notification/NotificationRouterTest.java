package com.z254.butterfly.sentinel.notification;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentSeverity;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.support.RecordingNotificationSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationRouterTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RecordingNotificationSink recording = new RecordingNotificationSink();
    private final NotificationRouter router = new NotificationRouter(
            List.of(new LoggingNotificationSink(), recording),
            new SentinelMetrics(meterRegistry),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void channelTiersWidenWithSeverity() {
        assertThat(NotificationRouter.channelsFor(AlertSeverity.LOW))
                .containsExactly(NotificationChannel.LOG);
        assertThat(NotificationRouter.channelsFor(AlertSeverity.MEDIUM))
                .containsExactly(NotificationChannel.LOG, NotificationChannel.CHAT, NotificationChannel.EMAIL);
        assertThat(NotificationRouter.channelsFor(AlertSeverity.HIGH)).hasSize(4)
                .contains(NotificationChannel.PAGER)
                .doesNotContain(NotificationChannel.SMS);
        assertThat(NotificationRouter.channelsFor(AlertSeverity.EMERGENCY))
                .isEqualTo(NotificationRouter.channelsFor(AlertSeverity.CRITICAL))
                .contains(NotificationChannel.SMS);
    }

    @Nested
    @DisplayName("Alerts")
    class Alerts {

        @Test
        void deliversOnEveryChannelOfTheTier() {
            Map<NotificationChannel, Boolean> outcome = router.notifyAlert(alert(AlertSeverity.HIGH));

            assertThat(outcome).hasSize(4).containsValues(true).doesNotContainValue(false);
            assertThat(recording.channelsFor("a1")).containsExactly(
                    NotificationChannel.LOG, NotificationChannel.CHAT, NotificationChannel.PAGER, NotificationChannel.EMAIL);
            assertThat(recording.deliveries().get(0).notification().getTitle())
                    .isEqualTo("HIGH Error spike on checkout");
            assertThat(meterRegistry.counter("sentinel.notifications.delivered", "channel", "PAGER").count())
                    .isEqualTo(1.0);
        }

        @Test
        void failingChannelDoesNotBlockTheOthers() {
            recording.failChannel(NotificationChannel.SMS);

            Map<NotificationChannel, Boolean> outcome = router.notifyAlert(alert(AlertSeverity.CRITICAL));

            assertThat(outcome).containsEntry(NotificationChannel.SMS, false)
                    .containsEntry(NotificationChannel.PAGER, true)
                    .containsEntry(NotificationChannel.LOG, true);
            assertThat(meterRegistry.counter("sentinel.notifications.failed", "channel", "SMS").count())
                    .isEqualTo(1.0);
        }

        @Test
        void channelWithoutSinkIsNotDelivered() {
            NotificationRouter logOnly = new NotificationRouter(List.of(new LoggingNotificationSink()),
                    new SentinelMetrics(meterRegistry), Clock.fixed(NOW, ZoneOffset.UTC));

            Map<NotificationChannel, Boolean> outcome = logOnly.notifyAlert(alert(AlertSeverity.MEDIUM));

            assertThat(outcome).containsEntry(NotificationChannel.LOG, true)
                    .containsEntry(NotificationChannel.CHAT, false)
                    .containsEntry(NotificationChannel.EMAIL, false);
        }
    }

    @Nested
    @DisplayName("Escalations")
    class Escalations {

        @Test
        void escalationUsesPeakAlertSeverityAndCarriesReason() {
            Incident incident = incident();
            incident.setPeakAlertSeverity(AlertSeverity.EMERGENCY);

            Map<NotificationChannel, Boolean> outcome = router.notifyEscalation(incident, "Resolution capacity exhausted");

            assertThat(outcome).containsKey(NotificationChannel.SMS);
            assertThat(recording.escalations()).singleElement().satisfies(notification -> {
                assertThat(notification.getSeverity()).isEqualTo(AlertSeverity.EMERGENCY);
                assertThat(notification.getReason()).isEqualTo("Resolution capacity exhausted");
                assertThat(notification.getTitle()).isEqualTo("Incident inc_1 escalated: high_error_rate");
                assertThat(notification.getCreatedAt()).isEqualTo(NOW);
            });
        }

        @Test
        void escalationRequiresReason() {
            assertThatThrownBy(() -> router.notifyEscalation(incident(), " "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("inc_1");
            assertThat(recording.deliveries()).isEmpty();
        }
    }

    private static Alert alert(AlertSeverity severity) {
        return Alert.builder()
                .id("a1")
                .serviceName("checkout")
                .metricName("error_rate")
                .type(AnomalyType.ERROR_SPIKE)
                .severity(severity)
                .predictedImpact("Error rate climbing")
                .createdAt(NOW)
                .build();
    }

    private static Incident incident() {
        return Incident.builder()
                .id("inc_1")
                .serviceName("checkout")
                .type(IncidentType.HIGH_ERROR_RATE)
                .severity(IncidentSeverity.HIGH)
                .description("high_error_rate detected in checkout")
                .build();
    }
}
