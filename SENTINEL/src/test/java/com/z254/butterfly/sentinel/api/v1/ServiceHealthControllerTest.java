package com.z254.butterfly.sentinel.api.v1;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.engine.SentinelEngine;
import com.z254.butterfly.sentinel.health.HealthStatus;
import com.z254.butterfly.sentinel.health.ServiceHealthScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ServiceHealthControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Mock
    private SentinelEngine engine;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new ServiceHealthController(engine), new AlertController(engine))
                .build();
    }

    @Test
    @DisplayName("should return service health")
    void returnsHealth() {
        when(engine.getServiceHealth("checkout")).thenReturn(new ServiceHealthScore(
                "checkout", 92.5, 95, 100, 85, 90, HealthStatus.HEALTHY, NOW, 7));

        webTestClient.get()
                .uri("/api/v1/services/checkout/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overallScore").isEqualTo(92.5)
                .jsonPath("$.status").isEqualTo("HEALTHY");
    }

    @Test
    @DisplayName("should return 404 when no forecast exists")
    void missingForecast() {
        when(engine.getCapacityForecast("checkout", "cpu_usage")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/forecasts/checkout/cpu_usage")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("should list active alerts with non-negative limit")
    void listsAlerts() {
        when(engine.getActiveAlerts(0)).thenReturn(List.of());
        when(engine.getActiveAlerts(10)).thenReturn(List.of(Alert.builder()
                .id("a1")
                .serviceName("checkout")
                .metricName("cpu_usage")
                .type(AnomalyType.CPU_SATURATION)
                .severity(AlertSeverity.CRITICAL)
                .createdAt(NOW)
                .build()));

        webTestClient.get()
                .uri("/api/v1/alerts?limit=10")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("a1")
                .jsonPath("$[0].severity").isEqualTo("CRITICAL");

        webTestClient.get()
                .uri("/api/v1/alerts?limit=-5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }
}
