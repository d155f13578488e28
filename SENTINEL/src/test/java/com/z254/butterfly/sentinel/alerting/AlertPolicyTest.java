package com.z254.butterfly.sentinel.alerting;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.forecast.Forecast;
import com.z254.butterfly.sentinel.forecast.ForecastMethod;
import com.z254.butterfly.sentinel.forecast.ForecastPoint;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AlertPolicyTest {

    private final AlertPolicy policy = new AlertPolicy(new SentinelProperties().getAlerting());

    @ParameterizedTest(name = "{0} as {1} -> {2}")
    @CsvSource({
            "0.70, CPU_SATURATION, LOW",
            "0.75, CPU_SATURATION, MEDIUM",
            "0.85, LATENCY_INCREASE, HIGH",
            "0.95, MEMORY_LEAK, CRITICAL",
            "0.75, ERROR_SPIKE, HIGH",
            "0.85, DEPENDENCY_FAILURE, CRITICAL",
            "0.99, RESOURCE_EXHAUSTION, EMERGENCY"
    })
    void severityFollowsScoreBands(double score, AnomalyType type, AlertSeverity expected) {
        assertThat(policy.severity(score, type)).isEqualTo(expected);
    }

    @Test
    void emergencyIsTheCeiling() {
        assertThat(AlertSeverity.EMERGENCY.escalate()).isEqualTo(AlertSeverity.EMERGENCY);
    }

    @Nested
    @DisplayName("Time to impact")
    class TimeToImpact {

        private final Duration step = Duration.ofMinutes(1);

        @Test
        void firstForecastPointAboveTheImpactThreshold() {
            MetricWindow window = MetricWindow.of("checkout", "cpu_usage", 0.5, 0.5, 0.5, 0.5, 0.5, 0.5);
            Forecast forecast = forecast(0.55, 0.60, 0.64, 0.70, 0.80);

            Duration impact = policy.timeToImpact(window, AnomalyType.CPU_SATURATION, Optional.of(forecast), step);

            assertThat(impact).isEqualTo(Duration.ofMinutes(4));
        }

        @Test
        void memoryLeaksUseAWiderThreshold() {
            MetricWindow window = MetricWindow.of("checkout", "memory_usage", 0.4, 0.4, 0.4, 0.4, 0.4, 0.4);
            Forecast forecast = forecast(0.55, 0.58, 0.62, 0.65);

            Duration impact = policy.timeToImpact(window, AnomalyType.MEMORY_LEAK, Optional.of(forecast), step);

            assertThat(impact).isEqualTo(Duration.ofMinutes(3));
        }

        @Test
        void neverCrossingMeansTheWholeHorizon() {
            MetricWindow window = MetricWindow.of("checkout", "cpu_usage", 0.5, 0.5, 0.5, 0.5, 0.5, 0.5);

            Duration impact = policy.timeToImpact(window, AnomalyType.CPU_SATURATION,
                    Optional.of(forecast(0.5, 0.5, 0.5)), step);

            assertThat(impact).isEqualTo(Duration.ofMinutes(3));
        }

        @Test
        void withoutForecastTheDefaultWindowApplies() {
            MetricWindow window = MetricWindow.of("checkout", "cpu_usage", 0.5, 0.5, 0.5, 0.5, 0.5, 0.5);

            assertThat(policy.timeToImpact(window, AnomalyType.CPU_SATURATION, Optional.empty(), step))
                    .isEqualTo(Duration.ofMinutes(15));
        }
    }

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        void criticalAlertsAreBracketedByRestartAndEscalation() {
            List<String> actions = policy.recommendations("checkout", AnomalyType.PERFORMANCE_DEGRADATION,
                    AlertSeverity.CRITICAL);

            assertThat(actions).hasSize(6);
            assertThat(actions.get(0)).isEqualTo("URGENT: Consider immediate checkout service restart");
            assertThat(actions.get(actions.size() - 1)).isEqualTo("Escalate to on-call engineer immediately");
        }

        @Test
        void lowerSeveritiesGetThePlainPlaybook() {
            assertThat(policy.recommendations("checkout", AnomalyType.THROUGHPUT_DROP, AlertSeverity.MEDIUM))
                    .containsExactly("Check load balancer configuration",
                            "Verify upstream traffic sources",
                            "Review rate limiting settings");
        }

        @Test
        void onlyMildPerformanceAndThroughputAlertsAreAutoResolvable() {
            assertThat(policy.isAutoResolvable(AnomalyType.THROUGHPUT_DROP, AlertSeverity.HIGH)).isTrue();
            assertThat(policy.isAutoResolvable(AnomalyType.THROUGHPUT_DROP, AlertSeverity.CRITICAL)).isFalse();
            assertThat(policy.isAutoResolvable(AnomalyType.ERROR_SPIKE, AlertSeverity.LOW)).isFalse();
        }
    }

    @Test
    void alertIdIsStableForTheSameInputs() {
        Instant at = Instant.parse("2024-03-04T10:00:00Z");

        String id = AlertPolicy.alertId("checkout", "cpu_usage", AnomalyType.CPU_SATURATION, AlertSeverity.HIGH, at);

        assertThat(id).hasSize(12);
        assertThat(AlertPolicy.alertId("checkout", "cpu_usage", AnomalyType.CPU_SATURATION, AlertSeverity.HIGH, at))
                .isEqualTo(id);
        assertThat(AlertPolicy.alertId("checkout", "cpu_usage", AnomalyType.CPU_SATURATION, AlertSeverity.HIGH,
                at.plusMillis(1))).isNotEqualTo(id);
        assertThat(AlertPolicy.alertId("checkout", "cpu_usage", AnomalyType.CPU_SATURATION, AlertSeverity.CRITICAL, at))
                .isNotEqualTo(id);
    }

    private static Forecast forecast(double... values) {
        Instant origin = Instant.parse("2024-03-04T10:00:00Z");
        List<ForecastPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new ForecastPoint(origin.plus(Duration.ofMinutes(i + 1L)), values[i], values[i], values[i]));
        }
        return new Forecast(null, ForecastMethod.LINEAR, values[0], points, 0.8, 0.0, origin);
    }
}
