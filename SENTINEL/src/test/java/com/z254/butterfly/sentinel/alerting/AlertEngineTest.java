package com.z254.butterfly.sentinel.alerting;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyResult;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.detection.AnomalyTypeClassifier;
import com.z254.butterfly.sentinel.detection.DetectionMethod;
import com.z254.butterfly.sentinel.forecast.CapacityForecast;
import com.z254.butterfly.sentinel.forecast.ForecastMethod;
import com.z254.butterfly.sentinel.forecast.ForecastPoint;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.support.MutableClock;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    private SentinelProperties properties;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private AlertEngine alertEngine;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        rebuild();
    }

    private void rebuild() {
        TelemetryBuffer buffer = new TelemetryBuffer(properties);
        alertEngine = new AlertEngine(properties, new RootCauseAnalyzer(buffer, properties),
                new AnomalyTypeClassifier(), new SentinelMetrics(meterRegistry), new SentinelStructuredLogger(), clock);
    }

    @Nested
    @DisplayName("Alert creation")
    class Creation {

        @Test
        void ignoresNormalAndWeakVerdicts() {
            MetricWindow window = cpuWindow();

            assertThat(alertEngine.evaluate(verdict(false, 1.0, AnomalyType.CPU_SATURATION), window,
                    Optional.empty(), null)).isEmpty();
            assertThat(alertEngine.evaluate(verdict(true, 0.69, AnomalyType.CPU_SATURATION), window,
                    Optional.empty(), null)).isEmpty();
        }

        @Test
        void saturatedScoreRaisesACriticalAlert() {
            Alert alert = alertEngine.evaluate(verdict(true, 1.0, AnomalyType.CPU_SATURATION), cpuWindow(),
                    Optional.empty(), 72.5).orElseThrow();

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.getSource()).isEqualTo(AlertSource.ANOMALY);
            assertThat(alert.getId()).hasSize(12).matches("[0-9a-f]+");
            assertThat(alert.isSuppressed()).isFalse();
            assertThat(alert.isAutoResolvable()).isFalse();
            assertThat(alert.getTimeToImpact()).isEqualTo(Duration.ofMinutes(15));
            assertThat(alert.getServiceHealthScore()).isEqualTo(72.5);
            assertThat(alert.getRecommendedActions().get(0)).startsWith("URGENT");
            assertThat(alert.getPredictedImpact()).startsWith("CRITICAL:");
            assertThat(alertEngine.getActiveAlerts(10)).containsExactly(alert);
        }

        @Test
        void cascadingTypesAreBumpedOneLevel() {
            Alert alert = alertEngine.evaluate(verdict(true, 0.9, AnomalyType.ERROR_SPIKE),
                    MetricWindow.of("checkout", "error_rate", 0.01, 0.01, 0.01, 0.01, 0.01, 0.3),
                    Optional.empty(), null).orElseThrow();

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        }

        @Test
        void shortHistoryGetsTheShortImpactWindow() {
            Alert alert = alertEngine.evaluate(verdict(true, 0.8, AnomalyType.CPU_SATURATION),
                    MetricWindow.of("checkout", "cpu_usage", 0.4, 0.95), Optional.empty(), null).orElseThrow();

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
            assertThat(alert.getTimeToImpact()).isEqualTo(Duration.ofMinutes(5));
        }
    }

    @Nested
    @DisplayName("Deduplication")
    class Deduplication {

        @Test
        void repeatInsideTheWindowIsSuppressed() {
            Alert first = raise(AnomalyType.CPU_SATURATION, 1.0);
            clock.advance(Duration.ofMinutes(1));
            Alert repeat = raise(AnomalyType.CPU_SATURATION, 1.0);

            assertThat(first.isSuppressed()).isFalse();
            assertThat(repeat.isSuppressed()).isTrue();
            assertThat(alertEngine.bufferedAlerts()).isEqualTo(1);
            assertThat(meterRegistry.counter("sentinel.alerts.suppressed").count()).isEqualTo(1.0);
        }

        @Test
        void differentSeverityIsNotADuplicate() {
            raise(AnomalyType.CPU_SATURATION, 1.0);
            Alert lower = raise(AnomalyType.CPU_SATURATION, 0.8);

            assertThat(lower.isSuppressed()).isFalse();
            assertThat(alertEngine.bufferedAlerts()).isEqualTo(2);
        }

        @Test
        void repeatAfterTheWindowSurfacesAgain() {
            raise(AnomalyType.CPU_SATURATION, 1.0);
            clock.advance(Duration.ofMinutes(16));
            Alert later = raise(AnomalyType.CPU_SATURATION, 1.0);

            assertThat(later.isSuppressed()).isFalse();
            assertThat(alertEngine.getActiveAlerts(10)).containsExactly(later);
        }
    }

    @Nested
    @DisplayName("Correlation")
    class Correlation {

        @Test
        void singleAlertDoesNotCorrelate() {
            Alert alert = raise(AnomalyType.CPU_SATURATION, 1.0);

            assertThat(alertEngine.correlate(alert)).isEmpty();
        }

        @Test
        void concurrentAlertsOnOneServiceShareARecord() {
            Alert cpu = raise(AnomalyType.CPU_SATURATION, 0.9);
            clock.advance(Duration.ofMinutes(1));
            Alert memory = alertEngine.evaluate(verdict(true, 1.0, AnomalyType.RESOURCE_EXHAUSTION),
                    MetricWindow.of("checkout", "memory_usage", 0.5, 0.5, 0.5, 0.5, 0.5, 0.97),
                    Optional.empty(), null).orElseThrow();

            CorrelationRecord record = alertEngine.correlate(memory).orElseThrow();

            assertThat(record.getAlertIds()).containsExactlyInAnyOrder(cpu.getId(), memory.getId());
            assertThat(record.getAlertTypes())
                    .containsExactlyInAnyOrder(AnomalyType.CPU_SATURATION, AnomalyType.RESOURCE_EXHAUSTION);
            assertThat(record.getMaxSeverity()).isEqualTo(AlertSeverity.EMERGENCY);
            assertThat(record.getCorrelationScore()).isEqualTo(0.85);
            assertThat(record.getRootCause()).contains("checkout");
            assertThat(record.hasIncident()).isFalse();
            assertThat(meterRegistry.counter("sentinel.alerts.correlations").count()).isEqualTo(1.0);
        }

        @Test
        void furtherAlertsExtendTheSameRecord() {
            raise(AnomalyType.CPU_SATURATION, 0.9);
            Alert second = raise(AnomalyType.CPU_SATURATION, 1.0);
            String id = alertEngine.correlate(second).orElseThrow().getId();
            Alert third = raise(AnomalyType.CPU_SATURATION, 0.8);

            CorrelationRecord extended = alertEngine.correlate(third).orElseThrow();

            assertThat(extended.getId()).isEqualTo(id);
            assertThat(extended.getAlertIds()).hasSize(3);
            assertThat(alertEngine.getCorrelations()).hasSize(1);
            assertThat(meterRegistry.counter("sentinel.alerts.correlations").count()).isEqualTo(1.0);
        }

        @Test
        void linkingAnIncidentMarksTheRecord() {
            raise(AnomalyType.CPU_SATURATION, 0.9);
            Alert second = raise(AnomalyType.CPU_SATURATION, 1.0);
            alertEngine.correlate(second);

            alertEngine.linkIncident(second, "INC-1");

            assertThat(second.getIncidentId()).isEqualTo("INC-1");
            assertThat(alertEngine.getCorrelation("checkout")).hasValueSatisfying(record ->
                    assertThat(record.getIncidentIds()).containsExactly("INC-1"));
        }

        @Test
        void suppressedAlertNeverCorrelates() {
            raise(AnomalyType.CPU_SATURATION, 0.9);
            raise(AnomalyType.CPU_SATURATION, 1.0);
            Alert repeat = raise(AnomalyType.CPU_SATURATION, 1.0);

            assertThat(repeat.isSuppressed()).isTrue();
            assertThat(alertEngine.correlate(repeat)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Predictive alerts")
    class Predictive {

        @Test
        void capacityAtRiskRaisesAForecastAlert() {
            CapacityForecast forecast = capacity(Duration.ofMinutes(5));

            Alert alert = alertEngine.evaluatePredictive(forecast, cpuWindow(), null).orElseThrow();

            assertThat(alert.getSource()).isEqualTo(AlertSource.FORECAST);
            assertThat(alert.getAnomalyScore()).isCloseTo(0.9, within(1e-9));
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(alert.getTimeToImpact()).isEqualTo(Duration.ofMinutes(5));
            assertThat(alert.getRootCause().getContributingFactors().get(0)).contains("projected to reach 0.90");
        }

        @Test
        void forecastWithinLimitRaisesNothing() {
            assertThat(alertEngine.evaluatePredictive(capacity(null), cpuWindow(), null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        void compactsTheBufferToTheLatestAlertPerType() {
            properties.getAlerting().setMaxBufferedAlerts(2);
            rebuild();
            raise(AnomalyType.CPU_SATURATION, 0.8);
            clock.advance(Duration.ofSeconds(10));
            raise(AnomalyType.CPU_SATURATION, 0.9);
            clock.advance(Duration.ofSeconds(10));
            Alert newest = raise(AnomalyType.CPU_SATURATION, 1.0);

            int evicted = alertEngine.maintain();

            assertThat(evicted).isEqualTo(2);
            assertThat(alertEngine.getRecentAlerts()).containsExactly(newest);
        }

        @Test
        void compactionRunningAlongsideSurfacingLosesNoAlert() throws Exception {
            properties.getAlerting().setMaxBufferedAlerts(0);
            rebuild();
            AtomicBoolean surfacing = new AtomicBoolean(true);
            Thread compactor = new Thread(() -> {
                while (surfacing.get()) {
                    alertEngine.maintain();
                }
            });
            compactor.start();

            int services = 2_000;
            try {
                for (int i = 0; i < services; i++) {
                    MetricWindow window = MetricWindow.of("svc-" + i, "cpu_usage", 0.4, 0.4, 0.4, 0.4, 0.4, 0.93);
                    alertEngine.evaluate(verdict(true, 1.0, AnomalyType.CPU_SATURATION), window,
                            Optional.empty(), null);
                }
            } finally {
                surfacing.set(false);
                compactor.join(10_000);
            }
            alertEngine.maintain();

            assertThat(alertEngine.bufferedAlerts()).isEqualTo(services);
            assertThat(alertEngine.getRecentAlerts(services))
                    .extracting(Alert::getServiceName)
                    .doesNotHaveDuplicates()
                    .hasSize(services);
        }

        @Test
        void expiredCorrelationsAreDropped() {
            raise(AnomalyType.CPU_SATURATION, 0.9);
            alertEngine.correlate(raise(AnomalyType.CPU_SATURATION, 1.0));
            clock.advance(Duration.ofMinutes(20));

            alertEngine.maintain();

            assertThat(alertEngine.getCorrelations()).isEmpty();
            assertThat(alertEngine.getActiveAlerts(10)).isEmpty();
        }
    }

    @Test
    void activeAlertsAreOrderedMostSevereFirst() {
        Alert medium = raise(AnomalyType.CPU_SATURATION, 0.8);
        Alert critical = raise(AnomalyType.CPU_SATURATION, 1.0);
        Alert high = raise(AnomalyType.CPU_SATURATION, 0.9);

        assertThat(alertEngine.getActiveAlerts(10)).containsExactly(critical, high, medium);
        assertThat(alertEngine.getActiveAlerts(1)).containsExactly(critical);
        assertThat(AlertEngine.bySeverity(List.of(medium, high, critical))).containsExactly(critical, high, medium);
    }

    private Alert raise(AnomalyType type, double score) {
        clock.advance(Duration.ofSeconds(1));
        return alertEngine.evaluate(verdict(true, score, type), cpuWindow(), Optional.empty(), null).orElseThrow();
    }

    private static AnomalyResult verdict(boolean anomaly, double score, AnomalyType type) {
        return new AnomalyResult(anomaly, score, type, score, DetectionMethod.STATISTICAL, null);
    }

    private static MetricWindow cpuWindow() {
        double[] values = new double[20];
        for (int i = 0; i < 19; i++) {
            values[i] = i % 2 == 0 ? 0.40 : 0.42;
        }
        values[19] = 0.93;
        return MetricWindow.of("checkout", "cpu_usage", values);
    }

    private static CapacityForecast capacity(Duration timeToCapacity) {
        List<ForecastPoint> points = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            points.add(new ForecastPoint(T0.plus(Duration.ofMinutes(i)), 0.8 + i * 0.02, 0.78, 1.0));
        }
        return CapacityForecast.builder()
                .serviceName("checkout")
                .metricName("cpu_usage")
                .currentValue(0.8)
                .forecastPoints(points)
                .capacityLimit(0.9)
                .timeToCapacity(timeToCapacity)
                .confidence(0.8)
                .method(ForecastMethod.LINEAR)
                .build();
    }
}
