package com.z254.butterfly.sentinel.telemetry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryBufferTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    @Nested
    @DisplayName("Bounded history")
    class BoundedHistory {

        @Test
        void keepsOnlyTheNewestSamplesOfASeries() {
            TelemetryBuffer buffer = new TelemetryBuffer(3);
            for (int i = 0; i < 5; i++) {
                buffer.ingest("checkout", "cpu_usage", i, T0.plusSeconds(i));
            }

            assertThat(buffer.window("checkout", "cpu_usage", 10).values()).containsExactly(2.0, 3.0, 4.0);
            assertThat(buffer.size(new MetricKey("checkout", "cpu_usage"))).isEqualTo(3);
            assertThat(buffer.totalSamples()).isEqualTo(5);
        }

        @Test
        void windowReturnsTheLastNOldestFirst() {
            TelemetryBuffer buffer = new TelemetryBuffer(10);
            for (int i = 1; i <= 4; i++) {
                buffer.ingest("checkout", "latency_ms", i * 10, T0.plusSeconds(i));
            }

            MetricWindow window = buffer.window("checkout", "latency_ms", 2);

            assertThat(window.values()).containsExactly(30.0, 40.0);
            assertThat(window.latestValue()).isEqualTo(40.0);
        }

        @Test
        void unknownSeriesYieldsAnEmptyWindow() {
            TelemetryBuffer buffer = new TelemetryBuffer(10);

            assertThat(buffer.window("nope", "cpu_usage", 5).isEmpty()).isTrue();
            assertThat(buffer.latest("nope", "cpu_usage")).isEmpty();
            assertThat(buffer.metricsFor("nope")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Per-service views")
    class ServiceViews {

        @Test
        void latestValuesCoverEveryMetricOfTheService() {
            TelemetryBuffer buffer = new TelemetryBuffer(10);
            buffer.ingest("checkout", "cpu_usage", 0.4, T0);
            buffer.ingest("checkout", "cpu_usage", 0.6, T0.plusSeconds(1));
            buffer.ingest("checkout", "error_rate", 0.01, T0);
            buffer.ingest("payments", "cpu_usage", 0.9, T0);

            assertThat(buffer.latestValues("checkout"))
                    .containsEntry("cpu_usage", 0.6)
                    .containsEntry("error_rate", 0.01)
                    .hasSize(2);
            assertThat(buffer.services()).containsExactly("checkout", "payments");
        }

        @Test
        void versionMovesWithEverySampleOfTheService() {
            TelemetryBuffer buffer = new TelemetryBuffer(10);
            assertThat(buffer.version("checkout")).isZero();

            buffer.ingest("checkout", "cpu_usage", 0.4, T0);
            buffer.ingest("payments", "cpu_usage", 0.4, T0);
            buffer.ingest("checkout", "memory_usage", 0.4, T0);

            assertThat(buffer.version("checkout")).isEqualTo(2);
            assertThat(buffer.version("payments")).isEqualTo(1);
        }
    }

    @Test
    void rejectsMalformedSamples() {
        TelemetryBuffer buffer = new TelemetryBuffer(10);

        assertThatThrownBy(() -> buffer.ingest(" ", "cpu_usage", 0.1, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> buffer.ingest("checkout", "cpu_usage", Double.NaN, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> buffer.ingest("checkout", "cpu_usage", 0.1, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(buffer.totalSamples()).isZero();
    }
}
