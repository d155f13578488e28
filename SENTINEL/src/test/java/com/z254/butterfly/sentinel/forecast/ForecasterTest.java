package com.z254.butterfly.sentinel.forecast;

import com.z254.butterfly.sentinel.common.ErrorKind;
import com.z254.butterfly.sentinel.common.Result;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.support.MutableClock;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForecasterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private final Forecaster forecaster = new Forecaster(new SentinelProperties(), clock);

    @Test
    void shortSeriesIsInsufficientData() {
        Result<Forecast> result = forecaster.predict(MetricWindow.of("checkout", "cpu_usage", 0.1, 0.2, 0.3));

        assertThat(result.isOk()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.INSUFFICIENT_DATA);
    }

    @Test
    void horizonMustBePositive() {
        assertThatThrownBy(() -> forecaster.predict(line(12, 0.1, 0.01), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Linear path")
    class Linear {

        @Test
        void continuesAStraightLine() {
            Forecast forecast = forecaster.predict(line(12, 0.10, 0.02), 3).getValue();

            assertThat(forecast.method()).isEqualTo(ForecastMethod.LINEAR);
            assertThat(forecast.values()[0]).isCloseTo(0.34, within(1e-9));
            assertThat(forecast.values()[2]).isCloseTo(0.38, within(1e-9));
            assertThat(forecast.confidence()).isEqualTo(0.9);
            assertThat(forecast.currentValue()).isCloseTo(0.32, within(1e-9));
        }

        @Test
        void pointsAreStepSpacedAfterTheNewestSample() {
            MetricWindow window = line(12, 0.10, 0.02);
            Forecast forecast = forecaster.predict(window, 2).getValue();

            assertThat(forecast.points().get(0).time())
                    .isEqualTo(window.latestTimestamp().plus(Duration.ofMinutes(1)));
            assertThat(forecast.points().get(1).time())
                    .isEqualTo(window.latestTimestamp().plus(Duration.ofMinutes(2)));
        }

        @Test
        void stampedByTheInjectedClock() {
            clock.advance(Duration.ofHours(3));

            Forecast forecast = forecaster.predict(line(12, 0.10, 0.02)).getValue();

            assertThat(forecast.generatedAt()).isEqualTo(Instant.parse("2024-03-04T13:00:00Z"));
        }

        @Test
        void flatSeriesIsProjectedWithHighConfidence() {
            Forecast forecast = forecaster.predict(line(12, 0.5, 0.0)).getValue();

            assertThat(forecast.horizon()).isEqualTo(15);
            assertThat(forecast.maxValue()).isCloseTo(0.5, within(1e-9));
            assertThat(forecast.confidence()).isEqualTo(0.9);
        }

        @Test
        void noisySeriesHasAnIntervalAroundEveryPoint() {
            Forecast forecast = forecaster.predict(MetricWindow.of("checkout", "latency_ms",
                    100, 130, 95, 140, 110, 150, 105, 160, 120, 170, 115, 180)).getValue();

            assertThat(forecast.residualStd()).isPositive();
            assertThat(forecast.points()).allSatisfy(point -> {
                assertThat(point.lower()).isLessThan(point.value());
                assertThat(point.upper()).isGreaterThan(point.value());
            });
        }
    }

    @Nested
    @DisplayName("Smoothing path")
    class Smoothing {

        @Test
        void trendedSeriesUsesHolt() {
            Forecast forecast = forecaster.predict(noisyTrend(22)).getValue();

            assertThat(forecast.method()).isEqualTo(ForecastMethod.HOLT);
            assertThat(forecast.confidence()).isBetween(0.1, 0.95);
            assertThat(forecast.values()[forecast.horizon() - 1]).isGreaterThan(forecast.currentValue());
        }

        @Test
        void twoFullSeasonsEnableHoltWinters() {
            Forecast forecast = forecaster.predict(noisyTrend(36)).getValue();

            assertThat(forecast.method()).isEqualTo(ForecastMethod.HOLT_WINTERS);
            assertThat(forecast.confidence()).isBetween(0.1, 0.95);
        }
    }

    static MetricWindow line(int n, double start, double slope) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = start + slope * i;
        }
        return MetricWindow.of("checkout", "cpu_usage", values);
    }

    private static MetricWindow noisyTrend(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 100 + 2.0 * i + (i % 3 == 0 ? 3.0 : -1.5);
        }
        return MetricWindow.of("checkout", "request_rate", values);
    }
}
