package com.z254.butterfly.sentinel.forecast;

import com.z254.butterfly.sentinel.common.Result;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.telemetry.MetricSample;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Capacity exhaustion estimates on top of the {@link Forecaster}.
 * <p>
 * The limit comes from configuration, or is inferred as a multiple of the current value for
 * unbounded rate/time metrics, or defaults to 1.0 for utilisation-style metrics.
 */
@Component
public class CapacityForecaster {

    static final int DAILY_PATTERN_MIN_POINTS = 48;
    static final int WEEKLY_PATTERN_MIN_POINTS = 168;

    private final Forecaster forecaster;
    private final SentinelProperties.Capacity config;
    private final Clock clock;

    public CapacityForecaster(Forecaster forecaster, SentinelProperties properties, Clock clock) {
        this.forecaster = forecaster;
        this.config = properties.getCapacity();
        this.clock = clock;
    }

    public Result<CapacityForecast> forecast(MetricWindow window) {
        return forecaster.predict(window).map(forecast -> toCapacityForecast(window, forecast));
    }

    public double capacityLimit(String metricName, double currentValue) {
        Double configured = config.getLimits().get(metricName);
        if (configured != null) {
            return configured;
        }
        String lower = metricName.toLowerCase(Locale.ROOT);
        if ((lower.contains("rate") || lower.contains("time")) && currentValue > 0) {
            return currentValue * config.getUnboundedMultiplier();
        }
        return config.getDefaultLimit();
    }

    // ========== Private Methods ==========

    private CapacityForecast toCapacityForecast(MetricWindow window, Forecast forecast) {
        double current = forecast.currentValue();
        double limit = capacityLimit(window.metricName(), current);
        Duration step = forecaster.getStep();

        Duration timeToCapacity = null;
        List<ForecastPoint> points = forecast.points();
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).value() >= limit) {
                timeToCapacity = step.multipliedBy(i + 1L);
                break;
            }
        }

        double growthRate = points.isEmpty() ? 0.0
                : (points.get(points.size() - 1).value() - current) / points.size();

        return CapacityForecast.builder()
                .serviceName(window.serviceName())
                .metricName(window.metricName())
                .currentValue(current)
                .forecastPoints(new ArrayList<>(points))
                .capacityLimit(limit)
                .timeToCapacity(timeToCapacity)
                .growthRate(growthRate)
                .confidence(forecast.confidence())
                .method(forecast.method())
                .seasonalPatterns(detectSeasonalPatterns(window))
                .generatedAt(clock.instant())
                .build();
    }

    List<SeasonalPattern> detectSeasonalPatterns(MetricWindow window) {
        List<SeasonalPattern> patterns = new ArrayList<>();
        List<MetricSample> samples = window.samples();
        if (samples.size() > DAILY_PATTERN_MIN_POINTS) {
            peak(samples, SeasonalPattern.Kind.DAILY_PEAK).ifPresent(patterns::add);
        }
        if (samples.size() > WEEKLY_PATTERN_MIN_POINTS) {
            peak(samples, SeasonalPattern.Kind.WEEKLY_PEAK).ifPresent(patterns::add);
        }
        return patterns;
    }

    private Optional<SeasonalPattern> peak(List<MetricSample> samples, SeasonalPattern.Kind kind) {
        Map<Integer, double[]> slots = new TreeMap<>();
        double total = 0.0;
        for (MetricSample sample : samples) {
            int slot = kind == SeasonalPattern.Kind.DAILY_PEAK
                    ? sample.timestamp().atZone(ZoneOffset.UTC).getHour()
                    : sample.timestamp().atZone(ZoneOffset.UTC).getDayOfWeek().getValue();
            double[] acc = slots.computeIfAbsent(slot, s -> new double[2]);
            acc[0] += sample.value();
            acc[1] += 1;
            total += sample.value();
        }
        // A single slot carries no cycle information
        if (slots.size() < 2) {
            return Optional.empty();
        }

        int peakSlot = -1;
        double peakMean = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Integer, double[]> entry : slots.entrySet()) {
            double mean = entry.getValue()[0] / entry.getValue()[1];
            if (mean > peakMean) {
                peakMean = mean;
                peakSlot = entry.getKey();
            }
        }
        return Optional.of(new SeasonalPattern(kind, peakSlot, peakMean, total / samples.size()));
    }

    public static String describeSlot(SeasonalPattern pattern) {
        return pattern.kind() == SeasonalPattern.Kind.DAILY_PEAK
                ? String.format("%02d:00 UTC", pattern.peakSlot())
                : DayOfWeek.of(pattern.peakSlot()).name();
    }
}
