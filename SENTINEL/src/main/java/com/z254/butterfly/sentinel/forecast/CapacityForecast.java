package com.z254.butterfly.sentinel.forecast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Projection of a series against its capacity limit. Recomputed each forecasting cycle and
 * superseded, never merged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityForecast {

    private String serviceName;

    private String metricName;

    private double currentValue;

    @Builder.Default
    private List<ForecastPoint> forecastPoints = new ArrayList<>();

    private double capacityLimit;

    /** Time until the first projected point reaches the limit; null when it never does */
    private Duration timeToCapacity;

    /** Average change per forecast step */
    private double growthRate;

    private double confidence;

    private ForecastMethod method;

    @Builder.Default
    private List<SeasonalPattern> seasonalPatterns = new ArrayList<>();

    private Instant generatedAt;

    public Optional<Duration> timeToCapacity() {
        return Optional.ofNullable(timeToCapacity);
    }

    /**
     * Whether the limit is reached inside the forecast horizon.
     */
    public boolean isCapacityAtRisk() {
        return timeToCapacity != null;
    }

    public double maxForecastValue() {
        return forecastPoints.stream().mapToDouble(ForecastPoint::value).max().orElse(currentValue);
    }
}
