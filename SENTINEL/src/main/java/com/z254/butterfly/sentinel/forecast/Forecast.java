package com.z254.butterfly.sentinel.forecast;

import com.z254.butterfly.sentinel.telemetry.MetricKey;

import java.time.Instant;
import java.util.List;

/**
 * Short-horizon projection of one series.
 *
 * @param key          series
 * @param method       model that produced the projection
 * @param currentValue newest observed value
 * @param points       projected points, nearest first
 * @param confidence   model confidence in [0, 1]
 * @param residualStd  in-sample one-step residual standard deviation
 * @param generatedAt  computation time
 */
public record Forecast(MetricKey key,
                       ForecastMethod method,
                       double currentValue,
                       List<ForecastPoint> points,
                       double confidence,
                       double residualStd,
                       Instant generatedAt) {

    public Forecast {
        points = List.copyOf(points);
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    public double maxValue() {
        double max = Double.NEGATIVE_INFINITY;
        for (ForecastPoint point : points) {
            max = Math.max(max, point.value());
        }
        return max;
    }

    public int horizon() {
        return points.size();
    }
}
