package com.z254.butterfly.sentinel.forecast;

import com.z254.butterfly.sentinel.common.Result;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects a series' near-term trajectory.
 * <ul>
 *     <li>fewer than {@code minPoints} samples: {@code INSUFFICIENT_DATA}</li>
 *     <li>fewer than {@code advancedMinPoints}: least-squares line, confidence {@code clamp(R², 0.1, 0.9)}</li>
 *     <li>otherwise: Holt or Holt-Winters smoothing, confidence {@code clamp(1 - AIC/1000, 0.1, 0.95)}</li>
 * </ul>
 * Intervals are ±1.96 residual standard deviations. Projection depends only on the window;
 * the clock only stamps the result.
 */
@Slf4j
@Component
public class Forecaster {

    static final double Z_95 = 1.96;

    private final int defaultHorizon;
    private final Duration step;
    private final int minPoints;
    private final int advancedMinPoints;
    private final int seasonalPeriod;
    private final Clock clock;

    public Forecaster(SentinelProperties properties, Clock clock) {
        SentinelProperties.Forecast config = properties.getForecast();
        this.defaultHorizon = config.getHorizon();
        this.step = config.getStep();
        this.minPoints = config.getMinPoints();
        this.advancedMinPoints = config.getAdvancedMinPoints();
        this.seasonalPeriod = config.getSeasonalPeriod();
        this.clock = clock;
    }

    public Result<Forecast> predict(MetricWindow window) {
        return predict(window, defaultHorizon);
    }

    public Result<Forecast> predict(MetricWindow window, int horizon) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive");
        }
        if (window.size() < minPoints) {
            return Result.insufficientData(String.format("%s has %d points, %d required",
                    window.key(), window.size(), minPoints));
        }
        if (window.size() >= advancedMinPoints) {
            Result<Forecast> advanced = smoothing(window, horizon);
            if (advanced.isOk()) {
                return advanced;
            }
            log.debug("Falling back to linear forecast for {}: {}", window.key(), advanced.getMessage());
        }
        return Result.ok(linear(window, horizon));
    }

    public Duration getStep() {
        return step;
    }

    public int getDefaultHorizon() {
        return defaultHorizon;
    }

    // ========== Private Methods ==========

    private Result<Forecast> smoothing(MetricWindow window, int horizon) {
        ExponentialSmoothingModel model = ExponentialSmoothingModel.fit(window.values(), seasonalPeriod);
        if (model.isDegenerate()) {
            return Result.modelUnavailable("Smoothing fit degenerate for " + window.key());
        }
        double[] projected = model.forecast(horizon);
        double residualStd = model.residualStd();
        double confidence = clamp(1.0 - model.aic() / 1000.0, 0.1, 0.95);
        ForecastMethod method = model.isSeasonal() ? ForecastMethod.HOLT_WINTERS : ForecastMethod.HOLT;
        return Result.ok(build(window, method, projected, residualStd, confidence));
    }

    private Forecast linear(MetricWindow window, int horizon) {
        double[] values = window.values();
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }

        double[] projected = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            projected[h] = regression.predict(values.length + h);
        }

        double mse = regression.getMeanSquareError();
        double residualStd = Double.isNaN(mse) ? 0.0 : Math.sqrt(mse);
        double rSquared = regression.getRSquare();
        // A flat series has no variance to explain; it is projected exactly
        double confidence = Double.isNaN(rSquared)
                ? (regression.getTotalSumSquares() == 0 ? 0.9 : 0.1)
                : clamp(rSquared, 0.1, 0.9);
        return build(window, ForecastMethod.LINEAR, projected, residualStd, confidence);
    }

    private Forecast build(MetricWindow window, ForecastMethod method, double[] projected,
                           double residualStd, double confidence) {
        Instant origin = window.latestTimestamp() != null ? window.latestTimestamp() : clock.instant();
        double margin = Z_95 * residualStd;
        List<ForecastPoint> points = new ArrayList<>(projected.length);
        for (int h = 0; h < projected.length; h++) {
            points.add(new ForecastPoint(origin.plus(step.multipliedBy(h + 1L)),
                    projected[h], projected[h] - margin, projected[h] + margin));
        }
        return new Forecast(window.key(), method, window.latestValue(), points, confidence,
                residualStd, clock.instant());
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
