package com.z254.butterfly.sentinel.forecast;

/**
 * Additive Holt (trend) and Holt-Winters (trend + season) exponential smoothing.
 * <p>
 * Smoothing parameters are chosen by grid search over {@code 0.1..0.9}, minimising the sum of
 * squared one-step-ahead errors.
 */
final class ExponentialSmoothingModel {

    private static final double[] GRID = {0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9};
    private static final double MIN_VARIANCE = 1e-12;

    private final double level;
    private final double trend;
    private final double[] season;
    private final int period;
    private final int seriesLength;
    private final double sse;
    private final int errorCount;
    private final int parameterCount;

    private ExponentialSmoothingModel(double level, double trend, double[] season, int period,
                                      int seriesLength, double sse, int errorCount, int parameterCount) {
        this.level = level;
        this.trend = trend;
        this.season = season;
        this.period = period;
        this.seriesLength = seriesLength;
        this.sse = sse;
        this.errorCount = errorCount;
        this.parameterCount = parameterCount;
    }

    /**
     * Fit the model; the seasonal term is used only when {@code period > 1} and the series
     * covers at least two full seasons.
     */
    static ExponentialSmoothingModel fit(double[] y, int period) {
        if (y.length < 3) {
            throw new IllegalArgumentException("At least three points are required");
        }
        boolean seasonal = period > 1 && y.length >= 2 * period;

        ExponentialSmoothingModel best = null;
        for (double alpha : GRID) {
            for (double beta : GRID) {
                if (seasonal) {
                    for (double gamma : GRID) {
                        ExponentialSmoothingModel candidate = holtWinters(y, period, alpha, beta, gamma);
                        if (best == null || candidate.sse < best.sse) {
                            best = candidate;
                        }
                    }
                } else {
                    ExponentialSmoothingModel candidate = holt(y, alpha, beta);
                    if (best == null || candidate.sse < best.sse) {
                        best = candidate;
                    }
                }
            }
        }
        return best;
    }

    double[] forecast(int horizon) {
        double[] out = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            double value = level + h * trend;
            if (season != null) {
                value += season[(seriesLength - period + (h - 1) % period) % season.length];
            }
            out[h - 1] = value;
        }
        return out;
    }

    boolean isSeasonal() {
        return season != null;
    }

    double residualStd() {
        return Math.sqrt(sse / Math.max(1, errorCount));
    }

    /**
     * Akaike information criterion of the one-step errors.
     */
    double aic() {
        double variance = Math.max(sse / Math.max(1, errorCount), MIN_VARIANCE);
        return errorCount * Math.log(variance) + 2.0 * parameterCount;
    }

    boolean isDegenerate() {
        return Double.isNaN(level) || Double.isInfinite(level)
                || Double.isNaN(trend) || Double.isInfinite(trend)
                || Double.isNaN(sse);
    }

    // ========== Private Methods ==========

    private static ExponentialSmoothingModel holt(double[] y, double alpha, double beta) {
        double level = y[0];
        double trend = y[1] - y[0];
        double sse = 0.0;
        for (int t = 1; t < y.length; t++) {
            double predicted = level + trend;
            double error = y[t] - predicted;
            sse += error * error;
            double previousLevel = level;
            level = alpha * y[t] + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
        }
        return new ExponentialSmoothingModel(level, trend, null, 0, y.length, sse, y.length - 1, 4);
    }

    private static ExponentialSmoothingModel holtWinters(double[] y, int period,
                                                         double alpha, double beta, double gamma) {
        double firstMean = mean(y, 0, period);
        double secondMean = mean(y, period, 2 * period);
        double level = firstMean;
        double trend = (secondMean - firstMean) / period;

        double[] season = new double[y.length];
        for (int i = 0; i < period; i++) {
            season[i] = y[i] - firstMean;
        }

        double sse = 0.0;
        for (int t = period; t < y.length; t++) {
            double predicted = level + trend + season[t - period];
            double error = y[t] - predicted;
            sse += error * error;
            double previousLevel = level;
            level = alpha * (y[t] - season[t - period]) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            season[t] = gamma * (y[t] - level) + (1 - gamma) * season[t - period];
        }
        return new ExponentialSmoothingModel(level, trend, season, period, y.length, sse,
                y.length - period, 5 + period);
    }

    private static double mean(double[] y, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += y[i];
        }
        return sum / (to - from);
    }
}
