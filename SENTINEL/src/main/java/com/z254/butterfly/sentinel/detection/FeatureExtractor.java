package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.telemetry.MetricSample;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ensemble feature vector of a window:
 * current value, mean, standard deviation, short-term trend and the hour-of-day and
 * day-of-week phases encoded as sine/cosine pairs.
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 8;

    private FeatureExtractor() {
    }

    public static double[] extract(MetricWindow window) {
        return extract(window.samples());
    }

    static double[] extract(List<MetricSample> samples) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        SimpleRegression trend = new SimpleRegression();
        for (int i = 0; i < samples.size(); i++) {
            double value = samples.get(i).value();
            stats.addValue(value);
            trend.addData(i, value);
        }

        MetricSample newest = samples.get(samples.size() - 1);
        double slope = samples.size() > 1 ? trend.getSlope() : 0.0;
        double std = samples.size() > 1 ? stats.getStandardDeviation() : 0.0;

        ZonedDateTime time = toUtc(newest.timestamp());
        double hourPhase = 2 * Math.PI * (time.getHour() * 60 + time.getMinute()) / (24 * 60.0);
        double dayPhase = 2 * Math.PI * (time.getDayOfWeek().getValue() - 1) / 7.0;

        return new double[]{
                newest.value(),
                stats.getMean(),
                std,
                Double.isNaN(slope) ? 0.0 : slope,
                Math.sin(hourPhase),
                Math.cos(hourPhase),
                Math.sin(dayPhase),
                Math.cos(dayPhase)
        };
    }

    /**
     * One vector per sliding window of {@code windowSize} samples over the history.
     */
    public static double[][] trainingSet(MetricWindow history, int windowSize) {
        List<MetricSample> samples = history.samples();
        List<double[]> vectors = new ArrayList<>();
        for (int end = windowSize; end <= samples.size(); end++) {
            vectors.add(extract(samples.subList(end - windowSize, end)));
        }
        return vectors.toArray(new double[0][]);
    }

    private static ZonedDateTime toUtc(Instant instant) {
        return instant.atZone(ZoneOffset.UTC);
    }
}
