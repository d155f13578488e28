package com.z254.butterfly.sentinel.telemetry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, read-only view of the most recent samples of one series (newest last).
 */
public record MetricWindow(MetricKey key, List<MetricSample> samples) {

    private static final Instant SAMPLE_ORIGIN = Instant.parse("2024-01-01T00:00:00Z");

    public MetricWindow {
        samples = List.copyOf(samples);
    }

    /**
     * Window of one-minute-spaced samples whose newest sample sits at a fixed instant.
     */
    public static MetricWindow of(String service, String metric, double... values) {
        Instant base = SAMPLE_ORIGIN.minusSeconds((values.length - 1) * 60L);
        List<MetricSample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            samples.add(new MetricSample(service, metric, values[i], base.plusSeconds(i * 60L)));
        }
        return new MetricWindow(new MetricKey(service, metric), samples);
    }

    public String serviceName() {
        return key.serviceName();
    }

    public String metricName() {
        return key.metricName();
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double[] values() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).value();
        }
        return values;
    }

    public double latestValue() {
        if (samples.isEmpty()) {
            throw new IllegalStateException("Window for " + key + " is empty");
        }
        return samples.get(samples.size() - 1).value();
    }

    public Instant latestTimestamp() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1).timestamp();
    }

    /**
     * Up to {@code n} samples ending just before index {@code end}, i.e. the window as it
     * stood when sample {@code end - 1} arrived.
     */
    public MetricWindow endingAt(int end, int n) {
        int to = Math.min(Math.max(end, 0), samples.size());
        int from = Math.max(0, to - n);
        if (from == 0 && to == samples.size()) {
            return this;
        }
        return new MetricWindow(key, samples.subList(from, to));
    }

    /**
     * Last {@code n} samples of this window.
     */
    public MetricWindow tail(int n) {
        if (n >= samples.size()) {
            return this;
        }
        return new MetricWindow(key, samples.subList(samples.size() - n, samples.size()));
    }
}
