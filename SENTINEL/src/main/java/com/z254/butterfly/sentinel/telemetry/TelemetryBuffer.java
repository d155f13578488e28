package com.z254.butterfly.sentinel.telemetry;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded per-(service, metric) history and the single source of truth for recent telemetry.
 * <p>
 * Writers for the same series are serialized on that series' buffer; writers for different
 * series never contend. Snapshots are immutable copies.
 */
@Component
public class TelemetryBuffer {

    private final int capacity;
    private final Map<MetricKey, SeriesBuffer> series = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> metricsByService = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> serviceVersions = new ConcurrentHashMap<>();
    private final AtomicLong totalSamples = new AtomicLong();

    public TelemetryBuffer(SentinelProperties properties) {
        this(properties.getTelemetry().getBufferCapacity());
    }

    public TelemetryBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Append a sample; the oldest sample of the series is dropped when it is full.
     */
    public void ingest(String service, String metric, double value, Instant timestamp) {
        ingest(MetricSample.of(service, metric, value, timestamp));
    }

    public void ingest(MetricSample sample) {
        MetricKey key = sample.key();
        series.computeIfAbsent(key, k -> {
            metricsByService.computeIfAbsent(k.serviceName(), s -> ConcurrentHashMap.newKeySet())
                    .add(k.metricName());
            return new SeriesBuffer(capacity);
        }).append(sample);
        serviceVersions.computeIfAbsent(sample.serviceName(), s -> new AtomicLong()).incrementAndGet();
        totalSamples.incrementAndGet();
    }

    /**
     * Last {@code n} samples of a series, newest last. Empty when the series is unknown.
     */
    public List<MetricSample> snapshot(String service, String metric, int n) {
        SeriesBuffer buffer = series.get(new MetricKey(service, metric));
        return buffer == null ? List.of() : buffer.last(n);
    }

    public MetricWindow window(MetricKey key, int n) {
        SeriesBuffer buffer = series.get(key);
        return new MetricWindow(key, buffer == null ? List.of() : buffer.last(n));
    }

    public MetricWindow window(String service, String metric, int n) {
        return window(new MetricKey(service, metric), n);
    }

    public OptionalDouble latest(String service, String metric) {
        SeriesBuffer buffer = series.get(new MetricKey(service, metric));
        MetricSample newest = buffer == null ? null : buffer.newest();
        return newest == null ? OptionalDouble.empty() : OptionalDouble.of(newest.value());
    }

    /**
     * Latest value of every metric recorded for a service.
     */
    public Map<String, Double> latestValues(String service) {
        Map<String, Double> values = new TreeMap<>();
        for (String metric : metricsFor(service)) {
            latest(service, metric).ifPresent(v -> values.put(metric, v));
        }
        return values;
    }

    public int size(MetricKey key) {
        SeriesBuffer buffer = series.get(key);
        return buffer == null ? 0 : buffer.size();
    }

    public Set<String> services() {
        return Collections.unmodifiableSet(new TreeSet<>(metricsByService.keySet()));
    }

    public Set<String> metricsFor(String service) {
        Set<String> metrics = metricsByService.get(service);
        return metrics == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(metrics));
    }

    public Set<MetricKey> keys() {
        return Collections.unmodifiableSet(new HashSet<>(series.keySet()));
    }

    /**
     * Monotonic counter bumped on every sample recorded for the service.
     */
    public long version(String service) {
        AtomicLong version = serviceVersions.get(service);
        return version == null ? 0 : version.get();
    }

    public long totalSamples() {
        return totalSamples.get();
    }

    public int capacity() {
        return capacity;
    }
}
