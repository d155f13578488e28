package com.z254.butterfly.sentinel.health;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes {@link ServiceHealthScore}s from buffered telemetry and recent anomaly scores.
 * <p>
 * Weights: performance 0.3, reliability 0.25, resources 0.25, errors 0.2. A score is only
 * recomputed when the service has ingested samples since the last computation, and is
 * replaced as a whole.
 */
@Slf4j
@Component
public class HealthScorer {

    static final double PERFORMANCE_WEIGHT = 0.30;
    static final double RELIABILITY_WEIGHT = 0.25;
    static final double RESOURCE_WEIGHT = 0.25;
    static final double ERROR_WEIGHT = 0.20;

    static final int LATENCY_WINDOW = 10;
    static final int THROUGHPUT_MIN_HISTORY = 20;
    static final int ANOMALY_HISTORY = 20;

    private final TelemetryBuffer buffer;
    private final Clock clock;
    private final double highAnomalyScore;

    private final Map<String, ServiceHealthScore> scores = new ConcurrentHashMap<>();
    private final Map<String, Deque<Double>> anomalyScores = new ConcurrentHashMap<>();

    public HealthScorer(TelemetryBuffer buffer, SentinelProperties properties, Clock clock) {
        this.buffer = buffer;
        this.clock = clock;
        this.highAnomalyScore = properties.getDetection().getAnomalyThreshold();
    }

    /**
     * Remember a detection score for the reliability component; only the last 20 are kept.
     */
    public void recordAnomalyScore(String service, double score) {
        Deque<Double> history = anomalyScores.computeIfAbsent(service, s -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(score);
            while (history.size() > ANOMALY_HISTORY) {
                history.removeFirst();
            }
        }
    }

    /**
     * Current score for the service, recomputed when its buffer version moved.
     */
    public ServiceHealthScore refresh(String service) {
        long version = buffer.version(service);
        return scores.compute(service, (svc, existing) -> {
            if (existing != null && existing.sampleVersion() == version) {
                return existing;
            }
            return compute(svc, version);
        });
    }

    public Optional<ServiceHealthScore> getHealth(String service) {
        return Optional.ofNullable(scores.get(service));
    }

    public Optional<Double> overallScore(String service) {
        return getHealth(service).map(ServiceHealthScore::overallScore);
    }

    public List<ServiceHealthScore> getAll() {
        return scores.values().stream()
                .sorted(Comparator.comparing(ServiceHealthScore::serviceName))
                .toList();
    }

    // ========== Scoring ==========

    ServiceHealthScore compute(String service, long version) {
        Set<String> metrics = buffer.metricsFor(service);
        if (metrics.isEmpty()) {
            return ServiceHealthScore.noData(service, clock.instant(), version);
        }

        List<Double> performance = new ArrayList<>();
        List<Double> resources = new ArrayList<>();
        List<Double> errors = new ArrayList<>();
        for (String metric : metrics) {
            String name = metric.toLowerCase(Locale.ROOT);
            if (name.contains("latency") || name.contains("response_time")) {
                double[] recent = buffer.window(service, metric, LATENCY_WINDOW).values();
                performance.add(latencyScore(StatUtils.mean(recent)));
            } else if (name.contains("throughput") || name.contains("request_rate")) {
                double[] history = buffer.window(service, metric, buffer.capacity()).values();
                if (history.length > THROUGHPUT_MIN_HISTORY) {
                    performance.add(throughputScore(history));
                }
            } else if (name.contains("memory")) {
                double latest = buffer.latest(service, metric).orElse(0.0);
                resources.add(name.contains("mb") ? memoryMbScore(latest) : memoryFractionScore(latest));
            } else if (name.contains("cpu")) {
                resources.add(cpuScore(buffer.latest(service, metric).orElse(0.0)));
            } else if (name.contains("error")) {
                errors.add(errorRateScore(buffer.latest(service, metric).orElse(0.0)));
            }
        }

        double performanceScore = averageOrFull(performance);
        double reliabilityScore = reliabilityScore(service);
        double resourceScore = averageOrFull(resources);
        double errorScore = averageOrFull(errors);
        double overall = PERFORMANCE_WEIGHT * performanceScore
                + RELIABILITY_WEIGHT * reliabilityScore
                + RESOURCE_WEIGHT * resourceScore
                + ERROR_WEIGHT * errorScore;

        return new ServiceHealthScore(service, overall, performanceScore, reliabilityScore, resourceScore,
                errorScore, HealthStatus.fromScore(overall), clock.instant(), version);
    }

    double reliabilityScore(String service) {
        Deque<Double> history = anomalyScores.get(service);
        if (history == null) {
            return 100.0;
        }
        double[] recent;
        synchronized (history) {
            if (history.isEmpty()) {
                return 100.0;
            }
            recent = history.stream().mapToDouble(Double::doubleValue).toArray();
        }
        long high = Arrays.stream(recent).filter(score -> score >= highAnomalyScore).count();
        double penalty = Math.min(50.0, high * 10.0 + StatUtils.mean(recent) * 20.0);
        return 100.0 - penalty;
    }

    static double latencyScore(double meanMs) {
        if (meanMs <= 50) {
            return 100;
        }
        if (meanMs <= 100) {
            return 80;
        }
        return meanMs <= 200 ? 60 : 40;
    }

    static double throughputScore(double[] history) {
        int recentCount = Math.min(LATENCY_WINDOW, history.length);
        double recent = StatUtils.mean(history, history.length - recentCount, recentCount);
        double historical = StatUtils.mean(history);
        if (historical <= 0) {
            return 100;
        }
        double ratio = recent / historical;
        if (ratio >= 0.9) {
            return 100;
        }
        if (ratio >= 0.7) {
            return 80;
        }
        return ratio >= 0.5 ? 60 : 40;
    }

    static double memoryFractionScore(double fraction) {
        if (fraction <= 0.5) {
            return 100;
        }
        if (fraction <= 0.75) {
            return 80;
        }
        return fraction <= 0.9 ? 60 : 40;
    }

    static double memoryMbScore(double megabytes) {
        if (megabytes <= 512) {
            return 100;
        }
        if (megabytes <= 768) {
            return 80;
        }
        return megabytes <= 1024 ? 60 : 40;
    }

    static double cpuScore(double fraction) {
        if (fraction <= 0.5) {
            return 100;
        }
        if (fraction <= 0.7) {
            return 80;
        }
        return fraction <= 0.85 ? 60 : 40;
    }

    static double errorRateScore(double rate) {
        if (rate <= 0.001) {
            return 100;
        }
        if (rate <= 0.005) {
            return 90;
        }
        if (rate <= 0.01) {
            return 80;
        }
        return rate <= 0.05 ? 60 : 30;
    }

    private static double averageOrFull(List<Double> scores) {
        return scores.isEmpty() ? 100.0 : scores.stream().mapToDouble(Double::doubleValue).average().orElse(100.0);
    }
}
