package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Nearest-centroid classifier over standardized incident feature vectors. Immutable once
 * trained; retraining builds a new instance.
 */
public final class CentroidIncidentClassifier {

    static final int FEATURES = 9;

    private final Map<IncidentType, double[]> centroids;
    private final double[] means;
    private final double[] scales;
    private final EuclideanDistance distance = new EuclideanDistance();

    private CentroidIncidentClassifier(Map<IncidentType, double[]> centroids, double[] means, double[] scales) {
        this.centroids = centroids;
        this.means = means;
        this.scales = scales;
    }

    /**
     * Train from labelled incidents. Types with fewer than {@code minPerClass} examples are
     * ignored; at least two types must remain.
     */
    public static Optional<CentroidIncidentClassifier> train(List<Incident> history, int minPerClass) {
        Map<IncidentType, List<double[]>> byType = history.stream()
                .filter(incident -> incident.getMetricsSnapshot() != null && incident.getType() != null)
                .collect(Collectors.groupingBy(Incident::getType, () -> new EnumMap<>(IncidentType.class),
                        Collectors.mapping(i -> features(i.getMetricsSnapshot(), i.getContext()), Collectors.toList())));
        byType.values().removeIf(samples -> samples.size() < minPerClass);
        if (byType.size() < 2) {
            return Optional.empty();
        }

        List<double[]> all = byType.values().stream().flatMap(List::stream).toList();
        double[] means = new double[FEATURES];
        double[] scales = new double[FEATURES];
        for (int f = 0; f < FEATURES; f++) {
            double[] column = column(all, f);
            means[f] = new Mean().evaluate(column);
            double std = new StandardDeviation().evaluate(column);
            scales[f] = std > 0 ? std : 1.0;
        }

        Map<IncidentType, double[]> centroids = new EnumMap<>(IncidentType.class);
        byType.forEach((type, samples) -> {
            double[] centroid = new double[FEATURES];
            for (double[] sample : samples) {
                double[] z = standardize(sample, means, scales);
                for (int f = 0; f < FEATURES; f++) {
                    centroid[f] += z[f] / samples.size();
                }
            }
            centroids.put(type, centroid);
        });
        return Optional.of(new CentroidIncidentClassifier(centroids, means, scales));
    }

    /**
     * Closest type, with a probability from a softmax over negative centroid distances.
     */
    public Prediction predict(IncidentMetrics metrics, IncidentContext context) {
        double[] z = standardize(features(metrics, context), means, scales);
        Map<IncidentType, Double> weights = new EnumMap<>(IncidentType.class);
        double total = 0.0;
        for (Map.Entry<IncidentType, double[]> entry : centroids.entrySet()) {
            double weight = Math.exp(-distance.compute(z, entry.getValue()));
            weights.put(entry.getKey(), weight);
            total += weight;
        }
        Map.Entry<IncidentType, Double> best = Collections.max(weights.entrySet(), Map.Entry.comparingByValue());
        double probability = total > 0 ? best.getValue() / total : 0.0;
        return new Prediction(best.getKey(), probability);
    }

    public Set<IncidentType> knownTypes() {
        return Collections.unmodifiableSet(centroids.keySet());
    }

    static double[] features(IncidentMetrics metrics, IncidentContext context) {
        IncidentContext ctx = context != null ? context : IncidentContext.builder().build();
        double throughput = metrics.getThroughput() != null ? metrics.getThroughput() : 0.0;
        return new double[]{
                metrics.cpu(),
                metrics.memory(),
                metrics.disk(),
                metrics.errors(),
                metrics.responseTimeMs(),
                throughput,
                "peak".equals(ctx.getTimeOfDay()) ? 1.0 : 0.0,
                ctx.hasRecentDeployment() ? 1.0 : 0.0,
                ctx.hasUnhealthyDependency() ? 1.0 : 0.0
        };
    }

    private static double[] standardize(double[] raw, double[] means, double[] scales) {
        double[] z = new double[raw.length];
        for (int f = 0; f < raw.length; f++) {
            z[f] = (raw[f] - means[f]) / scales[f];
        }
        return z;
    }

    private static double[] column(List<double[]> rows, int index) {
        double[] column = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            column[i] = rows.get(i)[index];
        }
        return column;
    }

    public record Prediction(IncidentType type, double probability) {
    }
}
