package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Z-score test combined with an interquartile-range fence.
 * <p>
 * The newest sample is compared with the baseline formed by the samples before it. It is
 * anomalous when {@code z > zThreshold} or it falls outside
 * {@code [Q1 - k·IQR, Q3 + k·IQR]}. The score is {@code min(z / zThreshold, 1)}.
 */
public class StatisticalDetector implements Detector {

    private final int minHistory;
    private final double zThreshold;
    private final double iqrMultiplier;
    private final AnomalyTypeClassifier typeClassifier;

    public StatisticalDetector(SentinelProperties properties, AnomalyTypeClassifier typeClassifier) {
        this(properties.getDetection().getMinHistory(),
                properties.getDetection().getZScoreThreshold(),
                properties.getDetection().getIqrMultiplier(),
                typeClassifier);
    }

    public StatisticalDetector(int minHistory, double zThreshold, double iqrMultiplier,
                               AnomalyTypeClassifier typeClassifier) {
        this.minHistory = minHistory;
        this.zThreshold = zThreshold;
        this.iqrMultiplier = iqrMultiplier;
        this.typeClassifier = typeClassifier;
    }

    @Override
    public AnomalyResult detect(MetricWindow window) {
        if (window.size() < minHistory) {
            return AnomalyResult.insufficientData();
        }

        double[] values = window.values();
        double current = values[values.length - 1];
        DescriptiveStatistics baseline = new DescriptiveStatistics();
        for (int i = 0; i < values.length - 1; i++) {
            baseline.addValue(values[i]);
        }

        double mean = baseline.getMean();
        double std = baseline.getStandardDeviation();
        double z;
        if (std > 0) {
            z = Math.abs(current - mean) / std;
        } else {
            z = current == mean ? 0.0 : Double.POSITIVE_INFINITY;
        }

        double q1 = baseline.getPercentile(25);
        double q3 = baseline.getPercentile(75);
        double iqr = q3 - q1;
        boolean outsideFence = current < q1 - iqrMultiplier * iqr || current > q3 + iqrMultiplier * iqr;

        boolean anomaly = z > zThreshold || outsideFence;
        double score = Math.min(z / zThreshold, 1.0);

        return new AnomalyResult(anomaly, score, typeClassifier.classify(window), score,
                DetectionMethod.STATISTICAL, null);
    }

    @Override
    public String name() {
        return "statistical";
    }
}
