package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.common.ErrorKind;

/**
 * Verdict for one metric window. Transient: it lives only as long as the alert it may spawn.
 *
 * @param anomaly      whether the newest sample is anomalous
 * @param score        normalized anomaly score in [0, 1]
 * @param anomalyType  rule-table classification of the window
 * @param confidence   agreement behind the verdict in [0, 1]
 * @param method       detector path that produced the verdict
 * @param degradedBy   why the preferred path was not used, or {@code null}
 */
public record AnomalyResult(boolean anomaly,
                            double score,
                            AnomalyType anomalyType,
                            double confidence,
                            DetectionMethod method,
                            ErrorKind degradedBy) {

    public AnomalyResult {
        score = clamp(score);
        confidence = clamp(confidence);
    }

    /**
     * Result for a series that is too short to judge.
     */
    public static AnomalyResult insufficientData() {
        return new AnomalyResult(false, 0.0, AnomalyType.DATA_QUALITY_ISSUE, 0.0,
                DetectionMethod.NONE, ErrorKind.INSUFFICIENT_DATA);
    }

    public AnomalyResult withDegradation(ErrorKind reason) {
        return new AnomalyResult(anomaly, score, anomalyType, confidence, method, reason);
    }

    public boolean hasData() {
        return degradedBy != ErrorKind.INSUFFICIENT_DATA;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
