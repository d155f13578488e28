package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.common.ErrorKind;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;

import java.util.Optional;

/**
 * Majority vote over an ensemble of isolation forests.
 * <p>
 * Windows shorter than the history minimum are reported as insufficient data without touching
 * the ensemble. Series without a trained model are judged by the statistical fallback.
 */
public class EnsembleDetector implements Detector {

    private final DetectionModelStore modelStore;
    private final Detector fallback;
    private final AnomalyTypeClassifier typeClassifier;
    private final int minHistory;

    public EnsembleDetector(DetectionModelStore modelStore,
                            Detector fallback,
                            AnomalyTypeClassifier typeClassifier,
                            int minHistory) {
        this.modelStore = modelStore;
        this.fallback = fallback;
        this.typeClassifier = typeClassifier;
        this.minHistory = minHistory;
    }

    @Override
    public AnomalyResult detect(MetricWindow window) {
        if (window.size() < minHistory) {
            return AnomalyResult.insufficientData();
        }

        Optional<EnsembleModel> model = modelStore.get(window.key());
        if (model.isEmpty()) {
            return fallback.detect(window).withDegradation(ErrorKind.MODEL_UNAVAILABLE);
        }

        EnsembleModel ensemble = model.get();
        double[] features = FeatureExtractor.extract(window);
        int votes = 0;
        double scoreSum = 0.0;
        for (IsolationForest member : ensemble.members()) {
            double score = member.score(features);
            scoreSum += Math.abs(score);
            if (score > member.getThreshold()) {
                votes++;
            }
        }

        boolean anomaly = votes >= ensemble.majority();
        double score = scoreSum / ensemble.size();
        double agreement = (double) (anomaly ? votes : ensemble.size() - votes) / ensemble.size();

        return new AnomalyResult(anomaly, score, typeClassifier.classify(window), agreement,
                DetectionMethod.ENSEMBLE, null);
    }

    @Override
    public String name() {
        return "ensemble";
    }
}
