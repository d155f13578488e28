package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.telemetry.MetricKey;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trained ensemble models keyed by series. Training happens off the detection path; detection
 * only reads the latest published model.
 */
@Slf4j
@Component
public class DetectionModelStore {

    private final Map<MetricKey, EnsembleModel> models = new ConcurrentHashMap<>();
    private final SentinelProperties.Detection.Ensemble config;
    private final int windowSize;
    private final Clock clock;

    public DetectionModelStore(SentinelProperties properties, Clock clock) {
        this.config = properties.getDetection().getEnsemble();
        this.windowSize = properties.getDetection().getWindowSize();
        this.clock = clock;
    }

    public Optional<EnsembleModel> get(MetricKey key) {
        return Optional.ofNullable(models.get(key));
    }

    /**
     * Train and publish a model from a series' history.
     *
     * @return the model, or empty when the history is shorter than the training minimum
     */
    public Optional<EnsembleModel> train(MetricWindow history) {
        if (history.size() < Math.max(config.getMinTrainingSamples(), windowSize + 1)) {
            return Optional.empty();
        }

        double[][] vectors = FeatureExtractor.trainingSet(history, windowSize);
        List<IsolationForest> members = new ArrayList<>(config.getSeeds().size());
        for (Long seed : config.getSeeds()) {
            members.add(IsolationForest.fit(vectors, config.getTreesPerModel(),
                    config.getSampleSize(), config.getContamination(), seed));
        }

        EnsembleModel model = new EnsembleModel(members, vectors.length, clock.instant());
        models.put(history.key(), model);
        log.debug("Trained ensemble for {}: members={}, vectors={}", history.key(), members.size(), vectors.length);
        return Optional.of(model);
    }

    public void evict(MetricKey key) {
        models.remove(key);
    }

    public int size() {
        return models.size();
    }
}
