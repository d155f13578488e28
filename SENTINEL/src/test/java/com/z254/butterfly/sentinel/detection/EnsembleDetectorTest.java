package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.common.ErrorKind;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.support.MutableClock;
import com.z254.butterfly.sentinel.telemetry.MetricKey;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class EnsembleDetectorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private DetectionModelStore modelStore;
    private EnsembleDetector detector;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        properties.getDetection().getEnsemble().setTreesPerModel(25);
        properties.getDetection().getEnsemble().setSampleSize(64);
        AnomalyTypeClassifier typeClassifier = new AnomalyTypeClassifier();
        modelStore = new DetectionModelStore(properties, clock);
        detector = new EnsembleDetector(modelStore, new StatisticalDetector(properties, typeClassifier),
                typeClassifier, properties.getDetection().getMinHistory());
    }

    @Nested
    @DisplayName("Without a trained model")
    class Untrained {

        @Test
        void fallsBackToTheStatisticalDetector() {
            AnomalyResult result = detector.detect(StatisticalDetectorTest.window(0.40, 0.42, 20, 0.93));

            assertThat(result.method()).isEqualTo(DetectionMethod.STATISTICAL);
            assertThat(result.degradedBy()).isEqualTo(ErrorKind.MODEL_UNAVAILABLE);
            assertThat(result.anomaly()).isTrue();
            assertThat(result.hasData()).isTrue();
        }

        @Test
        void shortWindowNeverReachesTheFallback() {
            AnomalyResult result = detector.detect(MetricWindow.of("checkout", "cpu_usage", 0.4, 0.5));

            assertThat(result.hasData()).isFalse();
            assertThat(result.method()).isEqualTo(DetectionMethod.NONE);
        }
    }

    @Nested
    @DisplayName("With a trained model")
    class Trained {

        @Test
        void votesWithTheEnsemble() {
            MetricWindow history = noisy(120);
            assertThat(modelStore.train(history)).isPresent();

            AnomalyResult result = detector.detect(history.tail(20));

            assertThat(result.method()).isEqualTo(DetectionMethod.ENSEMBLE);
            assertThat(result.degradedBy()).isNull();
            assertThat(result.confidence()).isGreaterThanOrEqualTo(0.5);
            assertThat(result.score()).isBetween(0.0, 1.0);
        }
    }

    @Nested
    @DisplayName("Model store")
    class ModelStore {

        @Test
        void refusesToTrainOnShortHistory() {
            assertThat(modelStore.train(noisy(30))).isEmpty();
            assertThat(modelStore.size()).isZero();
        }

        @Test
        void publishesOneMemberPerSeed() {
            EnsembleModel model = modelStore.train(noisy(80)).orElseThrow();

            assertThat(model.size()).isEqualTo(3);
            assertThat(model.majority()).isEqualTo(2);
            assertThat(model.trainedAt()).isEqualTo(clock.instant());
            assertThat(modelStore.get(new MetricKey("checkout", "cpu_usage"))).containsSame(model);
        }

        @Test
        void evictionForgetsTheModel() {
            modelStore.train(noisy(80));
            modelStore.evict(new MetricKey("checkout", "cpu_usage"));

            assertThat(modelStore.get(new MetricKey("checkout", "cpu_usage"))).isEmpty();
        }
    }

    @Test
    void featureVectorsCoverEverySlidingWindow() {
        assertThat(FeatureExtractor.extract(noisy(20))).hasSize(FeatureExtractor.FEATURE_COUNT);
        assertThat(FeatureExtractor.trainingSet(noisy(40), 20)).hasNumberOfRows(21);
    }

    private static MetricWindow noisy(int n) {
        Random random = new Random(7);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 0.4 + random.nextGaussian() * 0.02;
        }
        return MetricWindow.of("checkout", "cpu_usage", values);
    }
}
