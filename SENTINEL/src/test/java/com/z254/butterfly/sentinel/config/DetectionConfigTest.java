package com.z254.butterfly.sentinel.config;

import com.z254.butterfly.sentinel.detection.AnomalyTypeClassifier;
import com.z254.butterfly.sentinel.detection.DetectionModelStore;
import com.z254.butterfly.sentinel.detection.EnsembleDetector;
import com.z254.butterfly.sentinel.detection.StatisticalDetector;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionConfigTest {

    private final DetectionConfig config = new DetectionConfig();

    @Test
    void strategyPropertySelectsTheDetector() {
        SentinelProperties properties = new SentinelProperties();
        properties.getDetection().setStrategy(SentinelProperties.DetectorStrategy.STATISTICAL);

        assertThat(config.anomalyDetector(properties, modelStore(properties), new AnomalyTypeClassifier()))
                .isInstanceOf(StatisticalDetector.class);

        properties.getDetection().setStrategy(SentinelProperties.DetectorStrategy.ENSEMBLE);

        assertThat(config.anomalyDetector(properties, modelStore(properties), new AnomalyTypeClassifier()))
                .isInstanceOf(EnsembleDetector.class)
                .satisfies(detector -> assertThat(detector.name()).isEqualTo("ensemble"));
    }

    private static DetectionModelStore modelStore(SentinelProperties properties) {
        return new DetectionModelStore(properties, Clock.systemUTC());
    }
}
