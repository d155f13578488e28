package com.z254.butterfly.sentinel.config;

import com.z254.butterfly.sentinel.detection.AnomalyTypeClassifier;
import com.z254.butterfly.sentinel.detection.DetectionModelStore;
import com.z254.butterfly.sentinel.detection.Detector;
import com.z254.butterfly.sentinel.detection.EnsembleDetector;
import com.z254.butterfly.sentinel.detection.StatisticalDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the anomaly detector once, at startup.
 */
@Slf4j
@Configuration
public class DetectionConfig {

    @Bean
    public Detector anomalyDetector(SentinelProperties properties,
                                    DetectionModelStore modelStore,
                                    AnomalyTypeClassifier typeClassifier) {
        StatisticalDetector statistical = new StatisticalDetector(properties, typeClassifier);
        Detector detector = switch (properties.getDetection().getStrategy()) {
            case STATISTICAL -> statistical;
            case ENSEMBLE -> new EnsembleDetector(modelStore, statistical, typeClassifier,
                    properties.getDetection().getMinHistory());
        };
        log.info("Anomaly detector selected: {}", detector.name());
        return detector;
    }
}
