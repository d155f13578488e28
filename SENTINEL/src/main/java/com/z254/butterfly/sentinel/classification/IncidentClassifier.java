package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.domain.model.ClassificationMethod;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics.MetricDimension;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides whether a metrics snapshot constitutes an incident and of which type.
 * <p>
 * The detection conditions always decide whether there is an incident and its severity.
 * The type comes from the trained classifier when it is confident enough, otherwise from
 * the matching condition (refined by the driving alert's anomaly type).
 */
@Slf4j
@Component
public class IncidentClassifier {

    private final double ruleConfidence;
    private final double mlPrecedenceConfidence;
    private final int minTrainingSamplesPerClass;
    private final SentinelMetrics metrics;

    private final AtomicReference<CentroidIncidentClassifier> model = new AtomicReference<>();

    public IncidentClassifier(SentinelProperties properties, SentinelMetrics metrics) {
        SentinelProperties.Resolution config = properties.getResolution();
        this.ruleConfidence = config.getRuleConfidence();
        this.mlPrecedenceConfidence = config.getMlPrecedenceConfidence();
        this.minTrainingSamplesPerClass = config.getMinTrainingSamplesPerClass();
        this.metrics = metrics;
    }

    public Optional<Classification> classify(IncidentMetrics snapshot, IncidentContext context) {
        return classify(snapshot, context, null);
    }

    /**
     * Classify a detection driven by {@code alert}; conditions on the alert's metric are
     * evaluated before all others.
     */
    public Optional<Classification> classify(IncidentMetrics snapshot, IncidentContext context, Alert alert) {
        Optional<DetectionCondition> matched = evaluateConditions(snapshot, context,
                alert != null ? MetricDimension.of(alert.getMetricName()) : null);
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        DetectionCondition condition = matched.get();

        CentroidIncidentClassifier trained = model.get();
        if (trained != null) {
            CentroidIncidentClassifier.Prediction prediction = trained.predict(snapshot, context);
            if (prediction.probability() >= mlPrecedenceConfidence) {
                return Optional.of(new Classification(prediction.type(), condition.getSeverity(),
                        prediction.probability(), ClassificationMethod.MODEL, condition));
            }
            log.debug("Classifier probability {} below {} for {}, using rules",
                    prediction.probability(), mlPrecedenceConfidence, prediction.type());
        }

        IncidentType type = refine(condition, alert != null ? alert.getType() : null);
        return Optional.of(new Classification(type, condition.getSeverity(), ruleConfidence,
                ClassificationMethod.RULES, condition));
    }

    /**
     * Retrain from closed incidents. Keeps the previous model when the history is not yet
     * rich enough.
     */
    public boolean train(List<Incident> closedIncidents) {
        Optional<CentroidIncidentClassifier> trained =
                CentroidIncidentClassifier.train(closedIncidents, minTrainingSamplesPerClass);
        trained.ifPresent(next -> {
            model.set(next);
            metrics.recordModelTrained();
            log.info("Incident classifier trained: types={}", next.knownTypes());
        });
        return trained.isPresent();
    }

    public boolean isTrained() {
        return model.get() != null;
    }

    // ========== Private Methods ==========

    Optional<DetectionCondition> evaluateConditions(IncidentMetrics snapshot, IncidentContext context,
                                                    MetricDimension focus) {
        if (focus != null) {
            for (DetectionCondition condition : DetectionCondition.values()) {
                if (condition.concerns(focus) && condition.matches(snapshot, context)) {
                    return Optional.of(condition);
                }
            }
        }
        for (DetectionCondition condition : DetectionCondition.values()) {
            if (condition.matches(snapshot, context)) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }

    static IncidentType refine(DetectionCondition condition, AnomalyType alertType) {
        if (alertType == AnomalyType.MEMORY_LEAK && condition.concerns(MetricDimension.MEMORY)) {
            return IncidentType.MEMORY_LEAK;
        }
        if (alertType == AnomalyType.NETWORK_ISSUES && condition.concerns(MetricDimension.RESPONSE_TIME)) {
            return IncidentType.NETWORK_TIMEOUT;
        }
        return condition.getType();
    }
}
