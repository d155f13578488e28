package com.z254.butterfly.sentinel.config;

import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for SENTINEL.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Telemetry buffering and ingestion</li>
 *     <li>Anomaly detection and forecasting models</li>
 *     <li>Alert deduplication and correlation</li>
 *     <li>Resolution workflow safety limits</li>
 *     <li>Scaling bounds and cooldowns</li>
 *     <li>Notification and action executor adapters</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private final Telemetry telemetry = new Telemetry();
    private final Ingestion ingestion = new Ingestion();
    private final Detection detection = new Detection();
    private final Forecast forecast = new Forecast();
    private final Capacity capacity = new Capacity();
    private final Alerting alerting = new Alerting();
    private final Resolution resolution = new Resolution();
    private final Scaling scaling = new Scaling();
    private final Notification notification = new Notification();
    private final Executor executor = new Executor();
    private final Loops loops = new Loops();

    /**
     * Per-series history buffer.
     */
    @Data
    public static class Telemetry {
        /** Samples retained per (service, metric) series */
        @Positive
        private int bufferCapacity = 1000;
    }

    /**
     * Producer/consumer ingestion pipeline.
     */
    @Data
    public static class Ingestion {
        /** Pending samples held before the oldest are dropped */
        @Positive
        private int queueCapacity = 10_000;

        /** Maximum samples applied per consumer batch */
        @Positive
        private int batchSize = 500;

        /** Consumer poll timeout while waiting for the first sample of a batch */
        private Duration pollTimeout = Duration.ofMillis(100);
    }

    /**
     * Anomaly detection.
     */
    @Data
    public static class Detection {
        private DetectorStrategy strategy = DetectorStrategy.ENSEMBLE;

        /** Minimum anomaly score that reaches the alert engine */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double anomalyThreshold = 0.7;

        /** Samples examined per detection */
        @Positive
        private int windowSize = 20;

        /** Buffered samples required before a series is examined at all */
        @Positive
        private int minSamples = 5;

        /** Samples required for a scored verdict */
        @Positive
        private int minHistory = 10;

        private double zScoreThreshold = 3.0;

        private double iqrMultiplier = 1.5;

        private final Ensemble ensemble = new Ensemble();

        @Data
        public static class Ensemble {
            private List<Long> seeds = List.of(42L, 43L, 44L);
            @Positive
            private int treesPerModel = 100;
            @Positive
            private int sampleSize = 256;
            private double contamination = 0.1;
            /** Samples a series needs before a model is trained for it */
            @Positive
            private int minTrainingSamples = 60;
            /** Forecast cycles between retraining passes */
            @Positive
            private int retrainEveryCycles = 10;
        }
    }

    /**
     * Time-series forecasting.
     */
    @Data
    public static class Forecast {
        @Positive
        private int horizon = 15;

        /** Wall-clock distance between forecast points */
        private Duration step = Duration.ofMinutes(1);

        @Positive
        private int minPoints = 10;

        /** Points required for the trend/seasonal model */
        @Positive
        private int advancedMinPoints = 20;

        /** Season length in samples; the seasonal term needs two full seasons */
        @Positive
        private int seasonalPeriod = 12;

        /** History fed to the models */
        @Positive
        private int windowSize = 100;
    }

    /**
     * Capacity limits per metric name.
     */
    @Data
    public static class Capacity {
        private Map<String, Double> limits = new HashMap<>(Map.of(
                "cpu_usage", 0.9,
                "memory_usage", 0.95,
                "disk_usage", 0.9,
                "thread_pool_utilization", 0.9,
                "connection_pool_utilization", 0.95,
                "cache_memory_usage", 0.9));

        private double defaultLimit = 1.0;

        /** Multiplier over the current value for unbounded rate/time metrics */
        private double unboundedMultiplier = 2.0;
    }

    /**
     * Alert engine.
     */
    @Data
    public static class Alerting {
        private Duration dedupWindow = Duration.ofMinutes(15);

        private double correlationScore = 0.85;

        private Set<AnomalyType> criticalEscalationTypes = EnumSet.of(
                AnomalyType.DEPENDENCY_FAILURE,
                AnomalyType.RESOURCE_EXHAUSTION,
                AnomalyType.ERROR_SPIKE);

        /** Alerts retained before the buffer is compacted */
        @Positive
        private int maxBufferedAlerts = 100;

        @Positive
        private int recentAlertsLimit = 50;

        /** Impact window reported when no forecast exists */
        private Duration defaultImpactWindow = Duration.ofMinutes(15);

        /** Impact window reported when the series is too short to judge */
        private Duration shortHistoryImpactWindow = Duration.ofMinutes(5);

        @Positive
        private int maxRecommendations = 6;

        /** Lowest alert severity promoted to an incident */
        private AlertSeverity incidentSeverityThreshold = AlertSeverity.MEDIUM;

        private double significantCorrelation = 0.5;

        private double strongCorrelation = 0.8;
    }

    /**
     * Incident classification and resolution workflows.
     */
    @Data
    public static class Resolution {
        private boolean autoResolutionEnabled = true;

        /** Minimum success probability for automated resolution */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;

        /** Maximum actions in a resolution plan */
        @Positive
        private int maxPlanLength = 3;

        /** Concurrently resolving incidents across all services */
        @Positive
        private int maxConcurrentResolutions = 3;

        private Duration actionTimeout = Duration.ofSeconds(30);

        /** Pause between actions so the system can settle */
        private Duration settleDelay = Duration.ofSeconds(2);

        /** Retries per failed action before it counts as failed */
        private int maxActionRetries = 1;

        /** Rule-based classification confidence */
        private double ruleConfidence = 0.8;

        /** Classifier probability needed to override the rule-based type */
        private double mlPrecedenceConfidence = 0.7;

        /** Learned success rate an action needs to be recommended */
        private double recommenderConfidenceCut = 0.3;

        /** Closed incidents per type before the classifier trains */
        @Positive
        private int minTrainingSamplesPerClass = 5;

        /** Deployments newer than this count as recent */
        private Duration recentDeploymentWindow = Duration.ofHours(2);
    }

    /**
     * Scaling decision loop.
     */
    @Data
    public static class Scaling {
        private Duration cooldown = Duration.ofMinutes(5);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceFloor = 0.6;

        /** Confidence assigned to utilisation-only decisions */
        private double utilizationConfidence = 0.7;

        @NotBlank
        private String loadMetric = "request_rate";

        private Duration executionDelay = Duration.ofMinutes(1);

        @Positive
        private int historySize = 100;

        private ResourceDefaults defaults = new ResourceDefaults();

        /** Per-service overrides keyed by service name */
        private Map<String, ResourceDefaults> services = new HashMap<>();

        @Data
        public static class ResourceDefaults {
            private int minInstances = 1;
            private int maxInstances = 5;
            private int initialInstances = 1;
            private double targetCpu = 0.7;
            private double targetMemory = 0.8;
            private String instanceType = "standard";
            private double costPerHour = 0.10;
            private boolean autoScalingEnabled = true;
        }
    }

    /**
     * Notification adapters.
     */
    @Data
    public static class Notification {
        private final Kafka kafka = new Kafka();

        @Data
        public static class Kafka {
            private boolean enabled = false;
            @NotBlank
            private String topic = "sentinel.notifications";
        }
    }

    /**
     * Remediation action executor adapter.
     */
    @Data
    public static class Executor {
        private ExecutionMode mode = ExecutionMode.DRY_RUN;

        @NotBlank
        private String url = "http://localhost:8084";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        private String actionPathPrefix = "/api/v1/actions";
    }

    /**
     * Cadences of the periodic engine loops.
     */
    @Data
    public static class Loops {
        /** Disable to drive the engine manually */
        private boolean enabled = true;
        private Duration detection = Duration.ofSeconds(1);
        private Duration forecast = Duration.ofSeconds(30);
        private Duration health = Duration.ofSeconds(30);
        private Duration scaling = Duration.ofSeconds(60);
        private Duration alertMaintenance = Duration.ofSeconds(10);
    }

    public enum DetectorStrategy {
        /** Isolation-forest ensemble with statistical fallback */
        ENSEMBLE,
        /** Z-score and IQR fence only */
        STATISTICAL
    }

    /**
     * Execution mode for remediation actions.
     */
    public enum ExecutionMode {
        /** Real execution through the remediation connector */
        PRODUCTION,
        /** Logged only, no side effects */
        DRY_RUN
    }
}
