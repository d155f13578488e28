package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Environment of the service when the incident was detected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentContext {

    public static final String LOAD_NORMAL = "normal";
    public static final String LOAD_SPIKE = "spike";
    public static final String LOAD_DECLINING = "declining";

    @Builder.Default
    private String serviceVersion = "unknown";

    @Builder.Default
    private String environment = "production";

    /** Versions deployed inside the recent-deployment window, newest last */
    @Builder.Default
    private List<String> recentDeployments = new ArrayList<>();

    @Builder.Default
    private List<String> relatedAlerts = new ArrayList<>();

    /** Dependency name to health status */
    @Builder.Default
    private Map<String, String> dependencyHealth = new HashMap<>();

    /** normal, spike or declining */
    @Builder.Default
    private String loadPattern = LOAD_NORMAL;

    /** peak or off_peak */
    private String timeOfDay;

    private String dayOfWeek;

    public boolean hasRecentDeployment() {
        return !recentDeployments.isEmpty();
    }

    public boolean hasUnhealthyDependency() {
        return dependencyHealth.values().stream().anyMatch(status -> !"healthy".equalsIgnoreCase(status));
    }
}
