package com.z254.butterfly.sentinel.health;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    DEGRADED,
    CRITICAL,
    DOWN;

    public static HealthStatus fromScore(double overall) {
        if (overall >= 90) {
            return HEALTHY;
        }
        if (overall >= 75) {
            return WARNING;
        }
        if (overall >= 50) {
            return DEGRADED;
        }
        if (overall >= 25) {
            return CRITICAL;
        }
        return DOWN;
    }
}
