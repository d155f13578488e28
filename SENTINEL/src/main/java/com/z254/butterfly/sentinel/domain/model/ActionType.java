package com.z254.butterfly.sentinel.domain.model;

import java.util.Locale;

/**
 * Automated resolution actions understood by the action executor.
 */
public enum ActionType {
    RESTART_SERVICE,
    SCALE_UP,
    SCALE_DOWN,
    CLEAR_CACHE,
    ROLLBACK_DEPLOYMENT,
    APPLY_HOTFIX,
    FAILOVER,
    CIRCUIT_BREAKER,
    GRACEFUL_SHUTDOWN,
    RESET_CONNECTIONS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Name of the compensating action recorded for rollback.
     */
    public String rollbackName() {
        return switch (this) {
            case SCALE_UP -> "scale_down_to_original";
            case SCALE_DOWN -> "scale_up_to_original";
            case RESTART_SERVICE -> "restore_previous_state";
            case ROLLBACK_DEPLOYMENT -> "redeploy_to_target_version";
            case CLEAR_CACHE -> "restore_cache_if_possible";
            case FAILOVER -> "failback_to_primary";
            case CIRCUIT_BREAKER -> "close_circuit_breaker";
            default -> "undo_" + code();
        };
    }
}
