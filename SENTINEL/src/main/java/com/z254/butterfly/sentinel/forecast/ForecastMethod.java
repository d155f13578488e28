package com.z254.butterfly.sentinel.forecast;

public enum ForecastMethod {
    /** Least-squares line over the recent window */
    LINEAR,
    /** Exponential smoothing with additive trend */
    HOLT,
    /** Exponential smoothing with additive trend and season */
    HOLT_WINTERS
}
