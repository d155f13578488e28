package com.z254.butterfly.sentinel.forecast;

import java.time.Instant;

/**
 * One projected value with its confidence interval.
 */
public record ForecastPoint(Instant time, double value, double lower, double upper) {
}
