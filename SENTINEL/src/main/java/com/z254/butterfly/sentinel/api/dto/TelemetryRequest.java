package com.z254.butterfly.sentinel.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One telemetry sample. A missing timestamp means "now".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryRequest {

    @NotBlank(message = "Service name is required")
    private String serviceName;

    @NotBlank(message = "Metric name is required")
    private String metricName;

    @NotNull(message = "Value is required")
    private Double value;

    private Instant timestamp;
}
