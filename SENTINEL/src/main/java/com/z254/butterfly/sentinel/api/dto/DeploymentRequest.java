package com.z254.butterfly.sentinel.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Deployment notification, used as classification context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentRequest {

    @NotBlank(message = "Service name is required")
    private String serviceName;

    @NotBlank(message = "Version is required")
    private String version;

    private Instant deployedAt;
}
