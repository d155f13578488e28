package com.z254.butterfly.sentinel.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
public class IncidentDto {
    private String id;
    private String serviceName;
    private String type;
    private String description;
    private String severity;
    private String peakAlertSeverity;
    private String status;
    private double classificationConfidence;
    private String classificationMethod;
    private List<String> recommendedActions;
    private List<String> attemptedActions;
    private List<String> relatedAlertIds;
    private String correlationId;
    private int resolutionAttempts;
    private String escalationReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant resolvedAt;
    private Long mttrMs;
}
