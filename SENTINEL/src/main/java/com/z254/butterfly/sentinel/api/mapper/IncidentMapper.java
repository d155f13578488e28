package com.z254.butterfly.sentinel.api.mapper;

import com.z254.butterfly.sentinel.api.dto.IncidentDto;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.Incident;

import java.util.List;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        return IncidentDto.builder()
                .id(incident.getId())
                .serviceName(incident.getServiceName())
                .type(incident.getType().code())
                .description(incident.getDescription())
                .severity(incident.getSeverity().name())
                .peakAlertSeverity(incident.getPeakAlertSeverity() != null
                        ? incident.getPeakAlertSeverity().name() : null)
                .status(incident.getStatus().name())
                .classificationConfidence(incident.getClassificationConfidence())
                .classificationMethod(incident.getClassificationMethod() != null
                        ? incident.getClassificationMethod().name() : null)
                .recommendedActions(codes(incident.getRecommendedActions()))
                .attemptedActions(codes(incident.getAttemptedActions()))
                .relatedAlertIds(List.copyOf(incident.getRelatedAlertIds()))
                .correlationId(incident.getCorrelationId())
                .resolutionAttempts(incident.getResolutionHistory().size())
                .escalationReason(incident.getEscalationReason())
                .createdAt(incident.getCreatedAt())
                .updatedAt(incident.getUpdatedAt())
                .resolvedAt(incident.getResolvedAt())
                .mttrMs(incident.getMttrMs())
                .build();
    }

    private static List<String> codes(List<ActionType> actions) {
        return actions.stream().map(ActionType::code).toList();
    }
}
