package com.z254.butterfly.sentinel.api.v1;

import com.z254.butterfly.sentinel.api.dto.IncidentDto;
import com.z254.butterfly.sentinel.api.dto.IncidentListResponse;
import com.z254.butterfly.sentinel.api.mapper.IncidentMapper;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentStatus;
import com.z254.butterfly.sentinel.domain.service.IncidentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for incident querying. Incidents are opened and resolved by the engine.
 */
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident querying")
public class IncidentController {

    private final IncidentService incidentService;

    public IncidentController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "List incidents with optional filters, newest first")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status")
            @RequestParam(required = false) IncidentStatus status,
            @Parameter(description = "Filter by service")
            @RequestParam(required = false) String service,
            @Parameter(description = "Only active incidents")
            @RequestParam(defaultValue = "false") boolean active,
            @Parameter(description = "Page number")
            @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "20") int size) {

        return Mono.fromCallable(() -> {
            List<Incident> matching = active
                    ? incidentService.getActiveIncidents().stream()
                            .filter(i -> service == null || service.equals(i.getServiceName()))
                            .toList()
                    : incidentService.listIncidents(status, service);

            return ResponseEntity.ok(IncidentListResponse.builder()
                    .incidents(matching.stream()
                            .skip((long) Math.max(page, 0) * size)
                            .limit(Math.max(size, 0))
                            .map(IncidentMapper::toDto)
                            .toList())
                    .total(matching.size())
                    .page(page)
                    .size(size)
                    .build());
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        return Mono.justOrEmpty(incidentService.getIncident(id))
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/timeline")
    @Operation(summary = "Get incident timeline", description = "Get timeline events for an incident")
    public Mono<ResponseEntity<List<Incident.TimelineEvent>>> getTimeline(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        return Mono.justOrEmpty(incidentService.getIncident(id))
                .map(incident -> ResponseEntity.ok(List.copyOf(incident.getTimeline())))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/resolutions")
    @Operation(summary = "Get resolution history", description = "Actions attempted for an incident")
    public Mono<ResponseEntity<List<Incident.ResolutionRecord>>> getResolutions(
            @Parameter(description = "Incident ID") @PathVariable String id) {
        return Mono.justOrEmpty(incidentService.getIncident(id))
                .map(incident -> ResponseEntity.ok(List.copyOf(incident.getResolutionHistory())))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
