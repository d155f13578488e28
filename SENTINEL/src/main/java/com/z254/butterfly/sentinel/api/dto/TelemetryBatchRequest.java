package com.z254.butterfly.sentinel.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryBatchRequest {

    @NotEmpty(message = "At least one sample is required")
    private List<@Valid TelemetryRequest> samples;
}
