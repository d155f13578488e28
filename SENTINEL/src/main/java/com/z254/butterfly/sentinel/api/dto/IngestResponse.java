package com.z254.butterfly.sentinel.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Acknowledgement of queued samples. Samples are processed asynchronously.
 */
@Data
@Builder
public class IngestResponse {
    private int accepted;
    private int queueDepth;
    private long droppedSamples;
}
