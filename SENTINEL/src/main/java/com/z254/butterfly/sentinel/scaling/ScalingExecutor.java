package com.z254.butterfly.sentinel.scaling;

import reactor.core.publisher.Mono;

/**
 * Applies an instance count change to the platform. Emits whether the change was accepted.
 */
public interface ScalingExecutor {

    Mono<Boolean> scale(ScalingDecision decision);
}
