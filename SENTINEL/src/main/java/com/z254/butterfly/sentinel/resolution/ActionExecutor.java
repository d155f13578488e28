package com.z254.butterfly.sentinel.resolution;

import reactor.core.publisher.Mono;

/**
 * The only seam through which the engine touches real infrastructure.
 * <p>
 * Implementations report ordinary failures as an unsuccessful {@link ActionResult}, or
 * signal {@link ActionExecutionException}; the caller applies its own timeout.
 */
public interface ActionExecutor {

    Mono<ActionResult> execute(ActionRequest request);
}
