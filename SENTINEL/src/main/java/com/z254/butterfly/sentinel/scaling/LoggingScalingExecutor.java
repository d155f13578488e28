package com.z254.butterfly.sentinel.scaling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Records scaling decisions without touching any platform.
 */
@Slf4j
@Component
public class LoggingScalingExecutor implements ScalingExecutor {

    @Override
    public Mono<Boolean> scale(ScalingDecision decision) {
        log.info("Scaling {} {} -> {} instances at {} (trigger={}, rollbackCriteria={})",
                decision.getServiceName(), decision.getCurrentInstances(), decision.getTargetInstances(),
                decision.getExecuteAt(), decision.getTrigger(), decision.getRollbackCriteria());
        return Mono.just(true);
    }
}
