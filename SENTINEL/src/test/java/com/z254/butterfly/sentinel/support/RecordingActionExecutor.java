package com.z254.butterfly.sentinel.support;

import com.z254.butterfly.sentinel.resolution.ActionExecutor;
import com.z254.butterfly.sentinel.resolution.ActionRequest;
import com.z254.butterfly.sentinel.resolution.ActionResult;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Records every request and answers from scripted responses, succeeding by default.
 * An optional effect runs after a successful forward action, e.g. to publish recovered
 * telemetry.
 */
public class RecordingActionExecutor implements ActionExecutor {

    private final Clock clock;
    private final List<ActionRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<Supplier<Mono<ActionResult>>>> scripted = new ConcurrentHashMap<>();
    private final Map<String, Consumer<ActionRequest>> effects = new ConcurrentHashMap<>();

    public RecordingActionExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<ActionResult> execute(ActionRequest request) {
        requests.add(request);
        Deque<Supplier<Mono<ActionResult>>> queue = scripted.get(request.getAction());
        Supplier<Mono<ActionResult>> next = null;
        if (queue != null) {
            synchronized (queue) {
                next = queue.pollFirst();
            }
        }
        if (next != null) {
            return next.get();
        }
        Consumer<ActionRequest> effect = effects.get(request.getAction());
        if (effect != null && !request.isRollback()) {
            effect.accept(request);
        }
        return Mono.just(ActionResult.succeeded("ok: " + request.getAction(), clock.instant()));
    }

    /**
     * Fail the next call of the action.
     */
    public RecordingActionExecutor failNext(String action, boolean critical) {
        return script(action, () -> Mono.just(ActionResult.failed(action + " failed", critical, clock.instant())));
    }

    public RecordingActionExecutor errorNext(String action, Throwable error) {
        return script(action, () -> Mono.error(error));
    }

    /**
     * The next call of the action never completes.
     */
    public RecordingActionExecutor hangNext(String action) {
        return script(action, Mono::never);
    }

    public RecordingActionExecutor onSuccess(String action, Consumer<ActionRequest> effect) {
        effects.put(action, effect);
        return this;
    }

    public List<ActionRequest> requests() {
        return List.copyOf(requests);
    }

    public List<String> executedActions() {
        return requests.stream().map(ActionRequest::getAction).toList();
    }

    private RecordingActionExecutor script(String action, Supplier<Mono<ActionResult>> response) {
        Deque<Supplier<Mono<ActionResult>>> queue = scripted.computeIfAbsent(action, a -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(response);
        }
        return this;
    }
}
