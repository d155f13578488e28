package com.z254.butterfly.sentinel.telemetry;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer/consumer intake in front of the {@link TelemetryBuffer}.
 * <p>
 * Producers never block: when the queue is full the oldest pending sample is discarded.
 * A single consumer thread drains the queue in batches, applies them to the buffer and counts
 * the samples each series received, so the detection loop can judge every one of them.
 */
@Slf4j
@Component
public class IngestionPipeline implements SmartLifecycle {

    private final TelemetryBuffer buffer;
    private final SentinelMetrics metrics;
    private final BlockingQueue<MetricSample> queue;
    private final int batchSize;
    private final Duration pollTimeout;

    // samples applied per series since the last takeNewSamples(), guarded by consumeLock
    private final Map<MetricKey, Integer> newSamples = new HashMap<>();
    private final AtomicLong droppedSamples = new AtomicLong();
    private final Object consumeLock = new Object();

    private volatile boolean running;
    private Thread consumer;

    public IngestionPipeline(TelemetryBuffer buffer,
                             SentinelMetrics metrics,
                             SentinelProperties properties) {
        this.buffer = buffer;
        this.metrics = metrics;
        this.queue = new ArrayBlockingQueue<>(properties.getIngestion().getQueueCapacity());
        this.batchSize = properties.getIngestion().getBatchSize();
        this.pollTimeout = properties.getIngestion().getPollTimeout();
    }

    /**
     * Enqueue one sample.
     *
     * @throws IllegalArgumentException when the sample is malformed
     */
    public void submit(String service, String metric, double value, Instant timestamp) {
        MetricSample sample;
        try {
            sample = MetricSample.of(service, metric, value, timestamp);
        } catch (IllegalArgumentException e) {
            metrics.recordSampleRejected();
            throw e;
        }
        enqueue(sample);
    }

    public void submitAll(Collection<MetricSample> samples) {
        samples.forEach(s -> submit(s.serviceName(), s.metricName(), s.value(), s.timestamp()));
    }

    private void enqueue(MetricSample sample) {
        while (!queue.offer(sample)) {
            if (queue.poll() != null) {
                droppedSamples.incrementAndGet();
                metrics.recordSampleDropped();
            }
        }
        metrics.setIngestionQueueDepth(queue.size());
    }

    /**
     * Apply everything queued so far on the calling thread.
     *
     * @return number of samples applied
     */
    public int drainPending() {
        int applied = 0;
        List<MetricSample> batch = new ArrayList<>(batchSize);
        while (queue.drainTo(batch, batchSize) > 0) {
            applied += apply(batch);
            batch.clear();
        }
        return applied;
    }

    /**
     * Every series that received samples since the last call, with enough preceding history
     * to rebuild a {@code context}-sample window ending at each new sample. Every applied
     * sample is handed out exactly once.
     */
    public List<NewSamples> takeNewSamples(int context) {
        List<NewSamples> taken = new ArrayList<>();
        synchronized (consumeLock) {
            newSamples.forEach((key, count) -> {
                MetricWindow history = buffer.window(key, context + count - 1);
                taken.add(new NewSamples(history, Math.min(count, history.size())));
            });
            newSamples.clear();
        }
        return taken;
    }

    public int queueDepth() {
        return queue.size();
    }

    public long droppedSamples() {
        return droppedSamples.get();
    }

    private int apply(List<MetricSample> batch) {
        synchronized (consumeLock) {
            for (MetricSample sample : batch) {
                buffer.ingest(sample);
                newSamples.merge(sample.key(), 1, Integer::sum);
            }
        }
        metrics.recordSamplesIngested(batch.size());
        metrics.setIngestionQueueDepth(queue.size());
        return batch.size();
    }

    private void consumeLoop() {
        List<MetricSample> batch = new ArrayList<>(batchSize);
        while (running) {
            try {
                MetricSample first = queue.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                apply(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Failed to apply telemetry batch of {} samples: {}", batch.size(), e.getMessage(), e);
            } finally {
                batch.clear();
            }
        }
        log.info("Telemetry consumer stopped");
    }

    // ========== Lifecycle ==========

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        consumer = new Thread(this::consumeLoop, "sentinel-ingestion");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Telemetry consumer started: batchSize={}, pollTimeout={}", batchSize, pollTimeout);
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (consumer != null) {
            consumer.interrupt();
            try {
                consumer.join(pollTimeout.toMillis() * 10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            consumer = null;
        }
        drainPending();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
