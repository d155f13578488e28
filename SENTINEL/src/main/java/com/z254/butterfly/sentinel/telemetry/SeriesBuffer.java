package com.z254.butterfly.sentinel.telemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity ring buffer for one series. The oldest sample is overwritten when full.
 * All access is serialized on the buffer instance.
 */
final class SeriesBuffer {

    private final MetricSample[] ring;
    private int head;
    private int size;

    SeriesBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.ring = new MetricSample[capacity];
    }

    synchronized void append(MetricSample sample) {
        ring[head] = sample;
        head = (head + 1) % ring.length;
        if (size < ring.length) {
            size++;
        }
    }

    /**
     * Last {@code n} samples, oldest first.
     */
    synchronized List<MetricSample> last(int n) {
        int count = Math.min(Math.max(n, 0), size);
        List<MetricSample> out = new ArrayList<>(count);
        int start = head - count;
        for (int i = 0; i < count; i++) {
            int idx = Math.floorMod(start + i, ring.length);
            out.add(ring[idx]);
        }
        return Collections.unmodifiableList(out);
    }

    synchronized MetricSample newest() {
        if (size == 0) {
            return null;
        }
        return ring[Math.floorMod(head - 1, ring.length)];
    }

    synchronized int size() {
        return size;
    }

    int capacity() {
        return ring.length;
    }
}
