package com.gpupool.metrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded ring buffer of utilization samples. Once full, each new sample replaces the oldest.
 */
public class UtilizationHistory {

    private final PoolUtilization[] samples;
    private int next;
    private int size;

    public UtilizationHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive");
        }
        this.samples = new PoolUtilization[capacity];
    }

    public synchronized void record(PoolUtilization sample) {
        samples[next] = sample;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    /**
     * Samples oldest first.
     */
    public synchronized List<PoolUtilization> snapshot() {
        List<PoolUtilization> result = new ArrayList<>(size);
        int start = (next - size + samples.length) % samples.length;
        for (int i = 0; i < size; i++) {
            result.add(samples[(start + i) % samples.length]);
        }
        return result;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return samples.length;
    }
}
