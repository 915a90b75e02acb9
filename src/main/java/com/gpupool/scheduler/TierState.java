package com.gpupool.scheduler;

import com.gpupool.backend.TierBinding;
import com.gpupool.core.Tier;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Runtime state of one tier: the running set, its bound and the availability flag.
 * <p>
 * The running set is mutated only by the scheduler thread. The gauges are volatile copies
 * refreshed after each mutation so other threads can read utilization without locking.
 */
public class TierState {

    private final TierBinding binding;
    private final Set<String> running = new LinkedHashSet<>();

    private volatile int activeCount;
    private volatile int queuedCount;
    private volatile boolean available = true;

    public TierState(TierBinding binding) {
        this.binding = binding;
    }

    public Tier getTier() {
        return binding.tier();
    }

    public TierBinding getBinding() {
        return binding;
    }

    public int getMaxConcurrency() {
        return binding.maxConcurrency();
    }

    boolean hasFreeSlot() {
        return running.size() < binding.maxConcurrency();
    }

    void addRunning(String taskId) {
        if (!hasFreeSlot()) {
            throw new IllegalStateException("Tier " + getTier() + " is at capacity");
        }
        running.add(taskId);
        activeCount = running.size();
    }

    boolean removeRunning(String taskId) {
        boolean removed = running.remove(taskId);
        activeCount = running.size();
        return removed;
    }

    void updateQueued(int size) {
        this.queuedCount = size;
    }

    public int getActiveCount() {
        return activeCount;
    }

    public int getQueuedCount() {
        return queuedCount;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}
