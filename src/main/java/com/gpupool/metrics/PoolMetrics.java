package com.gpupool.metrics;

/**
 * Pool-wide counters. Updated from the scheduler and worker threads.
 */
public class PoolMetrics {

    private long submitted;
    private long completed;
    private long failed;
    private long queueTimeouts;
    private long cancelled;
    private long cacheHits;
    private long cacheMisses;
    private long joinedInFlight;
    private double totalCost;
    private double averageDurationMs;

    public synchronized void recordSubmitted() {
        submitted++;
    }

    public synchronized void recordCacheHit() {
        cacheHits++;
    }

    public synchronized void recordCacheMiss() {
        cacheMisses++;
    }

    public synchronized void recordJoinedInFlight() {
        joinedInFlight++;
    }

    /**
     * Count a successful execution and fold its duration into the running average.
     */
    public synchronized void recordCompleted(long durationMs, double cost) {
        completed++;
        totalCost += cost;
        averageDurationMs += (durationMs - averageDurationMs) / completed;
    }

    public synchronized void recordFailed() {
        failed++;
    }

    public synchronized void recordQueueTimeout() {
        queueTimeouts++;
    }

    public synchronized void recordCancelled() {
        cancelled++;
    }

    public synchronized MetricsSnapshot snapshot() {
        return new MetricsSnapshot(submitted, completed, failed, queueTimeouts, cancelled,
                cacheHits, cacheMisses, joinedInFlight, totalCost, averageDurationMs);
    }
}
