package com.gpupool.metrics;

/**
 * Point-in-time copy of the pool counters.
 *
 * @param submitted         Tasks accepted, including cache hits and bulk entries
 * @param completed         Tasks that executed successfully
 * @param failed            Tasks that failed during execution
 * @param queueTimeouts     Tasks failed without execution after waiting too long
 * @param cancelled         Tasks cancelled while queued
 * @param cacheHits         Submissions answered from the cache
 * @param cacheMisses       Submissions that needed execution
 * @param joinedInFlight    Submissions answered by an identical task already in flight
 * @param totalCost         Sum of per-run costs of completed executions
 * @param averageDurationMs Mean execution time of completed executions
 */
public record MetricsSnapshot(
        long submitted,
        long completed,
        long failed,
        long queueTimeouts,
        long cancelled,
        long cacheHits,
        long cacheMisses,
        long joinedInFlight,
        double totalCost,
        double averageDurationMs
) {
    /**
     * hits / (hits + misses), or 0 before any lookup.
     */
    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups == 0 ? 0.0 : (double) cacheHits / lookups;
    }
}
