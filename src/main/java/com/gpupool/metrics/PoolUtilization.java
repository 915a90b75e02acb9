package com.gpupool.metrics;

import com.gpupool.core.Tier;

import java.util.Map;

/**
 * Utilization of every tier at one instant.
 *
 * @param tiers     Per-tier figures
 * @param timestamp Sample time (epoch millis)
 */
public record PoolUtilization(Map<Tier, TierUtilization> tiers, long timestamp) {

    public PoolUtilization {
        tiers = Map.copyOf(tiers);
    }

    public TierUtilization tier(Tier tier) {
        return tiers.get(tier);
    }

    public int totalActive() {
        return tiers.values().stream().mapToInt(TierUtilization::active).sum();
    }

    public int totalCapacity() {
        return tiers.values().stream().mapToInt(TierUtilization::maxConcurrency).sum();
    }

    public int totalQueued() {
        return tiers.values().stream().mapToInt(TierUtilization::queued).sum();
    }

    public double overallRatio() {
        int capacity = totalCapacity();
        return capacity == 0 ? 0.0 : (double) totalActive() / capacity;
    }

    /**
     * @param tier           Tier
     * @param active         Running tasks
     * @param maxConcurrency Concurrency bound
     * @param queued         Waiting tasks
     * @param available      Last known availability
     */
    public record TierUtilization(Tier tier, int active, int maxConcurrency, int queued, boolean available) {

        public double ratio() {
            return maxConcurrency == 0 ? 0.0 : (double) active / maxConcurrency;
        }
    }
}
