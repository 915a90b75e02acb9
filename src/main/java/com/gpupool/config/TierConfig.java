package com.gpupool.config;

import com.gpupool.core.Tier;

/**
 * Per-tier capacity and cost profile.
 *
 * @param tier                Tier identifier
 * @param gpu                 GPU class requested from the backend (e.g. T4)
 * @param maxConcurrency      Max tasks running at once
 * @param costPerRun          Cost charged per execution
 * @param estimatedDurationMs Typical run time, reported when a task starts
 */
public record TierConfig(
        Tier tier,
        String gpu,
        int maxConcurrency,
        double costPerRun,
        long estimatedDurationMs
) {
    public static TierConfig defaults(Tier tier) {
        return switch (tier) {
            case LOW -> new TierConfig(tier, "T4", 10, 0.01, 15_000);
            case MID -> new TierConfig(tier, "A10G", 5, 0.02, 20_000);
            case HIGH -> new TierConfig(tier, "A100", 2, 0.05, 25_000);
        };
    }

    public TierConfig withMaxConcurrency(int value) {
        return new TierConfig(tier, gpu, value, costPerRun, estimatedDurationMs);
    }
}
