package com.gpupool.backend;

import com.gpupool.config.TierConfig;
import com.gpupool.core.Tier;

import java.util.Objects;

/**
 * A tier's remote handle together with its capacity and cost profile.
 */
public record TierBinding(
        Tier tier,
        String gpu,
        RemoteExecutionHandle handle,
        int maxConcurrency,
        double costPerRun,
        long estimatedDurationMs
) {
    public TierBinding {
        Objects.requireNonNull(tier, "tier cannot be null");
        Objects.requireNonNull(handle, "handle cannot be null");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive for tier " + tier);
        }
    }

    public static TierBinding of(TierConfig config, RemoteExecutionHandle handle) {
        return new TierBinding(config.tier(), config.gpu(), handle, config.maxConcurrency(),
                config.costPerRun(), config.estimatedDurationMs());
    }
}
