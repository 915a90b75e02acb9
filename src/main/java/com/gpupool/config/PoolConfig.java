package com.gpupool.config;

import com.gpupool.core.Tier;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Root configuration for the GPU validation pool.
 *
 * @param name      Pool name identifier
 * @param scheduler Admission loop configuration
 * @param cache     Result cache configuration
 * @param backend   Remote execution backend configuration
 * @param tiers     Tier capacity profiles
 */
public record PoolConfig(
        String name,
        SchedulerConfig scheduler,
        CacheConfig cache,
        BackendConfig backend,
        List<TierConfig> tiers
) {
    public PoolConfig {
        scheduler = scheduler != null ? scheduler : SchedulerConfig.defaults();
        cache = cache != null ? cache : CacheConfig.defaults();
        backend = backend != null ? backend : BackendConfig.simulated();
        tiers = tiers != null ? List.copyOf(tiers) : List.of();
    }

    /**
     * Get tier config by tier.
     */
    public TierConfig getTier(Tier tier) {
        return tiers.stream()
                .filter(t -> t.tier() == tier)
                .findFirst()
                .orElse(null);
    }

    /**
     * Get map of tier to its config.
     */
    public Map<Tier, TierConfig> tiersByName() {
        return tiers.stream()
                .collect(Collectors.toMap(TierConfig::tier, Function.identity()));
    }

    /**
     * Default configuration: all three tiers, cache on, simulated backend.
     */
    public static PoolConfig defaults() {
        return new PoolConfig(
                "gpu-validation-pool",
                SchedulerConfig.defaults(),
                CacheConfig.defaults(),
                BackendConfig.simulated(),
                Arrays.stream(Tier.values()).map(TierConfig::defaults).toList()
        );
    }

    public PoolConfig withScheduler(SchedulerConfig value) {
        return new PoolConfig(name, value, cache, backend, tiers);
    }

    public PoolConfig withCache(CacheConfig value) {
        return new PoolConfig(name, scheduler, value, backend, tiers);
    }

    public PoolConfig withTiers(List<TierConfig> value) {
        return new PoolConfig(name, scheduler, cache, backend, value);
    }
}
