package com.gpupool.backend;

import com.gpupool.config.PoolConfig;
import com.gpupool.config.TierConfig;
import com.gpupool.core.Tier;
import com.gpupool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Static mapping from tier to its remote handle and concurrency limit.
 */
public final class TierRegistry {

    private static final Logger log = LoggerFactory.getLogger(TierRegistry.class);

    private final Map<Tier, TierBinding> bindings;

    private TierRegistry(Map<Tier, TierBinding> bindings) {
        if (bindings.isEmpty()) {
            throw new ConfigurationException("At least one tier must be registered");
        }
        this.bindings = Collections.unmodifiableMap(new EnumMap<>(bindings));
    }

    /**
     * Build a registry from configuration, creating one handle per tier.
     */
    public static TierRegistry fromConfig(PoolConfig config, Function<TierConfig, RemoteExecutionHandle> handleFactory) {
        Builder builder = builder();
        for (TierConfig tierConfig : config.tiers()) {
            builder.register(TierBinding.of(tierConfig, handleFactory.apply(tierConfig)));
            log.info("Registered tier {} (gpu={}, maxConcurrency={}, cost={})",
                    tierConfig.tier(), tierConfig.gpu(), tierConfig.maxConcurrency(), tierConfig.costPerRun());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the binding for a tier.
     *
     * @throws IllegalArgumentException if the tier is not registered
     */
    public TierBinding get(Tier tier) {
        TierBinding binding = bindings.get(tier);
        if (binding == null) {
            throw new IllegalArgumentException("Tier not registered: " + tier);
        }
        return binding;
    }

    public boolean contains(Tier tier) {
        return bindings.containsKey(tier);
    }

    public Set<Tier> tiers() {
        return bindings.keySet();
    }

    public static final class Builder {
        private final Map<Tier, TierBinding> bindings = new EnumMap<>(Tier.class);

        public Builder register(TierBinding binding) {
            if (bindings.putIfAbsent(binding.tier(), binding) != null) {
                throw new ConfigurationException("Tier " + binding.tier() + " registered twice");
            }
            return this;
        }

        public Builder register(Tier tier, RemoteExecutionHandle handle, int maxConcurrency) {
            TierConfig defaults = TierConfig.defaults(tier);
            return register(new TierBinding(tier, defaults.gpu(), handle, maxConcurrency,
                    defaults.costPerRun(), defaults.estimatedDurationMs()));
        }

        public TierRegistry build() {
            return new TierRegistry(bindings);
        }
    }
}
