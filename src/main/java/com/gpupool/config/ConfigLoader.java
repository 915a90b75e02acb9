package com.gpupool.config;

import com.gpupool.core.Tier;
import com.gpupool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads pool configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.]+)(?::([^}]*))?}");

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static PoolConfig load(String path) {
        return load(path, System::getenv);
    }

    /**
     * Load configuration, resolving ${NAME} and ${NAME:default} placeholders with the given lookup.
     */
    public static PoolConfig load(String path, UnaryOperator<String> env) {
        log.info("Loading GPU pool configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream, env);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static PoolConfig parse(InputStream inputStream, UnaryOperator<String> env) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The pool section may sit at the root or under 'gpu-pool'
        Map<String, Object> poolMap = root.containsKey("gpu-pool")
                ? (Map<String, Object>) root.get("gpu-pool")
                : root;

        String name = getString(poolMap, "name", "gpu-validation-pool", env);
        SchedulerConfig scheduler = parseScheduler((Map<String, Object>) poolMap.get("scheduler"), env);
        CacheConfig cache = parseCache((Map<String, Object>) poolMap.get("cache"), env);
        BackendConfig backend = parseBackend((Map<String, Object>) poolMap.get("backend"), env);
        List<TierConfig> tiers = parseTiers((List<Map<String, Object>>) poolMap.get("tiers"), env);

        PoolConfig config = new PoolConfig(name, scheduler, cache, backend, tiers);
        validate(config);

        log.info("Loaded GPU pool configuration: {} with {} tiers, backend: {}, cache: {}",
                name, tiers.size(), backend.type(), cache.enabled() ? "on" : "off");

        return config;
    }

    private static SchedulerConfig parseScheduler(Map<String, Object> map, UnaryOperator<String> env) {
        SchedulerConfig defaults = SchedulerConfig.defaults();
        if (map == null) {
            return defaults;
        }
        return new SchedulerConfig(
                getLong(map, "tick-interval-ms", defaults.tickIntervalMs(), env),
                getLong(map, "queue-timeout-ms", defaults.queueTimeoutMs(), env),
                getLong(map, "execution-margin-ms", defaults.executionMarginMs(), env),
                getLong(map, "utilization-sample-interval-ms", defaults.utilizationSampleIntervalMs(), env),
                getInt(map, "utilization-history-size", defaults.utilizationHistorySize(), env),
                getLong(map, "health-check-interval-ms", defaults.healthCheckIntervalMs(), env),
                getBoolean(map, "dedupe-in-flight", defaults.dedupeInFlight(), env)
        );
    }

    private static CacheConfig parseCache(Map<String, Object> map, UnaryOperator<String> env) {
        CacheConfig defaults = CacheConfig.defaults();
        if (map == null) {
            return defaults;
        }
        return new CacheConfig(
                getBoolean(map, "enabled", defaults.enabled(), env),
                getLong(map, "ttl-ms", defaults.ttlMs(), env),
                getInt(map, "max-size", defaults.maxSize(), env)
        );
    }

    private static BackendConfig parseBackend(Map<String, Object> map, UnaryOperator<String> env) {
        BackendConfig defaults = BackendConfig.simulated();
        if (map == null) {
            return defaults;
        }
        String typeStr = getString(map, "type", defaults.type().name(), env);
        BackendType type;
        try {
            type = BackendType.valueOf(typeStr.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown backend type '" + typeStr + "'", e);
        }
        return new BackendConfig(
                type,
                getString(map, "endpoint", null, env),
                getString(map, "api-key", null, env),
                getLong(map, "timeout-ms", defaults.timeoutMs(), env),
                getInt(map, "max-retries", defaults.maxRetries(), env),
                getLong(map, "retry-backoff-ms", defaults.retryBackoffMs(), env),
                getLong(map, "simulated-latency-ms", defaults.simulatedLatencyMs(), env),
                getInt(map, "simulated-iterations", defaults.simulatedIterations(), env)
        );
    }

    private static List<TierConfig> parseTiers(List<Map<String, Object>> list, UnaryOperator<String> env) {
        if (list == null || list.isEmpty()) {
            log.warn("No tiers configured, using defaults for all tiers");
            return PoolConfig.defaults().tiers();
        }

        List<TierConfig> tiers = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> tierMap = list.get(i);
            String tierName = getString(tierMap, "name", null, env);
            if (tierName == null) {
                throw new ConfigurationException("Tier entry " + i + " has no name");
            }
            Tier tier;
            try {
                tier = Tier.parse(tierName);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown tier '" + tierName + "'", e);
            }
            TierConfig defaults = TierConfig.defaults(tier);
            TierConfig tierConfig = new TierConfig(
                    tier,
                    getString(tierMap, "gpu", defaults.gpu(), env),
                    getInt(tierMap, "max-concurrency", defaults.maxConcurrency(), env),
                    getDouble(tierMap, "cost-per-run", defaults.costPerRun(), env),
                    getLong(tierMap, "estimated-duration-ms", defaults.estimatedDurationMs(), env)
            );
            tiers.add(tierConfig);

            log.debug("Parsed tier: name={}, gpu={}, maxConcurrency={}",
                    tier, tierConfig.gpu(), tierConfig.maxConcurrency());
        }
        return tiers;
    }

    private static void validate(PoolConfig config) {
        SchedulerConfig scheduler = config.scheduler();
        if (scheduler.tickIntervalMs() <= 0) {
            throw new ConfigurationException("scheduler.tick-interval-ms must be positive");
        }
        if (scheduler.queueTimeoutMs() <= 0) {
            throw new ConfigurationException("scheduler.queue-timeout-ms must be positive");
        }
        if (config.cache().enabled() && (config.cache().ttlMs() <= 0 || config.cache().maxSize() <= 0)) {
            throw new ConfigurationException("cache.ttl-ms and cache.max-size must be positive when the cache is enabled");
        }

        Set<Tier> seen = EnumSet.noneOf(Tier.class);
        for (TierConfig tier : config.tiers()) {
            if (!seen.add(tier.tier())) {
                throw new ConfigurationException("Tier " + tier.tier() + " is configured twice");
            }
            if (tier.maxConcurrency() <= 0) {
                throw new ConfigurationException("Tier " + tier.tier() + " must allow at least one concurrent task");
            }
        }

        BackendConfig backend = config.backend();
        if (backend.type() == BackendType.HTTP && (backend.endpoint() == null || backend.endpoint().isBlank())) {
            throw new ConfigurationException("backend.endpoint is required for the HTTP backend");
        }
    }

    // Helper methods

    static String resolve(String value, UnaryOperator<String> env) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String resolved = env.apply(matcher.group(1));
            if (resolved == null) {
                resolved = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue,
                                    UnaryOperator<String> env) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        String resolved = resolve(value.toString(), env);
        return resolved.isEmpty() ? defaultValue : resolved;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue, UnaryOperator<String> env) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number number) return number.intValue();
        return Integer.parseInt(resolve(value.toString(), env).trim());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue, UnaryOperator<String> env) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number number) return number.longValue();
        return Long.parseLong(resolve(value.toString(), env).trim());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue,
                                    UnaryOperator<String> env) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number number) return number.doubleValue();
        return Double.parseDouble(resolve(value.toString(), env).trim());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue,
                                      UnaryOperator<String> env) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean bool) return bool;
        return Boolean.parseBoolean(resolve(value.toString(), env).trim());
    }
}
