package com.gpupool.config;

/**
 * Result cache configuration.
 *
 * @param enabled Whether results are cached at all
 * @param ttlMs   Time-to-live of every entry
 * @param maxSize Maximum number of entries
 */
public record CacheConfig(
        boolean enabled,
        long ttlMs,
        int maxSize
) {
    public static CacheConfig defaults() {
        return new CacheConfig(true, 300_000, 100);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(false, 300_000, 100);
    }
}
