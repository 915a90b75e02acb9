package com.gpupool.cache;

import com.gpupool.core.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Time-bounded result cache keyed by {@link Fingerprint}.
 *
 * <p>Design:
 * <ul>
 *   <li>Entries are kept in insertion order; all entries share one TTL, so the head is
 *       always the next to expire.</li>
 *   <li>Expired entries are drained from the head on every put and dropped lazily on get.</li>
 *   <li>At capacity the oldest inserted entry is evicted (FIFO). Re-putting a key moves it
 *       to the tail with a fresh expiry.</li>
 * </ul>
 * All operations are synchronized.
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final long ttlMs;
    private final int maxSize;
    private final LongSupplier clock;
    private final LinkedHashMap<Fingerprint, Entry> entries = new LinkedHashMap<>();

    public ResultCache(long ttlMs, int maxSize) {
        this(ttlMs, maxSize, System::currentTimeMillis);
    }

    public ResultCache(long ttlMs, int maxSize, LongSupplier clock) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive");
        }
        this.ttlMs = ttlMs;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Cached result for the key, or empty if absent or expired.
     */
    public synchronized Optional<ValidationResult> get(Fingerprint key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt <= clock.getAsLong()) {
            entries.remove(key);
            log.trace("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.result);
    }

    public synchronized void put(Fingerprint key, ValidationResult result) {
        long now = clock.getAsLong();
        evictExpired(now);

        entries.remove(key);
        if (entries.size() >= maxSize) {
            Iterator<Map.Entry<Fingerprint, Entry>> oldest = entries.entrySet().iterator();
            Fingerprint evicted = oldest.next().getKey();
            oldest.remove();
            log.debug("Cache at capacity ({}), evicted {}", maxSize, evicted);
        }
        entries.put(key, new Entry(result, now + ttlMs));
    }

    /**
     * Number of stored entries, including expired ones not yet dropped.
     */
    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public int getMaxSize() {
        return maxSize;
    }

    private void evictExpired(long now) {
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiresAt > now) {
                break;
            }
            it.remove();
        }
    }

    private record Entry(ValidationResult result, long expiresAt) {}
}
