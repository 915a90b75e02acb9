package com.gpupool.event;

import com.gpupool.core.Tier;
import com.gpupool.core.ValidationTask;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Something that happened in the pool.
 *
 * @param type      Event type
 * @param taskId    Task the event concerns, null for pool-level events
 * @param tier      Tier the event concerns, null if not tier-specific
 * @param payload   Type-specific details (result, error, position, ...)
 * @param timestamp When the event was published
 */
public record PoolEvent(
        PoolEventType type,
        String taskId,
        Tier tier,
        Map<String, Object> payload,
        Instant timestamp
) {
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String POSITION = "position";
    public static final String ESTIMATED_DURATION_MS = "estimatedDurationMs";
    public static final String WAITED_MS = "waitedMs";
    public static final String COUNT = "count";

    public PoolEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        if (type.isTaskEvent() && taskId == null) {
            throw new IllegalArgumentException(type + " event requires a task id");
        }
    }

    public static PoolEvent of(PoolEventType type, ValidationTask task, Map<String, Object> payload) {
        return new PoolEvent(type, task.getId(), task.getTier(), payload, Instant.now());
    }

    public static PoolEvent of(PoolEventType type, ValidationTask task) {
        return of(type, task, Map.of());
    }

    public static PoolEvent pool(PoolEventType type, Tier tier, Map<String, Object> payload) {
        return new PoolEvent(type, null, tier, payload, Instant.now());
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(payload.get(key));
    }
}
