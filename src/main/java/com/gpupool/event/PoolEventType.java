package com.gpupool.event;

/**
 * Kinds of events published by the pool.
 */
public enum PoolEventType {
    QUEUED,
    STARTED,
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED,
    CACHE_HIT,
    POOL_STARTED,
    POOL_STOPPED,
    QUEUES_CLEARED,
    WARMUP_STARTED,
    WARMUP_COMPLETE,
    WARMUP_FAILED;

    /**
     * Whether events of this type concern a single task.
     */
    public boolean isTaskEvent() {
        return switch (this) {
            case QUEUED, STARTED, COMPLETED, FAILED, TIMEOUT, CANCELLED, CACHE_HIT -> true;
            default -> false;
        };
    }
}
