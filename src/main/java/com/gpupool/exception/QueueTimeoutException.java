package com.gpupool.exception;

import com.gpupool.core.Tier;

/**
 * A task waited in its tier queue longer than the configured queue timeout.
 * The task was never dispatched to the remote backend.
 */
public class QueueTimeoutException extends PoolException {

    private final String taskId;
    private final Tier tier;
    private final long waitedMs;

    public QueueTimeoutException(String taskId, Tier tier, long waitedMs) {
        super("Task " + taskId + " timed out in " + tier + " queue after " + waitedMs + "ms");
        this.taskId = taskId;
        this.tier = tier;
        this.waitedMs = waitedMs;
    }

    public String getTaskId() {
        return taskId;
    }

    public Tier getTier() {
        return tier;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
