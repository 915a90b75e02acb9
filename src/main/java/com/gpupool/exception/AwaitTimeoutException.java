package com.gpupool.exception;

/**
 * The caller stopped waiting for a task before it reached a terminal state.
 */
public class AwaitTimeoutException extends PoolException {

    private final String taskId;

    public AwaitTimeoutException(String taskId, long waitedMs) {
        super("Gave up waiting for task " + taskId + " after " + waitedMs + "ms");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
