package com.gpupool.exception;

/**
 * The remote backend returned an error, the call itself failed,
 * or the response could not be turned into a result.
 */
public class ExecutionFailureException extends PoolException {

    private final String taskId;

    public ExecutionFailureException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public ExecutionFailureException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
