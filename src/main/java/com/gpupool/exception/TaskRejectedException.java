package com.gpupool.exception;

/**
 * Exception thrown when a task cannot be accepted by the pool.
 * Typically because the pool is not running.
 */
public class TaskRejectedException extends PoolException {

    public TaskRejectedException(String message) {
        super(message);
    }

    public TaskRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
