package com.gpupool.core;

import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Caller's view of a submitted task.
 * <p>
 * Follows the task's own completion without sharing it: completing this future does not
 * touch the task or any other caller waiting on it. {@link #cancel(boolean)} withdraws the
 * task from its queue and succeeds only while the task has not been admitted.
 */
public class TaskFuture extends CompletableFuture<ValidationResult> {

    private final String taskId;
    private final Predicate<String> withdraw;

    private TaskFuture(String taskId, Predicate<String> withdraw) {
        this.taskId = taskId;
        this.withdraw = withdraw;
    }

    /**
     * @param source   The task's completion
     * @param withdraw Removes a queued task by id, returning whether it was still queued
     */
    static TaskFuture following(String taskId, CompletableFuture<ValidationResult> source,
                                Predicate<String> withdraw) {
        TaskFuture future = new TaskFuture(taskId, withdraw);
        source.whenComplete((result, error) -> {
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(result);
            }
        });
        return future;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Cancel the task if it is still queued. A running or finished task is left alone.
     *
     * @param mayInterruptIfRunning Ignored; admitted tasks are never interrupted
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (isDone()) {
            return false;
        }
        // A withdrawn task cancels its completion, which cancels this future in turn
        return withdraw.test(taskId);
    }

    @Override
    public String toString() {
        return "TaskFuture[" + taskId + "] " + super.toString();
    }
}
