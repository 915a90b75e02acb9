package com.gpupool.core;

import com.gpupool.batch.BatchResult;
import com.gpupool.event.PoolEventBus;
import com.gpupool.metrics.MetricsSnapshot;
import com.gpupool.metrics.PoolUtilization;

import java.util.List;

/**
 * Main entry point for submitting validations to the GPU pool.
 * Tasks are queued per tier by priority and run under each tier's concurrency bound.
 */
public interface ValidationPool {

    /**
     * Start the admission loop. Idempotent.
     */
    void start();

    /**
     * Stop the pool. Still-queued tasks are cancelled; running tasks finish. Terminal.
     */
    void stop();

    boolean isRunning();

    /**
     * Submit a validation and wait for its result.
     *
     * @throws com.gpupool.exception.TaskRejectedException      if the pool is not running
     * @throws com.gpupool.exception.PoolUnavailableException   if the tier is marked unavailable
     * @throws com.gpupool.exception.QueueTimeoutException      if the task waited too long in queue
     * @throws com.gpupool.exception.ExecutionFailureException  if the backend call failed
     * @throws com.gpupool.exception.AwaitTimeoutException      if the caller's wait budget ran out
     * @throws java.util.concurrent.CancellationException       if the task was cancelled
     */
    ValidationResult submit(TaskSpec spec);

    /**
     * Submit a validation without waiting.
     *
     * @return Future carrying the task id, completing with the result or exceptionally with the
     *         task's failure; cancelling it withdraws the task while it is still queued
     * @throws com.gpupool.exception.TaskRejectedException    if the pool is not running
     * @throws com.gpupool.exception.PoolUnavailableException if the tier is marked unavailable
     */
    TaskFuture submitAsync(TaskSpec spec);

    /**
     * Submit several validations, bulk-executing compatible groups, and wait for all of them.
     *
     * @throws com.gpupool.exception.TaskRejectedException if the pool is not running
     */
    BatchResult submitBatch(List<TaskSpec> specs);

    /**
     * Cancel a queued task.
     *
     * @return true if the task was still queued; running, finished or unknown tasks are untouched
     */
    boolean cancel(String taskId);

    /**
     * Ask a tier's backend to pre-provision instances. The outcome sets the tier's availability.
     *
     * @return true if the backend acknowledged
     */
    boolean warmUp(Tier tier, int count);

    boolean hasCapacity(Tier tier);

    PoolUtilization utilization();

    MetricsSnapshot metrics();

    /**
     * Recent utilization samples, oldest first.
     */
    List<PoolUtilization> utilizationHistory();

    /**
     * Cancel every queued task.
     *
     * @return number of tasks cancelled
     */
    int clearQueues();

    PoolEventBus events();
}
