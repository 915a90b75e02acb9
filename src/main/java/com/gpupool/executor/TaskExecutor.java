package com.gpupool.executor;

import com.gpupool.backend.RemoteCall;
import com.gpupool.backend.TierBinding;
import com.gpupool.backend.ValidationOutcome;
import com.gpupool.cache.Fingerprint;
import com.gpupool.cache.ResultCache;
import com.gpupool.core.ValidationResult;
import com.gpupool.core.ValidationTask;
import com.gpupool.event.PoolEvent;
import com.gpupool.event.PoolEventBus;
import com.gpupool.event.PoolEventType;
import com.gpupool.exception.ExecutionFailureException;
import com.gpupool.metrics.PoolMetrics;
import com.gpupool.scheduler.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs admitted tasks against their tier's remote handle on a pool of worker threads.
 * <p>
 * Successful outcomes are validated, turned into results, cached and counted before the
 * task's future completes. Any error fails only that task; nothing is retried here.
 */
public class TaskExecutor implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final PoolEventBus events;
    private final PoolMetrics metrics;
    private final ResultCache cache;
    private final ExecutorService workers;
    private final AtomicInteger workerCounter = new AtomicInteger(0);

    /**
     * @param cache Result cache, or null when caching is disabled
     */
    public TaskExecutor(PoolEventBus events, PoolMetrics metrics, ResultCache cache) {
        this.events = events;
        this.metrics = metrics;
        this.cache = cache;
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("gpu-pool-worker-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void dispatch(ValidationTask task, TierBinding binding, Runnable release) {
        workers.execute(() -> run(task, binding, release));
    }

    private void run(ValidationTask task, TierBinding binding, Runnable release) {
        long start = System.currentTimeMillis();
        ValidationResult result = null;
        Throwable error = null;
        try {
            ValidationOutcome outcome = binding.handle().executeSingle(
                    new RemoteCall(task.getHypothesisId(), task.getRequest()));
            result = toResult(task, binding, outcome, System.currentTimeMillis() - start);
        } catch (Throwable t) {
            // Errors from a backend library fail the task too; the slot is always returned
            error = t;
        } finally {
            release.run();
        }
        if (error != null) {
            fail(task, error);
        } else {
            complete(task, result);
        }
    }

    /**
     * Validate a backend outcome and build the task's result.
     *
     * @throws ExecutionFailureException if the outcome is missing or malformed
     */
    public ValidationResult toResult(ValidationTask task, TierBinding binding, ValidationOutcome outcome,
                                     long durationMs) {
        if (outcome == null) {
            throw new ExecutionFailureException(task.getId(), "Backend returned no outcome");
        }
        Optional<String> defect = outcome.defect();
        if (defect.isPresent()) {
            throw new ExecutionFailureException(task.getId(), "Malformed backend outcome: " + defect.get());
        }
        return new ValidationResult(task.getId(), task.getHypothesisId(), task.getTier(),
                outcome.physicallyValid(), outcome.economicallyViable(), outcome.confidenceScore(),
                outcome.metrics(), durationMs, binding.costPerRun(), false);
    }

    /**
     * Record a fresh result: cache it, count it, mark the task completed and resolve its future.
     */
    public void complete(ValidationTask task, ValidationResult result) {
        if (cache != null) {
            cache.put(Fingerprint.of(task.getTier(), task.getRequest()), result);
        }
        metrics.recordCompleted(result.durationMs(), result.cost());
        task.markCompleted(System.currentTimeMillis());
        events.publish(PoolEvent.of(PoolEventType.COMPLETED, task, Map.of(PoolEvent.RESULT, result)));
        log.debug("Task {} completed on {} in {}ms", task.getId(), task.getTier(), result.durationMs());
        task.getCompletion().complete(result);
    }

    /**
     * Answer a task from a cached result without running it.
     */
    public ValidationResult completeFromCache(ValidationTask task, ValidationResult cached) {
        ValidationResult replay = cached.replayFor(task.getId(), task.getHypothesisId());
        long now = System.currentTimeMillis();
        task.markRunning(now);
        task.markCompleted(now);
        events.publish(PoolEvent.of(PoolEventType.CACHE_HIT, task, Map.of(PoolEvent.RESULT, replay)));
        log.debug("Task {} served from cache", task.getId());
        task.getCompletion().complete(replay);
        return replay;
    }

    /**
     * Fail a task with the given error, wrapped as an {@link ExecutionFailureException} if needed.
     */
    public void fail(ValidationTask task, Throwable error) {
        ExecutionFailureException failure = error instanceof ExecutionFailureException efe
                ? efe
                : new ExecutionFailureException(task.getId(), String.valueOf(error.getMessage()), error);
        task.markFailed(System.currentTimeMillis(), failure.getMessage());
        metrics.recordFailed();
        events.publish(PoolEvent.of(PoolEventType.FAILED, task,
                Map.of(PoolEvent.ERROR, String.valueOf(failure.getMessage()))));
        log.error("Task {} failed on {}: {}", task.getId(), task.getTier(), failure.getMessage());
        task.getCompletion().completeExceptionally(failure);
    }

    /**
     * Run work on the worker pool.
     */
    public void execute(Runnable work) {
        workers.execute(work);
    }

    /**
     * Stop accepting work. Tasks already running finish on their threads.
     */
    public void shutdown() {
        workers.shutdown();
        log.debug("Worker pool shut down");
    }
}
