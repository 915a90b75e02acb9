package com.gpupool.scheduler;

import com.gpupool.backend.TierBinding;
import com.gpupool.backend.TierRegistry;
import com.gpupool.config.SchedulerConfig;
import com.gpupool.core.Tier;
import com.gpupool.core.ValidationTask;
import com.gpupool.event.PoolEvent;
import com.gpupool.event.PoolEventBus;
import com.gpupool.event.PoolEventType;
import com.gpupool.exception.ExecutionFailureException;
import com.gpupool.exception.QueueTimeoutException;
import com.gpupool.exception.TaskRejectedException;
import com.gpupool.metrics.PoolMetrics;
import com.gpupool.metrics.PoolUtilization;
import com.gpupool.metrics.UtilizationHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission loop of the pool.
 * <p>
 * A single scheduler thread owns every tier queue and running set. Each tick it fails
 * queued tasks that waited past the queue timeout, then admits tasks in priority order
 * while their tier has a free slot. Enqueue, cancel, slot release and queue clearing are
 * posted to the same thread, so those structures are never shared.
 * <p>
 * The loop also samples utilization into the history and, when enabled, probes tier
 * handles on a separate health thread.
 */
public class AdmissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdmissionScheduler.class);

    static final String THREAD_NAME = "gpu-pool-scheduler";

    private final SchedulerConfig config;
    private final PoolEventBus events;
    private final PoolMetrics metrics;
    private final TaskDispatcher dispatcher;
    private final TierQueueSet queues;
    private final Map<Tier, TierState> states = new EnumMap<>(Tier.class);
    private final UtilizationHistory history;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledExecutorService loop;
    private volatile ScheduledExecutorService healthLoop;
    private volatile Thread loopThread;

    public AdmissionScheduler(TierRegistry registry, SchedulerConfig config, PoolEventBus events,
                              PoolMetrics metrics, TaskDispatcher dispatcher) {
        this.config = config;
        this.events = events;
        this.metrics = metrics;
        this.dispatcher = dispatcher;
        this.queues = new TierQueueSet(registry.tiers());
        for (Tier tier : registry.tiers()) {
            states.put(tier, new TierState(registry.get(tier)));
        }
        this.history = new UtilizationHistory(Math.max(1, config.utilizationHistorySize()));
    }

    // ==================== Lifecycle ====================

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        loop.scheduleWithFixedDelay(this::tick, config.tickIntervalMs(), config.tickIntervalMs(),
                TimeUnit.MILLISECONDS);
        if (config.utilizationSampleIntervalMs() > 0) {
            loop.scheduleAtFixedRate(this::sampleUtilization, 0, config.utilizationSampleIntervalMs(),
                    TimeUnit.MILLISECONDS);
        }
        if (config.healthCheckIntervalMs() > 0) {
            healthLoop = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, THREAD_NAME + "-health");
                t.setDaemon(true);
                return t;
            });
            healthLoop.scheduleWithFixedDelay(this::checkHealth, 0, config.healthCheckIntervalMs(),
                    TimeUnit.MILLISECONDS);
        }
        log.info("Admission loop started: tick={}ms, queueTimeout={}ms, tiers={}",
                config.tickIntervalMs(), config.queueTimeoutMs(), states.keySet());
    }

    /**
     * Stop the loop. Still-queued tasks are cancelled; running tasks finish on their workers.
     *
     * @return number of queued tasks cancelled
     */
    public int stop() {
        if (!running.compareAndSet(true, false)) {
            return 0;
        }
        // New posts are refused from here on; anything already posted runs before the drain
        int cancelled = call(this::cancelAllQueued);
        if (healthLoop != null) {
            healthLoop.shutdownNow();
        }
        loop.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Admission loop stopped, {} queued tasks cancelled", cancelled);
        return cancelled;
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Posted operations ====================

    /**
     * Queue a task for its tier. The QUEUED event carries the task's position.
     */
    public void enqueue(ValidationTask task) {
        TierState state = state(task.getTier());
        post(() -> {
            queues.enqueue(task.getTier(), task);
            state.updateQueued(queues.size(task.getTier()));
            int position = queues.position(task.getTier(), task.getId());
            events.publish(PoolEvent.of(PoolEventType.QUEUED, task, Map.of(PoolEvent.POSITION, position)));
            log.debug("Task {} queued on {} at position {}", task.getId(), task.getTier(), position);
        });
    }

    /**
     * Cancel a queued task.
     *
     * @return true if the task was queued and is now cancelled
     */
    public boolean cancel(String taskId) {
        if (!running.get()) {
            return false;
        }
        return call(() -> {
            for (Tier tier : queues.tiers()) {
                Optional<ValidationTask> task = queues.find(tier, taskId);
                if (task.isPresent()) {
                    queues.remove(tier, taskId);
                    states.get(tier).updateQueued(queues.size(tier));
                    cancelQueued(task.get());
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * Cancel every queued task in every tier.
     *
     * @return number of tasks cancelled
     */
    public int clearQueues() {
        if (!running.get()) {
            return 0;
        }
        return call(() -> {
            int cleared = cancelAllQueued();
            events.publish(PoolEvent.pool(PoolEventType.QUEUES_CLEARED, null,
                    Map.of(PoolEvent.COUNT, cleared)));
            log.info("Cleared {} queued tasks", cleared);
            return cleared;
        });
    }

    void release(ValidationTask task) {
        try {
            post(() -> {
                if (!state(task.getTier()).removeRunning(task.getId())) {
                    log.warn("Task {} released but was not running on {}", task.getId(), task.getTier());
                }
                admit(task.getTier(), System.currentTimeMillis());
            });
        } catch (TaskRejectedException e) {
            log.debug("Slot of task {} not released, admission loop stopped", task.getId());
        }
    }

    // ==================== Loop body ====================

    void tick() {
        long now = System.currentTimeMillis();
        for (Tier tier : queues.tiers()) {
            try {
                sweepExpired(tier, now);
                admit(tier, now);
            } catch (RuntimeException e) {
                log.error("Admission pass for tier {} failed", tier, e);
            }
        }
    }

    private void sweepExpired(Tier tier, long now) {
        List<ValidationTask> expired = queues.removeExpired(tier, now - config.queueTimeoutMs());
        if (!expired.isEmpty()) {
            states.get(tier).updateQueued(queues.size(tier));
            for (ValidationTask task : expired) {
                failQueueTimeout(task, now);
            }
        }
    }

    private void admit(Tier tier, long now) {
        TierState state = states.get(tier);
        while (state.hasFreeSlot()) {
            Optional<ValidationTask> next = queues.dequeueFront(tier);
            if (next.isEmpty()) {
                break;
            }
            ValidationTask task = next.get();
            state.updateQueued(queues.size(tier));
            if (task.getWaitTimeMs(now) > config.queueTimeoutMs()) {
                failQueueTimeout(task, now);
                continue;
            }
            state.addRunning(task.getId());
            task.markRunning(now);
            TierBinding binding = state.getBinding();
            events.publish(PoolEvent.of(PoolEventType.STARTED, task,
                    Map.of(PoolEvent.ESTIMATED_DURATION_MS, binding.estimatedDurationMs())));
            log.debug("Task {} admitted on {} ({}/{} running)",
                    task.getId(), tier, state.getActiveCount(), state.getMaxConcurrency());
            try {
                dispatcher.dispatch(task, binding, () -> release(task));
            } catch (RuntimeException e) {
                state.removeRunning(task.getId());
                failDispatch(task, e);
            }
        }
    }

    private void failQueueTimeout(ValidationTask task, long now) {
        long waited = task.getWaitTimeMs(now);
        task.markFailed(now, "Queue timeout after " + waited + "ms");
        metrics.recordQueueTimeout();
        task.getCompletion().completeExceptionally(new QueueTimeoutException(task.getId(), task.getTier(), waited));
        events.publish(PoolEvent.of(PoolEventType.TIMEOUT, task, Map.of(PoolEvent.WAITED_MS, waited)));
        log.warn("Task {} timed out after {}ms in {} queue", task.getId(), waited, task.getTier());
    }

    private void failDispatch(ValidationTask task, RuntimeException e) {
        String reason = "Dispatch failed: " + e.getMessage();
        task.markFailed(System.currentTimeMillis(), reason);
        metrics.recordFailed();
        task.getCompletion().completeExceptionally(new ExecutionFailureException(task.getId(), reason, e));
        events.publish(PoolEvent.of(PoolEventType.FAILED, task, Map.of(PoolEvent.ERROR, reason)));
        log.error("Task {} could not be dispatched", task.getId(), e);
    }

    private int cancelAllQueued() {
        int cancelled = 0;
        for (Tier tier : queues.tiers()) {
            List<ValidationTask> drained = queues.drain(tier);
            states.get(tier).updateQueued(0);
            for (ValidationTask task : drained) {
                cancelQueued(task);
                cancelled++;
            }
        }
        return cancelled;
    }

    private void cancelQueued(ValidationTask task) {
        task.markCancelled(System.currentTimeMillis());
        metrics.recordCancelled();
        task.getCompletion().cancel(false);
        events.publish(PoolEvent.of(PoolEventType.CANCELLED, task));
        log.debug("Task {} cancelled", task.getId());
    }

    // ==================== Utilization & health ====================

    /**
     * Current utilization. Safe to call from any thread.
     */
    public PoolUtilization utilization() {
        Map<Tier, PoolUtilization.TierUtilization> tiers = new EnumMap<>(Tier.class);
        for (TierState state : states.values()) {
            tiers.put(state.getTier(), new PoolUtilization.TierUtilization(state.getTier(),
                    state.getActiveCount(), state.getMaxConcurrency(), state.getQueuedCount(),
                    state.isAvailable()));
        }
        return new PoolUtilization(tiers, System.currentTimeMillis());
    }

    public List<PoolUtilization> utilizationHistory() {
        return history.snapshot();
    }

    void sampleUtilization() {
        try {
            history.record(utilization());
        } catch (RuntimeException e) {
            log.error("Utilization sampling failed", e);
        }
    }

    void checkHealth() {
        for (TierState state : states.values()) {
            boolean available;
            try {
                available = state.getBinding().handle().isAvailable();
            } catch (RuntimeException e) {
                log.warn("Health probe for tier {} threw: {}", state.getTier(), e.getMessage());
                available = false;
            }
            if (available != state.isAvailable()) {
                log.warn("Tier {} is now {}", state.getTier(), available ? "available" : "unavailable");
            }
            state.setAvailable(available);
        }
    }

    public boolean hasCapacity(Tier tier) {
        TierState state = state(tier);
        return state.getActiveCount() < state.getMaxConcurrency();
    }

    public boolean isAvailable(Tier tier) {
        return state(tier).isAvailable();
    }

    public void setAvailable(Tier tier, boolean available) {
        state(tier).setAvailable(available);
    }

    public TierState state(Tier tier) {
        TierState state = states.get(tier);
        if (state == null) {
            throw new IllegalArgumentException("Tier not registered: " + tier);
        }
        return state;
    }

    // ==================== Posting helpers ====================

    private void post(Runnable action) {
        ScheduledExecutorService current = loop;
        if (!running.get() || current == null) {
            throw new TaskRejectedException("Admission loop is not running");
        }
        Runnable guarded = () -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Posted scheduler action failed", e);
            }
        };
        try {
            current.execute(guarded);
        } catch (RejectedExecutionException e) {
            throw new TaskRejectedException("Admission loop is not running", e);
        }
    }

    private <T> T call(Callable<T> action) {
        if (Thread.currentThread() == loopThread) {
            try {
                return action.call();
            } catch (Exception e) {
                throw new IllegalStateException("Scheduler action failed", e);
            }
        }
        try {
            return loop.submit(action).get();
        } catch (RejectedExecutionException e) {
            throw new TaskRejectedException("Admission loop is not running", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for the admission loop", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scheduler action failed", e.getCause());
        }
    }
}
