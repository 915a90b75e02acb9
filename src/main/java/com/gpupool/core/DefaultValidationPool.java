package com.gpupool.core;

import com.gpupool.backend.BackendFactory;
import com.gpupool.backend.RemoteExecutionHandle;
import com.gpupool.backend.TierRegistry;
import com.gpupool.batch.BatchCoordinator;
import com.gpupool.batch.BatchResult;
import com.gpupool.cache.Fingerprint;
import com.gpupool.cache.ResultCache;
import com.gpupool.config.PoolConfig;
import com.gpupool.event.PoolEvent;
import com.gpupool.event.PoolEventBus;
import com.gpupool.event.PoolEventType;
import com.gpupool.exception.AwaitTimeoutException;
import com.gpupool.exception.PoolException;
import com.gpupool.exception.PoolUnavailableException;
import com.gpupool.exception.TaskRejectedException;
import com.gpupool.executor.TaskExecutor;
import com.gpupool.metrics.MetricsSnapshot;
import com.gpupool.metrics.PoolMetrics;
import com.gpupool.metrics.PoolUtilization;
import com.gpupool.scheduler.AdmissionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ValidationPool.
 * <p>
 * Submissions are checked against the result cache first; misses become tasks queued on
 * the {@link AdmissionScheduler}, which admits them under each tier's concurrency bound and
 * hands them to the {@link TaskExecutor}. Each task resolves through its own future.
 */
public class DefaultValidationPool implements ValidationPool {

    private static final Logger log = LoggerFactory.getLogger(DefaultValidationPool.class);

    private final PoolConfig config;
    private final TierRegistry registry;
    private final PoolEventBus events = new PoolEventBus();
    private final PoolMetrics metrics = new PoolMetrics();
    private final ResultCache cache;
    private final TaskExecutor executor;
    private final AdmissionScheduler scheduler;
    private final BatchCoordinator batchCoordinator;
    private final Map<Fingerprint, CompletableFuture<ValidationResult>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong taskCounter = new AtomicLong(0);
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * Create a pool whose tiers all use the backend described by the configuration.
     */
    public DefaultValidationPool(PoolConfig config) {
        this(config, registryFor(config));
    }

    public DefaultValidationPool(PoolConfig config, TierRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.cache = config.cache().enabled()
                ? new ResultCache(config.cache().ttlMs(), config.cache().maxSize())
                : null;
        this.executor = new TaskExecutor(events, metrics, cache);
        this.scheduler = new AdmissionScheduler(registry, config.scheduler(), events, metrics, executor);
        this.batchCoordinator = new BatchCoordinator(registry, cache, metrics, events, executor,
                this::newTask, this::submitAsync, scheduler::isAvailable, config.scheduler().callerTimeoutMs());

        log.info("ValidationPool initialized: {} (tiers={}, cache={}, dedupeInFlight={})",
                config.name(), registry.tiers(),
                cache != null ? "ttl=" + cache.getTtlMs() + "ms,max=" + cache.getMaxSize() : "off",
                config.scheduler().dedupeInFlight());
    }

    private static TierRegistry registryFor(PoolConfig config) {
        RemoteExecutionHandle handle = BackendFactory.create(config.backend());
        return TierRegistry.fromConfig(config, tierConfig -> handle);
    }

    // ==================== Lifecycle ====================

    @Override
    public void start() {
        if (stopped.get()) {
            throw new TaskRejectedException("Pool " + config.name() + " has been stopped");
        }
        if (scheduler.isRunning()) {
            return;
        }
        scheduler.start();
        events.publish(PoolEvent.pool(PoolEventType.POOL_STARTED, null, Map.of()));
        log.info("ValidationPool {} started", config.name());
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        int cancelled = scheduler.stop();
        executor.shutdown();
        events.publish(PoolEvent.pool(PoolEventType.POOL_STOPPED, null, Map.of(PoolEvent.COUNT, cancelled)));
        log.info("ValidationPool {} stopped, {} queued tasks cancelled", config.name(), cancelled);
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning() && !stopped.get();
    }

    // ==================== Submission ====================

    @Override
    public ValidationResult submit(TaskSpec spec) {
        ValidationTask task = newTask(spec);
        CompletableFuture<ValidationResult> future = submitTask(task);
        long timeoutMs = config.scheduler().callerTimeoutMs();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Caller gave up on task {} after {}ms", task.getId(), timeoutMs);
            throw new AwaitTimeoutException(task.getId(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new PoolException("Task " + task.getId() + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolException("Interrupted waiting for task " + task.getId(), e);
        }
    }

    @Override
    public TaskFuture submitAsync(TaskSpec spec) {
        ValidationTask task = newTask(spec);
        return TaskFuture.following(task.getId(), submitTask(task), scheduler::cancel);
    }

    private CompletableFuture<ValidationResult> submitTask(ValidationTask task) {
        ensureRunning();
        Tier tier = task.getTier();
        if (!registry.contains(tier)) {
            throw new IllegalArgumentException("Tier not registered: " + tier);
        }
        if (!scheduler.isAvailable(tier)) {
            log.warn("Rejecting task {}: tier {} is unavailable", task.getId(), tier);
            throw new PoolUnavailableException(tier);
        }

        metrics.recordSubmitted();
        Fingerprint fingerprint = Fingerprint.of(tier, task.getRequest());

        if (cache != null) {
            Optional<ValidationResult> cached = cache.get(fingerprint);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                executor.completeFromCache(task, cached.get());
                return task.getCompletion();
            }
        }

        if (config.scheduler().dedupeInFlight()) {
            CompletableFuture<ValidationResult> existing = inFlight.putIfAbsent(fingerprint, task.getCompletion());
            if (existing != null) {
                metrics.recordJoinedInFlight();
                log.debug("Task {} joined an identical request already in flight", task.getId());
                return existing.thenApply(result -> result.replayFor(task.getId(), task.getHypothesisId()));
            }
            task.getCompletion().whenComplete((result, error) -> inFlight.remove(fingerprint, task.getCompletion()));
        }
        if (cache != null) {
            metrics.recordCacheMiss();
        }

        scheduler.enqueue(task);
        return task.getCompletion();
    }

    @Override
    public BatchResult submitBatch(List<TaskSpec> specs) {
        ensureRunning();
        log.debug("Batch submission of {} specs", specs.size());
        return batchCoordinator.submit(specs);
    }

    @Override
    public boolean cancel(String taskId) {
        return scheduler.cancel(taskId);
    }

    // ==================== Tiers ====================

    @Override
    public boolean warmUp(Tier tier, int count) {
        ensureRunning();
        RemoteExecutionHandle handle = registry.get(tier).handle();
        events.publish(PoolEvent.pool(PoolEventType.WARMUP_STARTED, tier, Map.of(PoolEvent.COUNT, count)));
        boolean acknowledged;
        String error = "backend declined warm-up";
        try {
            acknowledged = handle.warmUp(count);
        } catch (RuntimeException e) {
            acknowledged = false;
            error = String.valueOf(e.getMessage());
        }
        scheduler.setAvailable(tier, acknowledged);
        if (acknowledged) {
            events.publish(PoolEvent.pool(PoolEventType.WARMUP_COMPLETE, tier, Map.of(PoolEvent.COUNT, count)));
            log.info("Warmed up {} instances on {}", count, tier);
        } else {
            events.publish(PoolEvent.pool(PoolEventType.WARMUP_FAILED, tier, Map.of(PoolEvent.ERROR, error)));
            log.warn("Warm-up on {} failed, tier marked unavailable: {}", tier, error);
        }
        return acknowledged;
    }

    @Override
    public boolean hasCapacity(Tier tier) {
        return scheduler.hasCapacity(tier);
    }

    // ==================== Observability ====================

    @Override
    public PoolUtilization utilization() {
        return scheduler.utilization();
    }

    @Override
    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    @Override
    public List<PoolUtilization> utilizationHistory() {
        return scheduler.utilizationHistory();
    }

    @Override
    public int clearQueues() {
        return scheduler.clearQueues();
    }

    @Override
    public PoolEventBus events() {
        return events;
    }

    public PoolConfig getConfig() {
        return config;
    }

    private ValidationTask newTask(TaskSpec spec) {
        long now = System.currentTimeMillis();
        String id = "gpu-task-" + now + "-" + taskCounter.incrementAndGet();
        return new ValidationTask(id, spec, now, sequence.incrementAndGet());
    }

    private void ensureRunning() {
        if (!isRunning()) {
            throw new TaskRejectedException("Pool " + config.name() + " is not running");
        }
    }
}
