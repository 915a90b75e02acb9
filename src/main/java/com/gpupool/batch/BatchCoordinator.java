package com.gpupool.batch;

import com.gpupool.backend.RemoteCall;
import com.gpupool.backend.TierBinding;
import com.gpupool.backend.TierRegistry;
import com.gpupool.backend.ValidationOutcome;
import com.gpupool.cache.Fingerprint;
import com.gpupool.cache.ResultCache;
import com.gpupool.core.TaskSpec;
import com.gpupool.core.Tier;
import com.gpupool.core.ValidationResult;
import com.gpupool.core.ValidationTask;
import com.gpupool.event.PoolEvent;
import com.gpupool.event.PoolEventBus;
import com.gpupool.event.PoolEventType;
import com.gpupool.exception.AwaitTimeoutException;
import com.gpupool.exception.BatchPartialFailureException;
import com.gpupool.exception.ExecutionFailureException;
import com.gpupool.exception.PoolUnavailableException;
import com.gpupool.executor.TaskExecutor;
import com.gpupool.metrics.PoolMetrics;
import com.gpupool.request.RequestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Splits a batch submission into bulk calls and ordinary submissions.
 * <p>
 * Specs are grouped by tier, then by request kind. A group of two or more specs whose kind
 * the tier handle can batch is sent as one {@code executeBatch} call, bypassing the tier
 * queue; cached entries are replayed and only the misses go out. Every other spec takes
 * the normal single-task path. Each entry is then accounted exactly like a single task.
 */
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final TierRegistry registry;
    private final ResultCache cache;
    private final PoolMetrics metrics;
    private final PoolEventBus events;
    private final TaskExecutor executor;
    private final Function<TaskSpec, ValidationTask> taskFactory;
    private final Function<TaskSpec, CompletableFuture<ValidationResult>> singleSubmitter;
    private final Predicate<Tier> availability;
    private final long callerTimeoutMs;

    /**
     * @param cache           Result cache, or null when caching is disabled
     * @param taskFactory     Creates a task with a fresh id for a spec
     * @param singleSubmitter Ordinary asynchronous submission of one spec
     * @param availability    Whether a tier currently accepts work
     * @param callerTimeoutMs How long {@link #submit} waits for all entries
     */
    public BatchCoordinator(TierRegistry registry, ResultCache cache, PoolMetrics metrics, PoolEventBus events,
                            TaskExecutor executor, Function<TaskSpec, ValidationTask> taskFactory,
                            Function<TaskSpec, CompletableFuture<ValidationResult>> singleSubmitter,
                            Predicate<Tier> availability, long callerTimeoutMs) {
        this.registry = registry;
        this.cache = cache;
        this.metrics = metrics;
        this.events = events;
        this.executor = executor;
        this.taskFactory = taskFactory;
        this.singleSubmitter = singleSubmitter;
        this.availability = availability;
        this.callerTimeoutMs = callerTimeoutMs;
    }

    /**
     * Submit every spec and wait for all of them, tolerating individual failures.
     */
    public BatchResult submit(List<TaskSpec> specs) {
        List<CompletableFuture<ValidationResult>> futures = dispatch(specs);
        return join(futures);
    }

    /**
     * Submit every spec without waiting. Futures are indexed like the input.
     */
    public List<CompletableFuture<ValidationResult>> dispatch(List<TaskSpec> specs) {
        List<CompletableFuture<ValidationResult>> futures = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            futures.add(null);
        }

        for (Map.Entry<Tier, Map<RequestKind, List<Integer>>> byTier : group(specs).entrySet()) {
            Tier tier = byTier.getKey();
            for (Map.Entry<RequestKind, List<Integer>> byKind : byTier.getValue().entrySet()) {
                List<Integer> indices = byKind.getValue();
                if (isBulkEligible(tier, byKind.getKey(), indices)) {
                    submitBulk(tier, byKind.getKey(), indices, specs, futures);
                } else {
                    for (int index : indices) {
                        futures.set(index, submitSingle(specs.get(index)));
                    }
                }
            }
        }
        return futures;
    }

    private Map<Tier, Map<RequestKind, List<Integer>>> group(List<TaskSpec> specs) {
        Map<Tier, Map<RequestKind, List<Integer>>> groups = new LinkedHashMap<>();
        for (int i = 0; i < specs.size(); i++) {
            TaskSpec spec = specs.get(i);
            groups.computeIfAbsent(spec.tier(), t -> new LinkedHashMap<>())
                    .computeIfAbsent(spec.request().kind(), k -> new ArrayList<>())
                    .add(i);
        }
        return groups;
    }

    private boolean isBulkEligible(Tier tier, RequestKind kind, List<Integer> indices) {
        return indices.size() >= 2
                && registry.contains(tier)
                && registry.get(tier).handle().supportsBatch(kind);
    }

    private CompletableFuture<ValidationResult> submitSingle(TaskSpec spec) {
        try {
            return singleSubmitter.apply(spec);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ==================== Bulk path ====================

    private void submitBulk(Tier tier, RequestKind kind, List<Integer> indices, List<TaskSpec> specs,
                            List<CompletableFuture<ValidationResult>> futures) {
        if (!availability.test(tier)) {
            for (int index : indices) {
                futures.set(index, CompletableFuture.failedFuture(new PoolUnavailableException(tier)));
            }
            return;
        }

        TierBinding binding = registry.get(tier);
        List<ValidationTask> misses = new ArrayList<>();
        List<Integer> missIndices = new ArrayList<>();
        for (int index : indices) {
            ValidationTask task = taskFactory.apply(specs.get(index));
            futures.set(index, task.getCompletion());
            metrics.recordSubmitted();

            Optional<ValidationResult> cached = lookup(task);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                executor.completeFromCache(task, cached.get());
                continue;
            }
            if (cache != null) {
                metrics.recordCacheMiss();
            }
            misses.add(task);
            missIndices.add(index);
        }

        if (misses.isEmpty()) {
            log.debug("Bulk group {}/{} fully served from cache ({} entries)", tier, kind, indices.size());
            return;
        }

        long now = System.currentTimeMillis();
        for (ValidationTask task : misses) {
            task.markRunning(now);
            events.publish(PoolEvent.of(PoolEventType.STARTED, task,
                    Map.of(PoolEvent.ESTIMATED_DURATION_MS, binding.estimatedDurationMs())));
        }
        log.debug("Bulk call on {} for {} {} requests ({} cached)",
                tier, misses.size(), kind, indices.size() - misses.size());
        executor.execute(() -> runBulk(binding, kind, misses, missIndices));
    }

    private Optional<ValidationResult> lookup(ValidationTask task) {
        if (cache == null) {
            return Optional.empty();
        }
        return cache.get(Fingerprint.of(task.getTier(), task.getRequest()));
    }

    private void runBulk(TierBinding binding, RequestKind kind, List<ValidationTask> tasks, List<Integer> indices) {
        List<RemoteCall> calls = new ArrayList<>(tasks.size());
        for (ValidationTask task : tasks) {
            calls.add(new RemoteCall(task.getHypothesisId(), task.getRequest()));
        }

        long start = System.currentTimeMillis();
        List<ValidationOutcome> outcomes;
        try {
            outcomes = binding.handle().executeBatch(kind, calls);
            if (outcomes == null) {
                throw new IllegalStateException("Backend returned no batch outcomes");
            }
        } catch (Throwable e) {
            log.error("Bulk call on {} for {} requests failed: {}", binding.tier(), tasks.size(), e.getMessage());
            for (ValidationTask task : tasks) {
                executor.fail(task, new ExecutionFailureException(task.getId(),
                        "Bulk call failed: " + e.getMessage(), e));
            }
            return;
        }

        long perTaskMs = (System.currentTimeMillis() - start) / tasks.size();
        for (int i = 0; i < tasks.size(); i++) {
            ValidationTask task = tasks.get(i);
            ValidationOutcome outcome = i < outcomes.size() ? outcomes.get(i) : null;
            ValidationResult result;
            try {
                result = executor.toResult(task, binding, outcome, perTaskMs);
            } catch (ExecutionFailureException e) {
                int index = indices.get(i);
                executor.fail(task, new ExecutionFailureException(task.getId(), e.getMessage(),
                        new BatchPartialFailureException(index, e.getMessage())));
                continue;
            }
            executor.complete(task, result);
        }
    }

    // ==================== Join ====================

    private BatchResult join(List<CompletableFuture<ValidationResult>> futures) {
        long deadline = System.currentTimeMillis() + callerTimeoutMs;
        List<ValidationResult> results = new ArrayList<>(futures.size());
        Map<Integer, Throwable> failures = new HashMap<>();

        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<ValidationResult> future = futures.get(i);
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            try {
                results.add(future.get(remaining, TimeUnit.MILLISECONDS));
                continue;
            } catch (ExecutionException e) {
                failures.put(i, e.getCause());
            } catch (CancellationException e) {
                failures.put(i, e);
            } catch (TimeoutException e) {
                failures.put(i, new AwaitTimeoutException("batch[" + i + "]", callerTimeoutMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.put(i, e);
            }
            results.add(null);
        }

        if (!failures.isEmpty()) {
            log.warn("Batch of {} finished with {} failures at indices {}",
                    futures.size(), failures.size(), failures.keySet());
        }
        return new BatchResult(results, failures);
    }
}
