package com.gpupool.core;

import com.gpupool.StubRemoteHandle;
import com.gpupool.backend.TierRegistry;
import com.gpupool.backend.ValidationOutcome;
import com.gpupool.config.CacheConfig;
import com.gpupool.config.PoolConfig;
import com.gpupool.config.SchedulerConfig;
import com.gpupool.event.PoolEvent;
import com.gpupool.event.PoolEventType;
import com.gpupool.exception.AwaitTimeoutException;
import com.gpupool.exception.ExecutionFailureException;
import com.gpupool.exception.PoolUnavailableException;
import com.gpupool.exception.QueueTimeoutException;
import com.gpupool.exception.TaskRejectedException;
import com.gpupool.metrics.MetricsSnapshot;
import com.gpupool.metrics.PoolUtilization;
import com.gpupool.request.PhysicsValidation;
import com.gpupool.request.ValidationRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultValidationPool.
 */
class DefaultValidationPoolTest {

    private StubRemoteHandle low;
    private StubRemoteHandle high;
    private DefaultValidationPool pool;

    @BeforeEach
    void setUp() {
        low = new StubRemoteHandle();
        high = new StubRemoteHandle();
    }

    @AfterEach
    void tearDown() {
        low.release();
        high.release();
        if (pool != null) {
            pool.stop();
        }
    }

    private static SchedulerConfig scheduler(long queueTimeoutMs) {
        return new SchedulerConfig(10, queueTimeoutMs, 5_000, 0, 10, 0, false);
    }

    private DefaultValidationPool createPool(SchedulerConfig scheduler, CacheConfig cache, int lowConcurrency) {
        TierRegistry registry = TierRegistry.builder()
                .register(Tier.LOW, low, lowConcurrency)
                .register(Tier.HIGH, high, 1)
                .build();
        PoolConfig config = PoolConfig.defaults().withScheduler(scheduler).withCache(cache);
        pool = new DefaultValidationPool(config, registry);
        pool.start();
        return pool;
    }

    private static ValidationRequest physics(int variant) {
        return new PhysicsValidation(Map.of("efficiency", 0.30 + variant * 0.001, "cost", 100.0));
    }

    private static TaskSpec spec(String hypothesisId, Priority priority, int variant) {
        return new TaskSpec(hypothesisId, Tier.LOW, priority, physics(variant));
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private List<String> recordQueuedTaskIds() {
        List<String> queued = new CopyOnWriteArrayList<>();
        pool.events().subscribe(event -> {
            if (event.type() == PoolEventType.QUEUED) {
                queued.add(event.taskId());
            }
        });
        return queued;
    }

    // ==================== Admission ====================

    @Test
    @DisplayName("Should admit queued tasks by priority with FIFO among equals")
    void shouldAdmitByPriorityThenFifo() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);

        // Occupy both slots so the next five tasks wait in the queue
        CompletableFuture<ValidationResult> blocker1 = pool.submitAsync(spec("blocker-1", Priority.NORMAL, 100));
        CompletableFuture<ValidationResult> blocker2 = pool.submitAsync(spec("blocker-2", Priority.NORMAL, 101));
        assertTrue(low.awaitStarted(2));

        List<String> startedOrder = new CopyOnWriteArrayList<>();
        CountDownLatch queued = new CountDownLatch(5);
        pool.events().subscribe(event -> {
            if (event.type() == PoolEventType.STARTED) {
                startedOrder.add(event.taskId());
            } else if (event.type() == PoolEventType.QUEUED) {
                queued.countDown();
            }
        });

        List<CompletableFuture<ValidationResult>> futures = new ArrayList<>();
        futures.add(pool.submitAsync(spec("low-1", Priority.LOW, 1)));
        futures.add(pool.submitAsync(spec("high", Priority.HIGH, 2)));
        futures.add(pool.submitAsync(spec("normal", Priority.NORMAL, 3)));
        futures.add(pool.submitAsync(spec("critical", Priority.CRITICAL, 4)));
        futures.add(pool.submitAsync(spec("low-2", Priority.LOW, 5)));
        assertTrue(queued.await(5, TimeUnit.SECONDS));

        low.release();
        blocker1.get(5, TimeUnit.SECONDS);
        blocker2.get(5, TimeUnit.SECONDS);

        Map<String, String> hypothesisByTask = new HashMap<>();
        for (CompletableFuture<ValidationResult> future : futures) {
            ValidationResult result = future.get(5, TimeUnit.SECONDS);
            hypothesisByTask.put(result.taskId(), result.hypothesisId());
        }

        List<String> admitted = startedOrder.stream().map(hypothesisByTask::get).toList();
        assertEquals(List.of("critical", "high", "normal", "low-1", "low-2"), admitted);
    }

    @Test
    @DisplayName("Should never run more tasks than the tier allows")
    void shouldRespectConcurrencyBound() throws Exception {
        low.withDelay(30);
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);

        List<CompletableFuture<ValidationResult>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(pool.submitAsync(spec("hyp-" + i, Priority.NORMAL, i)));
        }
        for (CompletableFuture<ValidationResult> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(10, low.getSingleCalls());
        assertTrue(low.getMaxConcurrent() <= 2, "max concurrent was " + low.getMaxConcurrent());
        assertEquals(10, pool.metrics().completed());
    }

    @Test
    @DisplayName("Should publish STARTED with the tier's estimated duration")
    void shouldPublishStartedWithEstimate() throws Exception {
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);
        List<PoolEvent> started = new CopyOnWriteArrayList<>();
        pool.events().subscribe(started::add, Set.of(PoolEventType.STARTED));

        ValidationResult result = pool.submit(spec("hyp-1", Priority.NORMAL, 1));

        assertEquals(1, started.size());
        assertEquals(result.taskId(), started.get(0).taskId());
        assertEquals(15_000L, started.get(0).payload().get(PoolEvent.ESTIMATED_DURATION_MS));
    }

    // ==================== Cache ====================

    @Test
    @DisplayName("Should answer an identical request from the cache without a second remote call")
    void shouldServeIdenticalRequestFromCache() {
        createPool(scheduler(10_000), CacheConfig.defaults(), 2);

        ValidationResult first = pool.submit(new TaskSpec("hyp-a", Tier.LOW, Priority.NORMAL, physics(1)));
        ValidationResult second = pool.submit(new TaskSpec("hyp-b", Tier.LOW, Priority.HIGH, physics(1)));

        assertFalse(first.fromCache());
        assertTrue(second.fromCache());
        assertEquals(1, low.getSingleCalls());
        assertEquals("hyp-b", second.hypothesisId());
        assertNotEquals(first.taskId(), second.taskId());
        assertEquals(first.confidenceScore(), second.confidenceScore());

        MetricsSnapshot metrics = pool.metrics();
        assertEquals(2, metrics.submitted());
        assertEquals(1, metrics.completed());
        assertEquals(1, metrics.cacheHits());
        assertEquals(1, metrics.cacheMisses());
        assertEquals(0.5, metrics.cacheHitRate(), 1e-9);
    }

    @Test
    @DisplayName("Should not share cached results across tiers")
    void shouldKeyCacheByTier() {
        createPool(scheduler(10_000), CacheConfig.defaults(), 2);

        pool.submit(new TaskSpec("hyp-a", Tier.LOW, Priority.NORMAL, physics(1)));
        ValidationResult onHigh = pool.submit(new TaskSpec("hyp-a", Tier.HIGH, Priority.NORMAL, physics(1)));

        assertFalse(onHigh.fromCache());
        assertEquals(1, low.getSingleCalls());
        assertEquals(1, high.getSingleCalls());
    }

    @Test
    @DisplayName("Should execute again once the cached result expired")
    void shouldExecuteAgainAfterCacheExpiry() throws Exception {
        createPool(scheduler(10_000), new CacheConfig(true, 100, 10), 2);

        pool.submit(spec("hyp-a", Priority.NORMAL, 1));
        Thread.sleep(250);
        ValidationResult again = pool.submit(spec("hyp-a", Priority.NORMAL, 1));

        assertFalse(again.fromCache());
        assertEquals(2, low.getSingleCalls());
    }

    // ==================== Timeouts ====================

    @Test
    @DisplayName("Should fail a task that waited past the queue timeout without executing it")
    void shouldTimeOutQueuedTask() throws Exception {
        low.blocking();
        createPool(scheduler(100), CacheConfig.disabled(), 1);

        CompletableFuture<ValidationResult> running = pool.submitAsync(spec("running", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        CompletableFuture<ValidationResult> waiting = pool.submitAsync(spec("waiting", Priority.CRITICAL, 2));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
        QueueTimeoutException timeout = assertInstanceOf(QueueTimeoutException.class, ex.getCause());
        assertEquals(Tier.LOW, timeout.getTier());

        low.release();
        running.get(5, TimeUnit.SECONDS);
        Thread.sleep(50);

        assertEquals(1, low.getSingleCalls());
        MetricsSnapshot metrics = pool.metrics();
        assertEquals(1, metrics.queueTimeouts());
        assertEquals(0, metrics.failed());
    }

    @Test
    @DisplayName("Should give up waiting after queue timeout plus execution margin")
    void shouldThrowAwaitTimeout() {
        low.blocking();
        createPool(new SchedulerConfig(10, 50, 50, 0, 10, 0, false), CacheConfig.disabled(), 1);

        assertThrows(AwaitTimeoutException.class, () -> pool.submit(spec("slow", Priority.NORMAL, 1)));
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("Should fail only the task whose backend call failed")
    void shouldIsolateFailures() throws Exception {
        low.withBehavior(call -> {
            if ("bad".equals(call.hypothesisId())) {
                throw new IllegalStateException("boom");
            }
            return StubRemoteHandle.VALID;
        });
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);

        CompletableFuture<ValidationResult> bad = pool.submitAsync(spec("bad", Priority.NORMAL, 1));
        CompletableFuture<ValidationResult> good = pool.submitAsync(spec("good", Priority.NORMAL, 2));

        assertEquals("good", good.get(5, TimeUnit.SECONDS).hypothesisId());
        ExecutionException ex = assertThrows(ExecutionException.class, () -> bad.get(5, TimeUnit.SECONDS));
        ExecutionFailureException failure = assertInstanceOf(ExecutionFailureException.class, ex.getCause());
        assertTrue(failure.getMessage().contains("boom"));

        assertEquals("after", pool.submit(spec("after", Priority.NORMAL, 3)).hypothesisId());
        MetricsSnapshot metrics = pool.metrics();
        assertEquals(1, metrics.failed());
        assertEquals(2, metrics.completed());
    }

    @Test
    @DisplayName("Should return the slot and fail the task when the backend throws an Error")
    void shouldReleaseSlotWhenBackendThrowsError() throws Exception {
        low.withBehavior(call -> {
            if ("bad".equals(call.hypothesisId())) {
                throw new AssertionError("decoder blew up");
            }
            return StubRemoteHandle.VALID;
        });
        createPool(scheduler(10_000), CacheConfig.disabled(), 1);

        CompletableFuture<ValidationResult> bad = pool.submitAsync(spec("bad", Priority.NORMAL, 1));
        ExecutionException ex = assertThrows(ExecutionException.class, () -> bad.get(5, TimeUnit.SECONDS));
        ExecutionFailureException failure = assertInstanceOf(ExecutionFailureException.class, ex.getCause());
        assertInstanceOf(AssertionError.class, failure.getCause());

        assertEquals("good", pool.submit(spec("good", Priority.NORMAL, 2)).hypothesisId());
        awaitCondition(() -> pool.hasCapacity(Tier.LOW));
        assertEquals(2, low.getSingleCalls());
        assertEquals(1, pool.metrics().failed());
        assertEquals(1, pool.metrics().completed());
    }

    @Test
    @DisplayName("Should reject a malformed backend outcome")
    void shouldRejectMalformedOutcome() {
        low.withBehavior(call -> new ValidationOutcome(true, true, 1.5, Map.of()));
        createPool(scheduler(10_000), CacheConfig.defaults(), 2);

        assertThrows(ExecutionFailureException.class, () -> pool.submit(spec("hyp", Priority.NORMAL, 1)));
        assertEquals(1, pool.metrics().failed());
    }

    // ==================== Cancellation ====================

    @Test
    @DisplayName("Should cancel only queued tasks")
    void shouldCancelQueuedTaskOnly() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 1);
        List<String> queuedIds = recordQueuedTaskIds();
        List<PoolEvent> cancelled = new CopyOnWriteArrayList<>();
        pool.events().subscribe(cancelled::add, Set.of(PoolEventType.CANCELLED));

        CompletableFuture<ValidationResult> running = pool.submitAsync(spec("running", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        CompletableFuture<ValidationResult> waiting = pool.submitAsync(spec("waiting", Priority.NORMAL, 2));
        awaitCondition(() -> queuedIds.size() == 2);

        String runningId = queuedIds.get(0);
        String waitingId = queuedIds.get(1);

        assertTrue(pool.cancel(waitingId));
        assertTrue(waiting.isCancelled());
        assertFalse(pool.cancel(waitingId));
        assertFalse(pool.cancel(runningId));
        assertFalse(pool.cancel("gpu-task-0-0"));

        low.release();
        assertEquals("running", running.get(5, TimeUnit.SECONDS).hypothesisId());
        assertEquals(1, low.getSingleCalls());
        assertEquals(1, pool.metrics().cancelled());
        assertEquals(1, cancelled.size());
        assertEquals(waitingId, cancelled.get(0).taskId());
    }

    @Test
    @DisplayName("Should withdraw a queued task when its future is cancelled")
    void shouldCancelQueuedTaskThroughFuture() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 1);

        TaskFuture running = pool.submitAsync(spec("running", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        TaskFuture waiting = pool.submitAsync(spec("waiting", Priority.NORMAL, 2));

        assertNotEquals(running.getTaskId(), waiting.getTaskId());
        assertTrue(waiting.cancel(true));
        assertTrue(waiting.isCancelled());
        assertFalse(waiting.cancel(true));
        assertFalse(running.cancel(true));
        assertFalse(running.isDone());

        low.release();
        assertEquals(running.getTaskId(), running.get(5, TimeUnit.SECONDS).taskId());
        Thread.sleep(50);

        assertEquals(1, low.getSingleCalls());
        MetricsSnapshot metrics = pool.metrics();
        assertEquals(1, metrics.cancelled());
        assertEquals(1, metrics.completed());
    }

    @Test
    @DisplayName("Should not let a caller completing its future affect joined submissions")
    void shouldIsolateCallerCompletionFromJoinedSubmissions() throws Exception {
        low.blocking();
        createPool(scheduler(10_000).withDedupeInFlight(true), CacheConfig.disabled(), 1);

        TaskFuture first = pool.submitAsync(spec("first", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        TaskFuture second = pool.submitAsync(spec("second", Priority.NORMAL, 1));

        assertTrue(first.completeExceptionally(new IllegalStateException("not a real result")));
        low.release();

        ValidationResult joined = second.get(5, TimeUnit.SECONDS);
        assertEquals("second", joined.hypothesisId());
        assertEquals(StubRemoteHandle.VALID.confidenceScore(), joined.confidenceScore());
        assertEquals(1, low.getSingleCalls());
        assertEquals(1, pool.metrics().completed());
    }

    @Test
    @DisplayName("Should cancel every queued task when queues are cleared")
    void shouldClearQueues() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 1);
        List<String> queuedIds = recordQueuedTaskIds();
        List<PoolEventType> poolEvents = new CopyOnWriteArrayList<>();
        pool.events().subscribe(event -> poolEvents.add(event.type()), Set.of(PoolEventType.QUEUES_CLEARED));

        CompletableFuture<ValidationResult> running = pool.submitAsync(spec("running", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        List<CompletableFuture<ValidationResult>> waiting = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            waiting.add(pool.submitAsync(spec("waiting-" + i, Priority.NORMAL, 10 + i)));
        }
        awaitCondition(() -> queuedIds.size() == 4);

        assertEquals(3, pool.clearQueues());
        waiting.forEach(future -> assertTrue(future.isCancelled()));
        assertEquals(List.of(PoolEventType.QUEUES_CLEARED), poolEvents);
        assertEquals(0, pool.utilization().tier(Tier.LOW).queued());

        low.release();
        running.get(5, TimeUnit.SECONDS);
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("Should cancel queued tasks on stop and reject later submissions")
    void shouldCancelQueuedTasksOnStop() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 1);
        List<String> queuedIds = recordQueuedTaskIds();
        List<PoolEventType> lifecycle = new CopyOnWriteArrayList<>();
        pool.events().subscribe(event -> lifecycle.add(event.type()), Set.of(PoolEventType.POOL_STOPPED));

        CompletableFuture<ValidationResult> running = pool.submitAsync(spec("running", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        CompletableFuture<ValidationResult> waiting = pool.submitAsync(spec("waiting", Priority.NORMAL, 2));
        awaitCondition(() -> queuedIds.size() == 2);

        pool.stop();

        assertFalse(pool.isRunning());
        assertTrue(waiting.isCancelled());
        assertEquals(List.of(PoolEventType.POOL_STOPPED), lifecycle);
        assertThrows(TaskRejectedException.class, () -> pool.submit(spec("late", Priority.NORMAL, 3)));
        assertThrows(TaskRejectedException.class, () -> pool.start());

        // The running task still finishes on its worker
        low.release();
        assertEquals("running", running.get(5, TimeUnit.SECONDS).hypothesisId());
    }

    @Test
    @DisplayName("Should reject submissions before start")
    void shouldRejectBeforeStart() {
        TierRegistry registry = TierRegistry.builder().register(Tier.LOW, low, 1).build();
        pool = new DefaultValidationPool(PoolConfig.defaults(), registry);

        assertFalse(pool.isRunning());
        assertThrows(TaskRejectedException.class, () -> pool.submitAsync(spec("early", Priority.NORMAL, 1)));
    }

    // ==================== Availability ====================

    @Test
    @DisplayName("Should fail fast on a tier whose warm-up failed")
    void shouldFailFastAfterFailedWarmUp() {
        low.withWarmUpResult(false);
        createPool(scheduler(10_000), CacheConfig.disabled(), 1);
        List<PoolEventType> warmUpEvents = new CopyOnWriteArrayList<>();
        pool.events().subscribe(event -> warmUpEvents.add(event.type()),
                Set.of(PoolEventType.WARMUP_STARTED, PoolEventType.WARMUP_COMPLETE, PoolEventType.WARMUP_FAILED));

        assertFalse(pool.warmUp(Tier.LOW, 2));
        assertThrows(PoolUnavailableException.class, () -> pool.submitAsync(spec("hyp", Priority.NORMAL, 1)));

        low.withWarmUpResult(true);
        assertTrue(pool.warmUp(Tier.LOW, 2));
        assertEquals("hyp", pool.submit(spec("hyp", Priority.NORMAL, 1)).hypothesisId());

        assertEquals(List.of(PoolEventType.WARMUP_STARTED, PoolEventType.WARMUP_FAILED,
                PoolEventType.WARMUP_STARTED, PoolEventType.WARMUP_COMPLETE), warmUpEvents);
    }

    @Test
    @DisplayName("Should mark a tier unavailable when its health probe fails")
    void shouldMarkTierDownFromHealthProbe() throws Exception {
        low.setAvailable(false);
        createPool(new SchedulerConfig(10, 2_000, 5_000, 0, 10, 20, false), CacheConfig.disabled(), 1);

        awaitCondition(() -> !pool.utilization().tier(Tier.LOW).available());
        assertThrows(PoolUnavailableException.class, () -> pool.submitAsync(spec("hyp", Priority.NORMAL, 1)));
        assertTrue(pool.utilization().tier(Tier.HIGH).available());
    }

    // ==================== In-flight dedupe ====================

    @Test
    @DisplayName("Should join identical in-flight submissions when dedupe is enabled")
    void shouldDedupeInFlight() throws Exception {
        low.blocking();
        createPool(scheduler(10_000).withDedupeInFlight(true), CacheConfig.disabled(), 2);

        CompletableFuture<ValidationResult> first = pool.submitAsync(spec("first", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        CompletableFuture<ValidationResult> second = pool.submitAsync(spec("second", Priority.NORMAL, 1));
        low.release();

        ValidationResult r1 = first.get(5, TimeUnit.SECONDS);
        ValidationResult r2 = second.get(5, TimeUnit.SECONDS);

        assertEquals(1, low.getSingleCalls());
        assertEquals("second", r2.hypothesisId());
        assertTrue(r2.fromCache());
        assertNotEquals(r1.taskId(), r2.taskId());

        MetricsSnapshot metrics = pool.metrics();
        assertEquals(2, metrics.submitted());
        assertEquals(1, metrics.completed());
        assertEquals(1, metrics.joinedInFlight());
        assertEquals(0, metrics.cacheHits());
        assertEquals(0, metrics.cacheMisses());
    }

    @Test
    @DisplayName("Should execute identical in-flight submissions twice by default")
    void shouldNotDedupeByDefault() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);

        CompletableFuture<ValidationResult> first = pool.submitAsync(spec("first", Priority.NORMAL, 1));
        CompletableFuture<ValidationResult> second = pool.submitAsync(spec("second", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(2));
        low.release();

        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        assertEquals(2, low.getSingleCalls());
    }

    // ==================== Utilization ====================

    @Test
    @DisplayName("Should report per-tier utilization and capacity")
    void shouldReportUtilization() throws Exception {
        low.blocking();
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);

        pool.submitAsync(spec("a", Priority.NORMAL, 1));
        assertTrue(low.awaitStarted(1));
        assertTrue(pool.hasCapacity(Tier.LOW));

        PoolUtilization utilization = pool.utilization();
        PoolUtilization.TierUtilization lowTier = utilization.tier(Tier.LOW);
        assertEquals(1, lowTier.active());
        assertEquals(2, lowTier.maxConcurrency());
        assertEquals(0.5, lowTier.ratio(), 1e-9);
        assertEquals(3, utilization.totalCapacity());

        pool.submitAsync(spec("b", Priority.NORMAL, 2));
        assertTrue(low.awaitStarted(1));
        assertFalse(pool.hasCapacity(Tier.LOW));
        assertTrue(pool.hasCapacity(Tier.HIGH));
    }

    @Test
    @DisplayName("Should keep a bounded utilization history")
    void shouldSampleUtilizationHistory() throws Exception {
        createPool(scheduler(10_000).withUtilizationSampling(20, 5), CacheConfig.disabled(), 2);

        Thread.sleep(250);

        List<PoolUtilization> history = pool.utilizationHistory();
        assertFalse(history.isEmpty());
        assertTrue(history.size() <= 5);
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i).timestamp() >= history.get(i - 1).timestamp());
        }
    }

    @Test
    @DisplayName("Should track cost and average duration of completed tasks")
    void shouldTrackCostAndDuration() {
        createPool(scheduler(10_000), CacheConfig.disabled(), 2);

        ValidationResult r1 = pool.submit(spec("a", Priority.NORMAL, 1));
        ValidationResult r2 = pool.submit(spec("b", Priority.NORMAL, 2));

        MetricsSnapshot metrics = pool.metrics();
        assertEquals(0.02, metrics.totalCost(), 1e-9);
        assertEquals(0.01, r1.cost(), 1e-9);
        assertEquals((r1.durationMs() + r2.durationMs()) / 2.0, metrics.averageDurationMs(), 1e-9);
        assertEquals(0.0, metrics.cacheHitRate(), 1e-9);
    }
}
