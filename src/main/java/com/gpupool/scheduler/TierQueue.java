package com.gpupool.scheduler;

import com.gpupool.core.Tier;
import com.gpupool.core.ValidationTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Priority queue of the tasks waiting for one tier.
 * <p>
 * Tasks are ordered by {@link QueueKey}: highest priority first, oldest first among equals.
 * Not thread-safe; owned by the scheduler thread.
 */
public class TierQueue {

    private static final Logger log = LoggerFactory.getLogger(TierQueue.class);

    private static final Comparator<ValidationTask> ORDER = Comparator.comparing(QueueKey::of);

    private final Tier tier;
    private final PriorityQueue<ValidationTask> queue = new PriorityQueue<>(ORDER);

    public TierQueue(Tier tier) {
        this.tier = tier;
    }

    public Tier getTier() {
        return tier;
    }

    public void enqueue(ValidationTask task) {
        if (task.getTier() != tier) {
            throw new IllegalArgumentException("Task " + task.getId() + " belongs to tier " + task.getTier()
                    + ", not " + tier);
        }
        queue.offer(task);
        log.trace("Task {} enqueued on {}, queue size: {}", task.getId(), tier, queue.size());
    }

    public Optional<ValidationTask> dequeueFront() {
        ValidationTask task = queue.poll();
        if (task != null) {
            log.trace("Task {} dequeued from {}, queue size: {}", task.getId(), tier, queue.size());
        }
        return Optional.ofNullable(task);
    }

    public Optional<ValidationTask> find(String taskId) {
        for (ValidationTask task : queue) {
            if (task.getId().equals(taskId)) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    public boolean remove(String taskId) {
        return queue.removeIf(task -> task.getId().equals(taskId));
    }

    /**
     * 1-based position the task would be served at, or 0 if it is not queued.
     */
    public int position(String taskId) {
        Optional<ValidationTask> target = find(taskId);
        if (target.isEmpty()) {
            return 0;
        }
        QueueKey key = QueueKey.of(target.get());
        int ahead = 0;
        for (ValidationTask task : queue) {
            if (QueueKey.of(task).compareTo(key) < 0) {
                ahead++;
            }
        }
        return ahead + 1;
    }

    /**
     * Remove and return every task created before the cutoff, in service order.
     */
    public List<ValidationTask> removeExpired(long createdBefore) {
        List<ValidationTask> expired = new ArrayList<>();
        Iterator<ValidationTask> it = queue.iterator();
        while (it.hasNext()) {
            ValidationTask task = it.next();
            if (task.getCreatedAt() < createdBefore) {
                expired.add(task);
                it.remove();
            }
        }
        expired.sort(ORDER);
        return expired;
    }

    /**
     * Remove and return every task, in service order.
     */
    public List<ValidationTask> drain() {
        List<ValidationTask> drained = new ArrayList<>(queue.size());
        ValidationTask task;
        while ((task = queue.poll()) != null) {
            drained.add(task);
        }
        return drained;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
