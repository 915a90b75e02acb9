package com.gpupool.scheduler;

import com.gpupool.core.Tier;
import com.gpupool.core.ValidationTask;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One {@link TierQueue} per tier. Not thread-safe; owned by the scheduler thread.
 */
public class TierQueueSet {

    private final Map<Tier, TierQueue> queues = new EnumMap<>(Tier.class);

    public TierQueueSet(Collection<Tier> tiers) {
        for (Tier tier : tiers) {
            queues.put(tier, new TierQueue(tier));
        }
    }

    public void enqueue(Tier tier, ValidationTask task) {
        queue(tier).enqueue(task);
    }

    public Optional<ValidationTask> dequeueFront(Tier tier) {
        return queue(tier).dequeueFront();
    }

    public Optional<ValidationTask> find(Tier tier, String taskId) {
        return queue(tier).find(taskId);
    }

    public boolean remove(Tier tier, String taskId) {
        return queue(tier).remove(taskId);
    }

    public int size(Tier tier) {
        return queue(tier).size();
    }

    public int position(Tier tier, String taskId) {
        return queue(tier).position(taskId);
    }

    public List<ValidationTask> drain(Tier tier) {
        return queue(tier).drain();
    }

    public List<ValidationTask> removeExpired(Tier tier, long createdBefore) {
        return queue(tier).removeExpired(createdBefore);
    }

    public Set<Tier> tiers() {
        return queues.keySet();
    }

    private TierQueue queue(Tier tier) {
        TierQueue queue = queues.get(tier);
        if (queue == null) {
            throw new IllegalArgumentException("No queue for tier " + tier);
        }
        return queue;
    }
}
