package com.gpupool.scheduler;

import com.gpupool.core.Priority;
import com.gpupool.core.ValidationTask;

import java.util.Objects;

/**
 * Ordering key of a queued task.
 * <p>
 * Comparison order:
 * 1. Priority rank (lower = served first)
 * 2. Enqueue sequence (FIFO fallback: earlier task wins)
 */
public final class QueueKey implements Comparable<QueueKey> {

    private final Priority priority;
    private final long sequence;

    public QueueKey(Priority priority, long sequence) {
        this.priority = Objects.requireNonNull(priority, "priority cannot be null");
        this.sequence = sequence;
    }

    public static QueueKey of(ValidationTask task) {
        return new QueueKey(task.getPriority(), task.getSequence());
    }

    public Priority getPriority() {
        return priority;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public int compareTo(QueueKey other) {
        int rankCmp = Integer.compare(this.priority.rank(), other.priority.rank());
        if (rankCmp != 0) {
            return rankCmp;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueKey that = (QueueKey) o;
        return sequence == that.sequence && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, sequence);
    }

    @Override
    public String toString() {
        return "QueueKey{" +
                "priority=" + priority +
                ", sequence=" + sequence +
                '}';
    }
}
