package com.gpupool.core;

import com.gpupool.request.ValidationRequest;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of validation work tracked by the pool.
 * <p>
 * Queue membership and the QUEUED/RUNNING transitions are driven by the scheduler thread;
 * terminal transitions may come from executor threads, so status changes are synchronized.
 * Once terminal, the task no longer changes.
 */
public final class ValidationTask {

    private final String id;
    private final String hypothesisId;
    private final Tier tier;
    private final Priority priority;
    private final ValidationRequest request;
    private final long createdAt;
    private final long sequence;
    private final CompletableFuture<ValidationResult> completion = new CompletableFuture<>();

    private TaskStatus status = TaskStatus.QUEUED;
    private long startedAt;
    private long completedAt;
    private String failureReason;

    public ValidationTask(String id, TaskSpec spec, long createdAt, long sequence) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(spec, "spec cannot be null");
        this.hypothesisId = spec.hypothesisId();
        this.tier = spec.tier();
        this.priority = spec.priority();
        this.request = spec.request();
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    public String getId() {
        return id;
    }

    public String getHypothesisId() {
        return hypothesisId;
    }

    public Tier getTier() {
        return tier;
    }

    public Priority getPriority() {
        return priority;
    }

    public ValidationRequest getRequest() {
        return request;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * Monotonic submission order, used as the FIFO tie-break among equal priorities.
     */
    public long getSequence() {
        return sequence;
    }

    public CompletableFuture<ValidationResult> getCompletion() {
        return completion;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized long getStartedAt() {
        return startedAt;
    }

    public synchronized long getCompletedAt() {
        return completedAt;
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    /**
     * Time spent waiting since submission.
     */
    public long getWaitTimeMs(long now) {
        return now - createdAt;
    }

    public synchronized void markRunning(long now) {
        transition(TaskStatus.RUNNING);
        this.startedAt = now;
    }

    public synchronized void markCompleted(long now) {
        transition(TaskStatus.COMPLETED);
        this.completedAt = now;
    }

    public synchronized void markFailed(long now, String reason) {
        transition(TaskStatus.FAILED);
        this.completedAt = now;
        this.failureReason = reason;
    }

    public synchronized void markCancelled(long now) {
        transition(TaskStatus.CANCELLED);
        this.completedAt = now;
    }

    private void transition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    @Override
    public String toString() {
        return "ValidationTask{" +
                "id='" + id + '\'' +
                ", tier=" + tier +
                ", priority=" + priority +
                ", kind=" + request.kind() +
                ", status=" + getStatus() +
                '}';
    }
}
