package com.gpupool.scheduler;

import com.gpupool.backend.TierBinding;
import com.gpupool.core.ValidationTask;

/**
 * Hands an admitted task to whatever runs it.
 * Must not block; the scheduler thread calls it.
 */
@FunctionalInterface
public interface TaskDispatcher {

    /**
     * @param task    Task already marked RUNNING and holding a slot
     * @param binding Binding of the task's tier
     * @param release Must be run exactly once when the task settles, to free the slot
     */
    void dispatch(ValidationTask task, TierBinding binding, Runnable release);
}
