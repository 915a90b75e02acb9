package com.gpupool.event;

/**
 * Receives pool events. Called on the publishing thread; implementations should not block.
 */
@FunctionalInterface
public interface PoolEventListener {

    void onEvent(PoolEvent event);
}
