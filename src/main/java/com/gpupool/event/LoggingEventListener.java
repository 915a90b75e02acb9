package com.gpupool.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every pool event to the log.
 */
public class LoggingEventListener implements PoolEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(PoolEvent event) {
        switch (event.type()) {
            case QUEUED -> log.debug("Task {} queued on {} at position {}",
                    event.taskId(), event.tier(), event.payload().get(PoolEvent.POSITION));
            case STARTED -> log.debug("Task {} started on {}, estimated {} ms",
                    event.taskId(), event.tier(), event.payload().get(PoolEvent.ESTIMATED_DURATION_MS));
            case COMPLETED -> log.debug("Task {} completed on {}", event.taskId(), event.tier());
            case CACHE_HIT -> log.debug("Task {} served from cache", event.taskId());
            case FAILED -> log.warn("Task {} failed on {}: {}",
                    event.taskId(), event.tier(), event.payload().get(PoolEvent.ERROR));
            case TIMEOUT -> log.warn("Task {} timed out in {} queue after {} ms",
                    event.taskId(), event.tier(), event.payload().get(PoolEvent.WAITED_MS));
            case CANCELLED -> log.info("Task {} cancelled", event.taskId());
            case WARMUP_FAILED -> log.warn("Warm-up of {} failed: {}",
                    event.tier(), event.payload().get(PoolEvent.ERROR));
            default -> log.info("Pool event {}{}", event.type(),
                    event.tier() != null ? " on " + event.tier() : "");
        }
    }
}
