package com.gpupool.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory pub/sub bus for pool events.
 * <p>
 * Events are delivered synchronously on the publishing thread. A listener that throws is
 * logged and skipped; other listeners still receive the event.
 */
public class PoolEventBus {

    private static final Logger log = LoggerFactory.getLogger(PoolEventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(PoolEvent event) {
        log.trace("Publishing {} for task {}", event.type(), event.taskId());
        for (Registration registration : registrations) {
            if (registration.types.contains(event.type())) {
                deliverSafely(registration.listener, event);
            }
        }
    }

    /**
     * Subscribe to all events.
     */
    public Subscription subscribe(PoolEventListener listener) {
        return subscribe(listener, EnumSet.allOf(PoolEventType.class));
    }

    /**
     * Subscribe to events of the given types only.
     */
    public Subscription subscribe(PoolEventListener listener, Set<PoolEventType> types) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        Registration registration = new Registration(listener, EnumSet.copyOf(types));
        registrations.add(registration);
        log.debug("Listener subscribed to {}", types);
        return () -> registrations.remove(registration);
    }

    public int listenerCount() {
        return registrations.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private void deliverSafely(PoolEventListener listener, PoolEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            log.warn("Listener threw exception processing event {}: {}", event.type(), e.getMessage(), e);
        }
    }

    // Identity equality so the same listener can be registered twice
    private static final class Registration {
        private final PoolEventListener listener;
        private final Set<PoolEventType> types;

        private Registration(PoolEventListener listener, Set<PoolEventType> types) {
            this.listener = listener;
            this.types = types;
        }
    }
}
