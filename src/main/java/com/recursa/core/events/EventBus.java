package com.recursa.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for task and frame lifecycle events.
 * <p>
 * A listener can be narrowed to one task and to an event family such as
 * {@code "consolidation."} or {@code "frame."}; listeners are called in the order
 * they subscribed. A listener that throws never affects the publisher or the
 * other listeners.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(RecursaEvent event) {
        log.debug("Event {} for task {} from {}", event.eventType(), event.taskId(), event.agentId());
        for (Listener listener : listeners) {
            if (listener.matches(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Events of one task.
     */
    public Subscription subscribe(String taskId, Consumer<RecursaEvent> consumer) {
        return add(new Listener(taskId, null, consumer));
    }

    /**
     * Events of one task whose type starts with {@code typePrefix}; a null task id matches every task.
     */
    public Subscription subscribe(String taskId, String typePrefix, Consumer<RecursaEvent> consumer) {
        return add(new Listener(taskId, typePrefix, consumer));
    }

    public Subscription subscribeAll(Consumer<RecursaEvent> consumer) {
        return add(new Listener(null, null, consumer));
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription add(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void deliver(Listener listener, RecursaEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (Exception e) {
            log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
        }
    }

    /**
     * Identity-compared so that unsubscribing removes exactly this registration.
     */
    private static final class Listener {
        private final String taskId;
        private final String typePrefix;
        private final Consumer<RecursaEvent> consumer;

        Listener(String taskId, String typePrefix, Consumer<RecursaEvent> consumer) {
            this.taskId = taskId;
            this.typePrefix = typePrefix == null || typePrefix.isBlank() ? null : typePrefix;
            this.consumer = consumer;
        }

        boolean matches(RecursaEvent event) {
            return (taskId == null || taskId.equals(event.taskId()))
                    && (typePrefix == null || event.eventType().startsWith(typePrefix));
        }

        Consumer<RecursaEvent> consumer() {
            return consumer;
        }
    }
}
