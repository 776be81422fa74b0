package com.reflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for task execution events.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations, so tasks running in
 * parallel may publish at the same time.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-task subscribers keyed by taskId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RecoveryEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all tasks. */
    private final CopyOnWriteArrayList<Consumer<RecoveryEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Deliver an event to the subscribers of its task, then to every global subscriber.
     * Delivery runs on the publishing thread; a subscriber that throws is logged and skipped.
     *
     * @param event the event to deliver
     */
    public void publish(RecoveryEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        List<Consumer<RecoveryEvent>> subs = taskSubscribers.get(event.taskId());
        if (subs != null) {
            for (Consumer<RecoveryEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<RecoveryEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one task.
     *
     * @param taskId   the task whose events are wanted
     * @param consumer callback invoked for each event of that task
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<RecoveryEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<RecoveryEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events of every task, as the {@code --watch} console does.
     *
     * @param consumer callback invoked for each event regardless of task
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<RecoveryEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RecoveryEvent> subscriber, RecoveryEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
