package com.backlogstore.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for record changes.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all events.
 * Delivery is synchronous on the publishing thread; a failing subscriber is
 * logged and skipped.
 */
public class TaskEventBus {

    private static final Logger log = LoggerFactory.getLogger(TaskEventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TaskEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TaskEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(TaskEvent event) {
        log.debug("Publishing {} for {}", event.type(), event.taskId());

        List<Consumer<TaskEvent>> taskSubs = taskSubscribers.get(event.taskId());
        if (taskSubs != null) {
            for (Consumer<TaskEvent> subscriber : taskSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<TaskEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one task id.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<TaskEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<TaskEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<TaskEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TaskEvent> subscriber, TaskEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} for {}: {}",
                    event.type(), event.taskId(), e.getMessage(), e);
        }
    }
}
