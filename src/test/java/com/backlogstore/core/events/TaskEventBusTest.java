package com.backlogstore.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TaskEventBus}.
 */
class TaskEventBusTest {

    private TaskEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new TaskEventBus();
    }

    private static TaskEvent updated(String taskId) {
        return TaskEvent.of(TaskEvent.Type.UPDATED, taskId, Path.of("backlog/tasks/" + taskId + ".md"));
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublish {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversToTaskSubscriber() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribe("TASK-1", received::add);

            TaskEvent event = updated("TASK-1");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events of other tasks")
        void ignoresOtherTasks() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribe("TASK-2", received::add);

            eventBus.publish(updated("TASK-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber sees every task, in publish order")
        void globalSeesEverything() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(TaskEvent.of(TaskEvent.Type.CREATED, "TASK-1", Path.of("a.md")));
            eventBus.publish(TaskEvent.of(TaskEvent.Type.DELETED, "TASK-2", null));

            assertEquals(2, received.size());
            assertEquals(TaskEvent.Type.CREATED, received.get(0).type());
            assertEquals("TASK-2", received.get(1).taskId());
            assertNull(received.get(1).path());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class Unsubscribe {

        @Test
        @DisplayName("stops delivery to that subscriber only")
        void stopsDelivery() {
            List<TaskEvent> first = new ArrayList<>();
            List<TaskEvent> second = new ArrayList<>();
            TaskEventBus.Subscription subscription = eventBus.subscribe("TASK-1", first::add);
            eventBus.subscribe("TASK-1", second::add);

            subscription.unsubscribe();
            eventBus.publish(updated("TASK-1"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("global subscription can be cancelled")
        void globalCancel() {
            List<TaskEvent> received = new ArrayList<>();
            TaskEventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            eventBus.publish(updated("TASK-1"));
            subscription.unsubscribe();
            eventBus.publish(updated("TASK-1"));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCases {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriber() {
            List<TaskEvent> received = new ArrayList<>();
            eventBus.subscribe("TASK-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(updated("TASK-1")));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<TaskEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            int threads = 8;
            int perThread = 50;
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                final int n = t;
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(updated("TASK-" + n));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
