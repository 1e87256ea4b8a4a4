package com.hotlistdigest.core.bus;

import com.hotlistdigest.core.events.DuplicatesMerged;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusConcurrencyTest {
    @Test
    void concurrentPublishInvokesAllSubscribers() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("No handler should fail in this test", error);
        });

        int subscriberCount = 8;
        int publishCount = 1_000;
        LongAdder invocations = new LongAdder();

        for (int i = 0; i < subscriberCount; i++) {
            bus.subscribe(DuplicatesMerged.class, event -> invocations.increment());
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[publishCount];
            for (int i = 0; i < publishCount; i++) {
                futures[i] = executor.submit(() -> bus.publish(new DuplicatesMerged(Instant.now(), 2, 1, 1)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertEquals((long) subscriberCount * publishCount, invocations.sum());
    }

    @Test
    void concurrentSubscribeAndPublishStaysStable() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());

        AtomicInteger observedEvents = new AtomicInteger();
        bus.subscribe(DuplicatesMerged.class, event -> observedEvents.incrementAndGet());

        int publisherTasks = 4;
        int publishesPerTask = 1_000;
        int subscriberTasks = 4;
        int subscriptionsPerTask = 150;
        CountDownLatch start = new CountDownLatch(1);

        ExecutorService executor = Executors.newFixedThreadPool(publisherTasks + subscriberTasks);
        try {
            Future<?>[] tasks = new Future<?>[publisherTasks + subscriberTasks];
            int index = 0;
            for (int i = 0; i < publisherTasks; i++) {
                tasks[index++] = executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < publishesPerTask; j++) {
                        bus.publish(new DuplicatesMerged(Instant.now(), 1, 1, 0));
                    }
                    return null;
                });
            }
            for (int i = 0; i < subscriberTasks; i++) {
                tasks[index++] = executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < subscriptionsPerTask; j++) {
                        bus.subscribeAll(event -> observedEvents.incrementAndGet());
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> task : tasks) {
                task.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertEquals(0, handlerErrors.get());
        assertTrue(observedEvents.get() >= publisherTasks * publishesPerTask);
    }
}
