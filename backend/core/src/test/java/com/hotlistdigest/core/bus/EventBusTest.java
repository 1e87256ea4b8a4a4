package com.hotlistdigest.core.bus;

import com.hotlistdigest.core.events.AlertRaised;
import com.hotlistdigest.core.events.DuplicatesMerged;
import com.hotlistdigest.core.events.Event;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(DuplicatesMerged.class, event -> hitsA.incrementAndGet());
        bus.subscribe(DuplicatesMerged.class, event -> hitsB.incrementAndGet());

        bus.publish(new DuplicatesMerged(NOW, 3, 2, 1));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventTypeAndCatchAllSeesEverything() {
        EventBus bus = new EventBus();
        AtomicInteger mergeHits = new AtomicInteger();
        AtomicInteger alertHits = new AtomicInteger();
        List<String> all = new CopyOnWriteArrayList<>();

        bus.subscribe(DuplicatesMerged.class, event -> mergeHits.incrementAndGet());
        bus.subscribe(AlertRaised.class, event -> alertHits.incrementAndGet());
        bus.subscribeAll(event -> all.add(event.type()));

        bus.publish(new DuplicatesMerged(NOW, 3, 2, 1));
        bus.publish(new AlertRaised(NOW, AlertRaised.CATEGORY_CACHE, "reset", Map.of()));

        assertEquals(1, mergeHits.get());
        assertEquals(1, alertHits.get());
        assertEquals(List.of("DuplicatesMerged", "AlertRaised"), all);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        AtomicReference<Event> failedEvent = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> {
            failedEvent.set(event);
            capturedError.set(error);
        });
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(DuplicatesMerged.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(DuplicatesMerged.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(new DuplicatesMerged(NOW, 1, 1, 0));

        assertEquals(2, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
        assertEquals("DuplicatesMerged", failedEvent.get().type());
    }
}
