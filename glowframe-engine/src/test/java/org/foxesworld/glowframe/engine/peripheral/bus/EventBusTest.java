package org.foxesworld.glowframe.engine.peripheral.bus;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    @Test
    void higherPriorityRunsFirstThenSubscriptionOrder() {
        EventBus bus = new EventBus();
        List<String> order = new ArrayList<>();
        bus.subscribe("tick", e -> order.add("low"), -1);
        bus.subscribe("tick", e -> order.add("first"));
        bus.subscribe("tick", e -> order.add("high"), 10);
        bus.subscribe("tick", e -> order.add("second"));

        bus.emit("tick", null);

        assertEquals(List.of("high", "first", "second", "low"), order);
    }

    @Test
    void wildcardHandlersInterleaveByPriority() {
        EventBus bus = new EventBus();
        List<String> order = new ArrayList<>();
        bus.subscribe("tick", e -> order.add("specific"), 5);
        bus.subscribeAll(e -> order.add("any-high"), 10);
        bus.subscribeAll(e -> order.add("any-low"), 0);

        bus.emit("tick", null);
        bus.emit("other", null);

        assertEquals(List.of("any-high", "specific", "any-low", "any-high", "any-low"), order);
    }

    @Test
    void failingHandlerIsIsolated() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("press", e -> { throw new IllegalStateException("boom"); }, 10);
        bus.subscribe("press", e -> seen.add("after"));

        DispatchReport report = bus.emit("press", Map.of("id", 1), 3);

        assertEquals(List.of("after"), seen);
        assertEquals(1, report.delivered());
        assertFalse(report.ok());
        assertEquals("boom", report.failures().get(0).error().getMessage());
        assertNotNull(bus.states().getLatest("press", 3));
    }

    @Test
    void handlerErrorIsIsolatedLikeAnException() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("press", e -> { throw new AssertionError("boom"); }, 10);
        bus.subscribe("press", e -> seen.add("after"));

        DispatchReport report = bus.emit("press", null, 2);

        assertEquals(List.of("after"), seen);
        assertTrue(report.failures().get(0).error() instanceof AssertionError);
        assertNotNull(bus.states().getLatest("press", 2));
    }

    @Test
    void eventReemittedByHandlerStaysLatestForItsProducer() {
        EventBus bus = new EventBus();
        bus.subscribe("t", e -> {
            if ("a".equals(e.data())) bus.emit(Input.of("t", "b", 1));
        });

        bus.emit(Input.of("t", "a", 1));

        assertEquals("b", bus.states().getLatest("t", 1).data());
        assertEquals("b", bus.states().getLatest("t").data());
    }

    @Test
    void stateIsRecordedAfterHandlersRun() {
        EventBus bus = new EventBus();
        List<Input> seenByHandler = new ArrayList<>();
        bus.subscribe("dial", e -> seenByHandler.add(bus.states().getLatest("dial", 1)));

        Input first = Input.of("dial", 1, 1);
        bus.emit(first);
        bus.emit(Input.of("dial", 2, 1));

        assertNull(seenByHandler.get(0));
        assertSame(first, seenByHandler.get(1));
    }

    @Test
    void onceHandlerRunsOnce() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        bus.once("boot", e -> seen.add(e.data()));

        bus.emit("boot", 1);
        bus.emit("boot", 2);

        assertEquals(List.of(1), seen);
        assertEquals(0, bus.subscriberCount("boot"));
    }

    @Test
    void unsubscribeStopsDelivery() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        Subscription s = bus.subscribe("boot", e -> seen.add(e.data()));

        assertTrue(bus.unsubscribe(s));
        assertFalse(bus.unsubscribe(s));
        bus.emit("boot", 1);

        assertTrue(seen.isEmpty());
        assertFalse(s.isActive());
    }

    @Test
    void postedEventsWaitForPump() {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        bus.subscribe("press", e -> seen.add(e.data()));

        bus.post(Input.of("press", 1));
        bus.post(Input.of("press", 2));
        assertTrue(seen.isEmpty());
        assertEquals(2, bus.queuedEventsApprox());

        assertEquals(2, bus.pump());
        assertEquals(List.of(1, 2), seen);
    }

    @Test
    void pumpRespectsEventLimit() {
        EventBus bus = new EventBus();
        for (int i = 0; i < 5; i++) bus.post(Input.of("press", i));

        assertEquals(3, bus.pump(3, 0));
        assertEquals(2, bus.queuedEventsApprox());
    }

    @Test
    void pumpStopsWhenTimeBudgetIsSpent() {
        AtomicLong clock = new AtomicLong();
        EventBus bus = new EventBus(new StateStore(), clock::get, Runnable::run);
        bus.subscribe("press", e -> clock.addAndGet(1_000));
        for (int i = 0; i < 200; i++) bus.post(Input.of("press", i));

        int processed = bus.pump(1_000, 50_000);

        assertEquals(64, processed);
        assertEquals(136, bus.queuedEventsApprox());
    }

    @Test
    void publishDispatchesOnExecutor() throws Exception {
        EventBus bus = new EventBus();
        List<Object> seen = new ArrayList<>();
        bus.subscribe("press", e -> seen.add(e.data()));

        DispatchReport report = bus.publish(Input.of("press", 9)).get(5, TimeUnit.SECONDS);

        assertEquals(1, report.delivered());
        assertEquals(List.of(9), seen);
    }

    @Test
    void payloadsAreFrozen() {
        EventBus bus = new EventBus();
        List<Input> seen = new ArrayList<>();
        bus.subscribe("press", seen::add);
        Map<String, Object> data = new HashMap<>();
        data.put("id", 1);

        bus.emit("press", data);
        data.put("id", 2);

        @SuppressWarnings("unchecked")
        Map<String, Object> delivered = (Map<String, Object>) seen.get(0).data();
        assertEquals(1, delivered.get("id"));
        assertThrows(UnsupportedOperationException.class, () -> delivered.put("id", 3));
    }

    @Test
    void clearAllRemovesHandlersAndQueue() {
        EventBus bus = new EventBus();
        bus.subscribe("press", e -> {});
        bus.subscribeAll(e -> {}, 0);
        bus.post(Input.of("press", 1));

        bus.clearAll();

        assertEquals(0, bus.subscriberCount("press"));
        assertEquals(0, bus.queuedEventsApprox());
    }

    @Test
    void blankEventTypeIsRejected() {
        EventBus bus = new EventBus();
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe(" ", e -> {}));
        assertThrows(IllegalArgumentException.class, () -> bus.emit(" ", null));
    }
}
