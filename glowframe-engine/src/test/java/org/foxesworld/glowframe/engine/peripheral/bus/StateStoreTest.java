package org.foxesworld.glowframe.engine.peripheral.bus;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    @Test
    void keepsLatestPerProducer() {
        StateStore store = new StateStore();
        Input e1 = Input.of("accel", Map.of("x", 1), 1);
        Input e2 = Input.of("accel", Map.of("x", 2), 1);
        Input e3 = Input.of("accel", Map.of("x", 3), 2);

        store.update(e1);
        store.update(e2);
        store.update(e3);

        assertSame(e2, store.getLatest("accel", 1));
        assertSame(e3, store.getLatest("accel", 2));
        assertEquals(2, store.getAll("accel").size());
        assertEquals(2, store.size());
    }

    @Test
    void unknownTypeOrProducerIsAbsent() {
        StateStore store = new StateStore();
        store.update(Input.of("button", true, 1));

        assertNull(store.getLatest("button", 7));
        assertNull(store.getLatest("dial"));
        assertTrue(store.getAll("dial").isEmpty());
    }

    @Test
    void newestAcrossProducersIsByTimestamp() {
        StateStore store = new StateStore();
        Input later = new Input("hr", 80, 1, Instant.parse("2024-01-01T00:00:02Z"));
        Input earlier = new Input("hr", 70, 2, Instant.parse("2024-01-01T00:00:01Z"));

        store.update(later);
        store.update(earlier);

        assertSame(later, store.getLatest("hr"));
    }

    @Test
    void viewsAreReadOnlyCopies() {
        StateStore store = new StateStore();
        store.update(Input.of("button", true, 1));

        Map<Integer, Input> all = store.getAll("button");
        Map<String, Map<Integer, Input>> snapshot = store.snapshot();
        store.update(Input.of("button", false, 2));

        assertEquals(1, all.size());
        assertThrows(UnsupportedOperationException.class, () -> all.remove(1));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
        assertEquals(2, store.getAll("button").size());
    }

    @Test
    void clearDropsEverything() {
        StateStore store = new StateStore();
        store.update(Input.of("button", true, 1));

        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.snapshot().isEmpty());
    }

    @Test
    void lowerSequenceWrittenLastDoesNotReplaceNewer() {
        StateStore store = new StateStore();
        long outer = store.nextSequence();
        long inner = store.nextSequence();

        store.update(Input.of("t", "inner", 1), inner);
        store.update(Input.of("t", "outer", 1), outer);

        assertEquals("inner", store.getLatest("t", 1).data());
        assertEquals(1, store.size());
    }
}
