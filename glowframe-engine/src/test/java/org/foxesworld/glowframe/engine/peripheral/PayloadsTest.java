package org.foxesworld.glowframe.engine.peripheral;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadsTest {

    @Test
    void freezeCopiesNestedCollections() {
        List<Object> inner = new ArrayList<>(List.of(1, 2));
        Map<String, Object> outer = new LinkedHashMap<>();
        outer.put("values", inner);
        outer.put("missing", null);

        @SuppressWarnings("unchecked")
        Map<String, Object> frozen = (Map<String, Object>) Payloads.freeze(outer);
        inner.add(3);

        assertEquals(List.of(1, 2), frozen.get("values"));
        assertTrue(frozen.containsKey("missing"));
        assertThrows(UnsupportedOperationException.class, () -> ((List<?>) frozen.get("values")).clear());
    }

    @Test
    void freezeKeepsScalars() {
        assertEquals("x", Payloads.freeze("x"));
        assertNull(Payloads.freeze(null));
    }

    @Test
    void truthiness() {
        assertFalse(Payloads.truthy(null));
        assertFalse(Payloads.truthy(0));
        assertFalse(Payloads.truthy(0.0));
        assertFalse(Payloads.truthy(""));
        assertFalse(Payloads.truthy(List.of()));
        assertFalse(Payloads.truthy(Map.of()));
        assertFalse(Payloads.truthy(false));
        assertTrue(Payloads.truthy(1));
        assertTrue(Payloads.truthy("on"));
        assertTrue(Payloads.truthy(Arrays.asList((Object) null)));
        assertTrue(Payloads.truthy(new Object()));
    }

    @Test
    void asMapFallsBackToEmpty() {
        assertTrue(Payloads.asMap("text").isEmpty());
        assertEquals(1, Payloads.asMap(Map.of("a", 1)).get("a"));
    }

    @Test
    void describeNamesTheEvent() {
        Input e = Input.of("button", Map.of("id", 4), 2);

        Map<String, Object> d = Payloads.describe(e);

        assertEquals("button", d.get("event_type"));
        assertEquals(2, d.get("producer_id"));
        assertEquals(Map.of("id", 4), d.get("data"));
        assertEquals(e.timestamp().toString(), d.get("timestamp"));
    }

    @Test
    void inputRejectsBlankType() {
        assertThrows(IllegalArgumentException.class, () -> Input.of("", null));
        assertThrows(NullPointerException.class, () -> Input.of(null, null));
    }
}
