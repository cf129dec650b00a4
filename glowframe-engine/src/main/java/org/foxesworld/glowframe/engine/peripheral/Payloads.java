package org.foxesworld.glowframe.engine.peripheral;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for event payloads.
 *
 * <p>Payloads are frozen on the way into an {@link Input}: maps, lists and sets are copied
 * recursively into unmodifiable views (insertion order kept, null values allowed). Other values
 * are kept as they are and are expected to be immutable.</p>
 */
public final class Payloads {

    private Payloads() {}

    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<Object, Object> out = new LinkedHashMap<>(Math.max(4, m.size() * 2));
            for (Map.Entry<?, ?> e : m.entrySet()) {
                out.put(e.getKey(), freeze(e.getValue()));
            }
            return Collections.unmodifiableMap(out);
        }
        if (value instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(freeze(o));
            return Collections.unmodifiableList(out);
        }
        if (value instanceof Set<?> s) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object o : s) out.add(freeze(o));
            return Collections.unmodifiableSet(out);
        }
        if (value instanceof Collection<?> c) {
            List<Object> out = new ArrayList<>(c.size());
            for (Object o : c) out.add(freeze(o));
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    /** @return the payload as a map, or an empty map when it is not one */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object data) {
        if (data instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return Map.of();
    }

    /**
     * Truthiness used by gates: booleans as is, numbers non-zero, strings and collections
     * non-empty, null false.
     */
    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence cs) return cs.length() > 0;
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        return true;
    }

    /** Plain description of an event, used inside derived payloads. */
    public static Map<String, Object> describe(Input event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("event_type", event.eventType());
        out.put("producer_id", event.producerId());
        out.put("data", event.data());
        out.put("timestamp", event.timestamp().toString());
        return Collections.unmodifiableMap(out);
    }
}
