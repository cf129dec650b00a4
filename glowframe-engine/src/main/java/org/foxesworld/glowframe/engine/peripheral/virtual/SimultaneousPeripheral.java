package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits when enough distinct producers fire the same event type within the window.
 */
final class SimultaneousPeripheral implements VirtualPeripheral {

    private record Hit(long atNanos, Input event) {}

    private final VirtualPeripheralContext ctx;
    private final long windowNanos;
    private final int requiredSources;
    private final String outputEventType;
    private final Map<String, Deque<Hit>> pending = new HashMap<>();

    SimultaneousPeripheral(VirtualPeripheralContext ctx, long windowNanos, int requiredSources, String outputEventType) {
        if (windowNanos <= 0) throw new IllegalArgumentException("window must be positive");
        if (requiredSources < 2) throw new IllegalArgumentException("requiredSources must be at least 2");
        this.ctx = ctx;
        this.windowNanos = windowNanos;
        this.requiredSources = requiredSources;
        this.outputEventType = outputEventType;
    }

    @Override
    public void handle(Input event) {
        Deque<Hit> bucket = pending.computeIfAbsent(event.eventType(), k -> new ArrayDeque<>());
        long now = ctx.monotonicNanos();

        while (!bucket.isEmpty() && now - bucket.peekFirst().atNanos() > windowNanos) {
            bucket.removeFirst();
        }
        bucket.addLast(new Hit(now, event));

        // newest event per producer, newest first
        Map<Integer, Input> unique = new LinkedHashMap<>();
        for (Iterator<Hit> it = bucket.descendingIterator(); it.hasNext(); ) {
            Input e = it.next().event();
            unique.putIfAbsent(e.producerId(), e);
        }
        if (unique.size() < requiredSources) return;

        List<Object> events = new ArrayList<>(unique.size());
        for (Input e : unique.values()) events.add(Payloads.describe(e));
        Collections.reverse(events);
        bucket.clear();
        ctx.emit(outputEventType, Map.of("events", events), 0);
    }

    @Override
    public void shutdown() {
        pending.clear();
    }
}
