package org.foxesworld.glowframe.engine.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Bounded history of stream values, optionally limited by age. Not thread-safe.
 */
final class ReplayBuffer<T> {

    private record Item<T>(long atNanos, T value) {}

    private final int capacity;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final ArrayDeque<Item<T>> items = new ArrayDeque<>();

    /**
     * @param capacity 0 disables replay
     * @param windowMs 0 keeps values regardless of age
     */
    ReplayBuffer(int capacity, int windowMs, LongSupplier nanoClock) {
        this.capacity = Math.max(0, capacity);
        this.windowNanos = windowMs * 1_000_000L;
        this.nanoClock = nanoClock;
    }

    void add(T value) {
        if (capacity == 0) return;
        items.addLast(new Item<>(nanoClock.getAsLong(), value));
        while (items.size() > capacity) items.removeFirst();
    }

    List<T> values() {
        evictExpired();
        List<T> out = new ArrayList<>(items.size());
        for (Item<T> i : items) out.add(i.value());
        return out;
    }

    int size() {
        evictExpired();
        return items.size();
    }

    private void evictExpired() {
        if (windowNanos <= 0 || items.isEmpty()) return;
        long now = nanoClock.getAsLong();
        while (!items.isEmpty() && now - items.peekFirst().atNanos() > windowNanos) {
            items.removeFirst();
        }
    }
}
