package org.foxesworld.glowframe.engine.peripheral.bus;

import org.foxesworld.glowframe.engine.peripheral.Input;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latest event per (event type, producer id).
 *
 * <p>Writers are ordered by an emission sequence. {@link EventBus} takes it with
 * {@link #nextSequence()} before running handlers, so an event re-emitted by a handler or by a
 * racing thread is newer than the event being dispatched, whichever is written last. Of two
 * writes for one key the higher sequence is kept. Reads never block and return copies.</p>
 */
public final class StateStore {

    private record Entry(Input input, long sequence) {}

    private static final Comparator<Entry> NEWEST = Comparator
            .comparing((Entry e) -> e.input().timestamp())
            .thenComparingLong(Entry::sequence);

    private final Map<String, ConcurrentHashMap<Integer, Entry>> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /** @return a fresh emission sequence, higher than every one handed out before */
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    public void update(Input input) {
        update(input, nextSequence());
    }

    /**
     * Record {@code input} unless the key already holds an event with a higher sequence.
     *
     * @param sequence value from {@link #nextSequence()} taken when the event was emitted
     */
    public void update(Input input, long sequence) {
        Objects.requireNonNull(input, "input");
        Entry e = new Entry(input, sequence);
        entries.computeIfAbsent(input.eventType(), k -> new ConcurrentHashMap<>())
                .merge(input.producerId(), e, (old, neu) -> neu.sequence() > old.sequence() ? neu : old);
    }

    /** @return latest event of {@code eventType} from {@code producerId}, or null */
    public Input getLatest(String eventType, int producerId) {
        Map<Integer, Entry> byProducer = entries.get(eventType);
        if (byProducer == null) return null;
        Entry e = byProducer.get(producerId);
        return e != null ? e.input() : null;
    }

    /** @return newest event of {@code eventType} from any producer, or null */
    public Input getLatest(String eventType) {
        Map<Integer, Entry> byProducer = entries.get(eventType);
        if (byProducer == null || byProducer.isEmpty()) return null;
        return byProducer.values().stream().max(NEWEST).map(Entry::input).orElse(null);
    }

    /** @return read-only copy of producer id to latest event */
    public Map<Integer, Input> getAll(String eventType) {
        Map<Integer, Entry> byProducer = entries.get(eventType);
        if (byProducer == null) return Map.of();
        Map<Integer, Input> out = new LinkedHashMap<>();
        byProducer.forEach((producer, e) -> out.put(producer, e.input()));
        return Collections.unmodifiableMap(out);
    }

    /** @return read-only copy of every event type to its producers' latest events */
    public Map<String, Map<Integer, Input>> snapshot() {
        Map<String, Map<Integer, Input>> out = new LinkedHashMap<>();
        for (String type : entries.keySet()) {
            Map<Integer, Input> all = getAll(type);
            if (!all.isEmpty()) out.put(type, all);
        }
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        int n = 0;
        for (Map<Integer, Entry> m : entries.values()) n += m.size();
        return n;
    }

    public void clear() {
        entries.clear();
    }
}
