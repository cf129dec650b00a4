package org.foxesworld.glowframe.engine.render.state;

import org.foxesworld.glowframe.engine.stream.SharedStream;
import org.foxesworld.glowframe.engine.stream.StreamSubscription;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Holds a renderer's current state snapshot.
 *
 * <p>Snapshots are replaced wholesale, never mutated: a reader that took a reference keeps a
 * consistent value for the whole frame. At most one upstream subscription is live;
 * {@link #reset()} disposes it and clears the snapshot.</p>
 */
public final class StateHolder<S> {

    private final AtomicReference<S> current = new AtomicReference<>();
    private StreamSubscription subscription; // guarded by this

    public void initialize(S initial) {
        current.set(Objects.requireNonNull(initial, "initial"));
    }

    /**
     * Subscribe to {@code stream}; every delivered value replaces the snapshot. When the stream
     * delivers nothing synchronously (no replay), {@code fallback} provides the first snapshot.
     *
     * @param fallback initial snapshot supplier, may be null
     * @throws IllegalStateException when neither the stream nor the fallback produced a snapshot
     */
    public synchronized void bind(SharedStream<? extends S> stream, Supplier<? extends S> fallback) {
        Objects.requireNonNull(stream, "stream");
        disposeSubscription();
        subscription = stream.subscribe(this::replace);

        if (current.get() == null && fallback != null) {
            current.compareAndSet(null, Objects.requireNonNull(fallback.get(), "fallback state"));
        }
        if (current.get() == null) {
            disposeSubscription();
            throw new IllegalStateException("stream '" + stream.name() + "' delivered no initial state");
        }
    }

    public void replace(S next) {
        current.set(Objects.requireNonNull(next, "next"));
    }

    /** Atomically derive a new snapshot from the current one. */
    public S update(UnaryOperator<S> change) {
        Objects.requireNonNull(change, "change");
        return current.updateAndGet(s -> {
            if (s == null) throw new IllegalStateException("state is not initialized");
            return Objects.requireNonNull(change.apply(s), "updated state");
        });
    }

    /** @return current snapshot or null */
    public S get() {
        return current.get();
    }

    public S require() {
        S s = current.get();
        if (s == null) throw new IllegalStateException("state is not initialized");
        return s;
    }

    public boolean isInitialized() {
        return current.get() != null;
    }

    public synchronized boolean isBound() {
        return subscription != null && subscription.isActive();
    }

    public synchronized void reset() {
        disposeSubscription();
        current.set(null);
    }

    private void disposeSubscription() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }
}
