package org.foxesworld.glowframe.engine.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Forwards only the latest upstream value per window.
 *
 * <p>The first value of a burst opens a window; values arriving inside it replace the pending one,
 * which is flushed when the window timer fires. A value arriving after an overdue window flushes
 * the pending value at once. Completion flushes the pending value first; an error drops it.</p>
 */
final class CoalescingSource<T> implements StreamSource<T> {

    private static final Logger log = LogManager.getLogger(CoalescingSource.class);

    private final StreamSource<T> upstream;
    private final String name;
    private final int windowMs;
    private final GraceScheduler timer;
    private final LongSupplier nanoClock;

    CoalescingSource(StreamSource<T> upstream, String name, int windowMs, GraceScheduler timer, LongSupplier nanoClock) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.name = Objects.requireNonNull(name, "name");
        if (windowMs <= 0) throw new IllegalArgumentException("windowMs must be > 0: " + windowMs);
        this.windowMs = windowMs;
        this.timer = Objects.requireNonNull(timer, "timer");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /** @return {@code source} itself when {@code windowMs} is 0 */
    static <T> StreamSource<T> wrap(StreamSource<T> source, String name, int windowMs,
                                    GraceScheduler timer, LongSupplier nanoClock) {
        return windowMs <= 0 ? source : new CoalescingSource<>(source, name, windowMs, timer, nanoClock);
    }

    @Override
    public StreamConnection connect(StreamObserver<? super T> downstream) {
        log.debug("Coalescing {} with window_ms={}", name, windowMs);
        Window w = new Window(downstream);
        StreamConnection c = upstream.connect(w);
        return () -> {
            c.close();
            w.dispose();
        };
    }

    private final class Window implements StreamObserver<T> {

        private final StreamObserver<? super T> downstream;

        // guarded by this
        private T pending;
        private boolean hasPending;
        private long dueNanos;
        private GraceScheduler.Scheduled scheduled;

        Window(StreamObserver<? super T> downstream) {
            this.downstream = downstream;
        }

        @Override
        public void onNext(T value) {
            long now = nanoClock.getAsLong();
            T overdue = null;
            boolean flushNow = false;
            synchronized (this) {
                if (hasPending && scheduled != null && now >= dueNanos) {
                    overdue = pending;
                    flushNow = true;
                    scheduled.cancel();
                    scheduled = null;
                }
                pending = value;
                hasPending = true;
                if (scheduled == null) {
                    dueNanos = now + windowMs * 1_000_000L;
                    scheduled = timer.schedule(windowMs, this::flush);
                }
            }
            if (flushNow) downstream.onNext(overdue);
        }

        private void flush() {
            T value;
            synchronized (this) {
                scheduled = null;
                if (!hasPending) return;
                value = pending;
                pending = null;
                hasPending = false;
            }
            downstream.onNext(value);
        }

        @Override
        public void onError(Throwable error) {
            dispose();
            downstream.onError(error);
        }

        @Override
        public void onComplete() {
            synchronized (this) {
                if (scheduled != null) {
                    scheduled.cancel();
                    scheduled = null;
                }
            }
            flush();
            downstream.onComplete();
        }

        synchronized void dispose() {
            if (scheduled != null) {
                scheduled.cancel();
                scheduled = null;
            }
            pending = null;
            hasPending = false;
        }
    }
}
