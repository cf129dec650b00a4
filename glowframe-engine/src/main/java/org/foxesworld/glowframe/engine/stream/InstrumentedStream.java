package org.foxesworld.glowframe.engine.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Logs per-interval delivery statistics of a {@link SharedStream} while it has subscribers.
 * Every value handed to a subscriber counts as one event.
 */
final class InstrumentedStream<T> implements SharedStream<T> {

    private static final Logger log = LogManager.getLogger(InstrumentedStream.class);

    /** One logged interval. */
    record Stats(long events, int subscribers) {}

    private final SharedStream<T> delegate;
    private final int intervalMs;
    private final GraceScheduler timer;

    // guarded by this
    private long events;
    private GraceScheduler.Scheduled next;
    private Stats last;

    InstrumentedStream(SharedStream<T> delegate, int intervalMs, GraceScheduler timer) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (intervalMs <= 0) throw new IllegalArgumentException("intervalMs must be > 0: " + intervalMs);
        this.intervalMs = intervalMs;
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public StreamSubscription subscribe(StreamObserver<? super T> observer) {
        Objects.requireNonNull(observer, "observer");
        synchronized (this) {
            scheduleLog();
        }
        StreamSubscription sub = delegate.subscribe(new StreamObserver<T>() {
            @Override
            public void onNext(T value) {
                synchronized (InstrumentedStream.this) {
                    events++;
                }
                observer.onNext(value);
            }

            @Override
            public void onError(Throwable error) {
                observer.onError(error);
            }

            @Override
            public void onComplete() {
                observer.onComplete();
            }
        });
        return new StreamSubscription() {
            @Override
            public boolean isActive() {
                return sub.isActive();
            }

            @Override
            public void close() {
                sub.close();
                synchronized (InstrumentedStream.this) {
                    if (delegate.subscriberCount() <= 0) cancelLog();
                }
            }
        };
    }

    private void scheduleLog() {
        if (next == null) next = timer.schedule(intervalMs, this::logStats);
    }

    private void cancelLog() {
        if (next != null) {
            next.cancel();
            next = null;
        }
    }

    private void logStats() {
        Stats stats;
        synchronized (this) {
            next = null;
            int subscribers = delegate.subscriberCount();
            if (subscribers <= 0) {
                events = 0;
                return;
            }
            stats = new Stats(events, subscribers);
            events = 0;
            last = stats;
            scheduleLog();
        }
        log.debug("Stream stats for {} events={} subscribers={} interval_ms={}",
                name(), stats.events(), stats.subscribers(), intervalMs);
    }

    /** @return the most recently logged interval, or null before the first one */
    synchronized Stats lastStats() {
        return last;
    }

    synchronized boolean logScheduled() {
        return next != null;
    }

    @Override
    public int subscriberCount() {
        return delegate.subscriberCount();
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public long delivered() {
        return delegate.delivered();
    }

    @Override
    public long connects() {
        return delegate.connects();
    }

    @Override
    public void close() {
        synchronized (this) {
            cancelLog();
        }
        delegate.close();
    }
}
