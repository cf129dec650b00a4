package org.foxesworld.glowframe.engine.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * {@link SharedStream} over one upstream connection with a replay buffer and a connect policy.
 *
 * <p>Ref-counted streams connect once {@code minSubscribers} are attached and disconnect when
 * the count drops below it, immediately or after the grace delay if nobody resubscribes in
 * the meantime. Auto-connect streams connect once at the threshold and stay connected until
 * closed. The replay buffer outlives reconnects.</p>
 *
 * <p>Values are delivered synchronously on the upstream thread, one at a time. A subscriber that
 * throws is logged and skipped. When the upstream completes or fails, every attached subscriber
 * is terminated and detached; the next subscriber starts a fresh connection.</p>
 */
public final class MulticastStream<T> implements SharedStream<T> {

    private static final Logger log = LogManager.getLogger(MulticastStream.class);

    public enum Policy { REF_COUNT, AUTO_CONNECT }

    private final String name;
    private final StreamSource<T> source;
    private final Policy policy;
    private final int minSubscribers;
    private final int graceMs;
    private final ConnectMode connectMode;
    private final GraceScheduler grace;
    private final ReplayBuffer<T> replay;

    // guarded by this
    private final List<Sub> subscribers = new ArrayList<>();
    private StreamConnection connection;
    private GraceScheduler.Scheduled pendingDisconnect;
    private boolean autoConnected;
    private boolean closed;
    private long delivered;
    private long connects;

    MulticastStream(String name,
                    StreamSource<T> source,
                    Policy policy,
                    int minSubscribers,
                    int graceMs,
                    ConnectMode connectMode,
                    int replayCapacity,
                    int replayWindowMs,
                    GraceScheduler grace,
                    LongSupplier nanoClock) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = Objects.requireNonNull(source, "source");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.connectMode = Objects.requireNonNull(connectMode, "connectMode");
        this.grace = Objects.requireNonNull(grace, "grace");
        if (minSubscribers < 1) throw new IllegalArgumentException("minSubscribers must be >= 1: " + minSubscribers);
        if (graceMs < 0) throw new IllegalArgumentException("graceMs must be >= 0: " + graceMs);
        this.minSubscribers = minSubscribers;
        this.graceMs = graceMs;
        this.replay = new ReplayBuffer<>(replayCapacity, replayWindowMs, nanoClock);
    }

    private final class Sub implements StreamSubscription {
        final StreamObserver<? super T> observer;
        volatile boolean active = true;

        Sub(StreamObserver<? super T> observer) {
            this.observer = observer;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            detach(this);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized StreamSubscription subscribe(StreamObserver<? super T> observer) {
        Objects.requireNonNull(observer, "observer");
        Sub sub = new Sub(observer);
        if (closed) {
            sub.active = false;
            observer.onComplete();
            return sub;
        }

        cancelPendingDisconnect();
        int count = subscribers.size() + 1;

        boolean eager = policy == Policy.REF_COUNT && connectMode == ConnectMode.EAGER;
        if (eager && shouldConnect(count)) connect();

        for (T v : replay.values()) {
            safeNext(sub, v);
        }
        subscribers.add(sub);

        if (!eager && shouldConnect(count)) connect();
        return sub;
    }

    private boolean shouldConnect(int count) {
        if (connection != null || count < minSubscribers) return false;
        return policy == Policy.REF_COUNT || !autoConnected;
    }

    private void connect() {
        log.debug("Connecting {} ({}, min={}, grace_ms={}, mode={})", name, policy, minSubscribers, graceMs, connectMode);
        connects++;
        if (policy == Policy.AUTO_CONNECT) autoConnected = true;
        connection = source.connect(new Upstream());
    }

    private synchronized void detach(Sub sub) {
        if (!sub.active) return;
        sub.active = false;
        subscribers.remove(sub);

        if (policy != Policy.REF_COUNT || connection == null || subscribers.size() >= minSubscribers) return;
        if (graceMs <= 0) {
            disconnect();
            return;
        }
        log.debug("Scheduling disconnect for {} in {}ms (min={})", name, graceMs, minSubscribers);
        cancelPendingDisconnect();
        pendingDisconnect = grace.schedule(graceMs, this::graceExpired);
    }

    private synchronized void graceExpired() {
        pendingDisconnect = null;
        if (connection == null || subscribers.size() >= minSubscribers) return;
        log.debug("Disconnecting {} after refcount grace window", name);
        disconnect();
    }

    private void disconnect() {
        StreamConnection c = connection;
        connection = null;
        if (c == null) return;
        try {
            c.close();
        } catch (RuntimeException e) {
            log.error("Stream {} failed to disconnect", name, e);
        }
    }

    private void cancelPendingDisconnect() {
        if (pendingDisconnect != null) {
            pendingDisconnect.cancel();
            pendingDisconnect = null;
        }
    }

    private synchronized void deliver(T value) {
        if (closed) return;
        delivered++;
        replay.add(value);
        for (Sub s : new ArrayList<>(subscribers)) {
            safeNext(s, value);
        }
    }

    private void safeNext(Sub s, T value) {
        if (!s.active) return;
        try {
            s.observer.onNext(value);
        } catch (Throwable e) {
            log.error("Stream {} subscriber failed", name, e);
        }
    }

    private synchronized void terminate(Throwable error) {
        if (closed) return;
        connection = null;
        autoConnected = false;
        cancelPendingDisconnect();
        List<Sub> subs = new ArrayList<>(subscribers);
        subscribers.clear();
        for (Sub s : subs) {
            s.active = false;
            try {
                if (error != null) s.observer.onError(error);
                else s.observer.onComplete();
            } catch (Throwable e) {
                log.error("Stream {} subscriber failed on termination", name, e);
            }
        }
    }

    private final class Upstream implements StreamObserver<T> {
        @Override
        public void onNext(T value) {
            deliver(value);
        }

        @Override
        public void onError(Throwable error) {
            log.warn("Stream {} upstream failed: {}", name, error.toString());
            terminate(error);
        }

        @Override
        public void onComplete() {
            terminate(null);
        }
    }

    @Override
    public synchronized int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public synchronized boolean isConnected() {
        return connection != null;
    }

    @Override
    public synchronized long delivered() {
        return delivered;
    }

    @Override
    public synchronized long connects() {
        return connects;
    }

    synchronized int replaySize() {
        return replay.size();
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        cancelPendingDisconnect();
        disconnect();
        closed = true;
        List<Sub> subs = new ArrayList<>(subscribers);
        subscribers.clear();
        for (Sub s : subs) {
            s.active = false;
            try {
                s.observer.onComplete();
            } catch (Throwable e) {
                log.error("Stream {} subscriber failed on completion", name, e);
            }
        }
        log.debug("Stream {} closed", name);
    }
}
