package org.foxesworld.glowframe.engine.peripheral.bus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.Input;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Pub/sub dispatcher for peripheral {@link Input} events.
 *
 * <p>{@link #emit} runs every matching handler on the calling thread (wildcards included,
 * higher priority first, then subscription order) and records the event in the
 * {@link StateStore} afterwards, under the sequence taken when dispatch started. A failing handler is logged and reported; it never stops the
 * other handlers or the state update.</p>
 *
 * <p>{@link #post} queues an event for the render loop, which drains the queue with
 * {@link #pump(int, long)} under an event and time budget. {@link #publish} dispatches on the
 * configured executor.</p>
 */
public final class EventBus {

    private static final Logger log = LogManager.getLogger(EventBus.class);

    public static final int DEFAULT_MAX_EVENTS_PER_FRAME = 4096;
    public static final long DEFAULT_TIME_BUDGET_NANOS = 2_000_000L; // 2ms

    /**
     * Copy-on-write subscriber array kept in dispatch order.
     */
    private static final class SubList {

        private volatile Subscription[] arr = new Subscription[0];

        synchronized void add(Subscription s) {
            Subscription[] next = Arrays.copyOf(arr, arr.length + 1);
            next[arr.length] = s;
            Arrays.sort(next, Subscription::compare);
            arr = next;
        }

        /** @return true if removed */
        synchronized boolean remove(Subscription s) {
            Subscription[] cur = arr;
            for (int i = 0; i < cur.length; i++) {
                if (cur[i] == s) {
                    Subscription[] next = new Subscription[cur.length - 1];
                    System.arraycopy(cur, 0, next, 0, i);
                    System.arraycopy(cur, i + 1, next, i, cur.length - i - 1);
                    arr = next;
                    return true;
                }
            }
            return false;
        }

        Subscription[] snapshot() {
            return arr;
        }

        synchronized void clear() {
            arr = new Subscription[0];
        }
    }

    private final StateStore states;
    private final LongSupplier nanoClock;
    private final Executor asyncExecutor;

    private final AtomicLong nextSequence = new AtomicLong();
    private final Map<String, SubList> handlers = new ConcurrentHashMap<>();
    private final SubList wildcard = new SubList();
    private final Queue<Input> queue = new ConcurrentLinkedQueue<>();

    public EventBus() {
        this(new StateStore());
    }

    public EventBus(StateStore states) {
        this(states, System::nanoTime, ForkJoinPool.commonPool());
    }

    /**
     * @param nanoClock     monotonic clock shared with virtual peripherals
     * @param asyncExecutor executor used by {@link #publish}
     */
    public EventBus(StateStore states, LongSupplier nanoClock, Executor asyncExecutor) {
        this.states = Objects.requireNonNull(states, "states");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
    }

    // ---------------- subscriptions ----------------

    public Subscription subscribe(String eventType, EventHandler handler) {
        return subscribe(eventType, handler, 0);
    }

    /**
     * @param eventType event type, or null to receive every event
     */
    public Subscription subscribe(String eventType, EventHandler handler, int priority) {
        return add(eventType, handler, priority, false);
    }

    /** Handler is removed after its first delivery. */
    public Subscription once(String eventType, EventHandler handler) {
        return add(eventType, handler, 0, true);
    }

    public Subscription subscribeAll(EventHandler handler, int priority) {
        return add(null, handler, priority, false);
    }

    /** @return true if the subscription was still registered */
    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null) return false;
        subscription.deactivate();
        if (subscription.eventType() == null) return wildcard.remove(subscription);
        SubList list = handlers.get(subscription.eventType());
        return list != null && list.remove(subscription);
    }

    public int subscriberCount(String eventType) {
        SubList list = handlers.get(eventType);
        return (list != null ? list.snapshot().length : 0) + wildcard.snapshot().length;
    }

    private Subscription add(String eventType, EventHandler handler, int priority, boolean once) {
        Objects.requireNonNull(handler, "handler");
        if (eventType != null && eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        Subscription s = new Subscription(eventType, handler, priority, nextSequence.getAndIncrement(), once);
        if (eventType == null) wildcard.add(s);
        else handlers.computeIfAbsent(eventType, k -> new SubList()).add(s);
        return s;
    }

    // ---------------- dispatch ----------------

    public DispatchReport emit(String eventType, Object data) {
        return emit(Input.of(eventType, data, 0));
    }

    public DispatchReport emit(String eventType, Object data, int producerId) {
        return emit(Input.of(eventType, data, producerId));
    }

    public DispatchReport emit(Input event) {
        Objects.requireNonNull(event, "event");
        long t0 = nanoClock.getAsLong();
        long sequence = states.nextSequence();
        int delivered = 0;
        List<HandlerFailure> failures = new ArrayList<>(0);
        try {
            for (Subscription s : targets(event.eventType())) {
                if (!s.isActive()) continue;
                if (s.once()) {
                    if (!s.deactivate()) continue;
                    unsubscribe(s);
                }
                try {
                    s.handler().handle(event);
                    delivered++;
                } catch (Throwable e) {
                    log.error("Event handler failed: {} (producer={}, {})", event.eventType(), event.producerId(), s, e);
                    failures.add(new HandlerFailure(s, e));
                }
            }
        } finally {
            states.update(event, sequence);
        }

        if (log.isDebugEnabled()) {
            log.debug("Dispatched event {} from producer {} to {} subscriber(s) in {}ms",
                    event.eventType(), event.producerId(), delivered,
                    String.format("%.3f", (nanoClock.getAsLong() - t0) / 1_000_000.0));
        }
        return new DispatchReport(event, delivered, failures);
    }

    /** Dispatch on the async executor. */
    public CompletableFuture<DispatchReport> publish(Input event) {
        Objects.requireNonNull(event, "event");
        return CompletableFuture.supplyAsync(() -> emit(event), asyncExecutor);
    }

    /** Queue for the next {@link #pump}. Safe from any thread. */
    public void post(Input event) {
        queue.add(Objects.requireNonNull(event, "event"));
    }

    /** Pump with defaults and return processed count. */
    public int pump() {
        return pump(DEFAULT_MAX_EVENTS_PER_FRAME, DEFAULT_TIME_BUDGET_NANOS);
    }

    /**
     * Drain queued events.
     *
     * @param timeBudgetNanos time budget, checked every 64 events; 0 or less means unbounded
     * @return number of events dispatched
     */
    public int pump(int maxEvents, long timeBudgetNanos) {
        int limit = Math.max(0, maxEvents);

        long now = nanoClock.getAsLong();
        long deadline;
        if (timeBudgetNanos <= 0L) {
            deadline = Long.MAX_VALUE;
        } else {
            long sum = now + timeBudgetNanos;
            deadline = (sum < now) ? Long.MAX_VALUE : sum;
        }

        int processed = 0;
        int checkMask = 0x3F;

        while (processed < limit) {
            Input e = queue.poll();
            if (e == null) break;

            processed++;
            emit(e);

            if ((processed & checkMask) == 0 && nanoClock.getAsLong() >= deadline) break;
        }
        return processed;
    }

    public int queuedEventsApprox() {
        return queue.size();
    }

    private List<Subscription> targets(String eventType) {
        Subscription[] any = wildcard.snapshot();
        SubList list = handlers.get(eventType);
        Subscription[] specific = (list != null) ? list.snapshot() : new Subscription[0];
        if (any.length == 0) return Arrays.asList(specific);
        if (specific.length == 0) return Arrays.asList(any);

        Subscription[] merged = Arrays.copyOf(any, any.length + specific.length);
        System.arraycopy(specific, 0, merged, any.length, specific.length);
        Arrays.sort(merged, Subscription::compare);
        return Arrays.asList(merged);
    }

    // ---------------- accessors ----------------

    public StateStore states() {
        return states;
    }

    /** Monotonic time of this bus, in nanoseconds. */
    public long monotonicNanos() {
        return nanoClock.getAsLong();
    }

    public void clearAll() {
        handlers.clear();
        wildcard.clear();
        queue.clear();
    }
}
