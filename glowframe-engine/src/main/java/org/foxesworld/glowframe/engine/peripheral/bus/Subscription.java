package org.foxesworld.glowframe.engine.peripheral.bus;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link EventBus#subscribe}. Pass it back to {@link EventBus#unsubscribe}.
 */
public final class Subscription {

    private final String eventType;
    private final EventHandler handler;
    private final int priority;
    private final long sequence;
    private final boolean once;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(String eventType, EventHandler handler, int priority, long sequence, boolean once) {
        this.eventType = eventType;
        this.handler = handler;
        this.priority = priority;
        this.sequence = sequence;
        this.once = once;
    }

    /** @return subscribed event type, or null for a wildcard subscription */
    public String eventType() { return eventType; }
    public int priority() { return priority; }
    public long sequence() { return sequence; }
    public boolean once() { return once; }
    public boolean isActive() { return active.get(); }

    EventHandler handler() { return handler; }

    boolean deactivate() {
        return active.compareAndSet(true, false);
    }

    /** Higher priority first, then subscription order. */
    static int compare(Subscription a, Subscription b) {
        int c = Integer.compare(b.priority, a.priority);
        return (c != 0) ? c : Long.compare(a.sequence, b.sequence);
    }

    @Override
    public String toString() {
        return "Subscription{type=" + (eventType == null ? "*" : eventType)
                + ", priority=" + priority + ", seq=" + sequence + (once ? ", once" : "") + '}';
    }
}
