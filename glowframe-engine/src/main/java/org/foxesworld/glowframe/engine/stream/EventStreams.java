package org.foxesworld.glowframe.engine.stream;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.bus.Subscription;

import java.util.Objects;

/**
 * Stream sources backed by event bus subscriptions.
 */
public final class EventStreams {

    public static final String FRAME_TICK = "render.frame.tick";

    private EventStreams() {}

    /** Events of one type; connecting subscribes to the bus, closing unsubscribes. */
    public static StreamSource<Input> events(EventBus bus, String eventType) {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(eventType, "eventType");
        return downstream -> {
            Subscription s = bus.subscribe(eventType, downstream::onNext);
            return () -> bus.unsubscribe(s);
        };
    }

    /** Shared stream of one bus event type. */
    public static SharedStream<Input> share(EventBus bus, String eventType, StreamShareSettings settings) {
        return SharedStreams.share(events(bus, eventType), eventType, settings);
    }

    public static SharedStream<Input> frameTicks(EventBus bus, StreamShareSettings settings) {
        return share(bus, FRAME_TICK, settings);
    }
}
