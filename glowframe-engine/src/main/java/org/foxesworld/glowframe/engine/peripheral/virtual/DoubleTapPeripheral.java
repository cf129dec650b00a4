package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits once when the same producer fires twice within the window. The pair is consumed, so a
 * third tap starts a new pair.
 */
final class DoubleTapPeripheral implements VirtualPeripheral {

    private record Tap(long atNanos, Input event) {}

    private final VirtualPeripheralContext ctx;
    private final long windowNanos;
    private final String outputEventType;
    private final Map<Integer, Tap> last = new HashMap<>();

    DoubleTapPeripheral(VirtualPeripheralContext ctx, long windowNanos, String outputEventType) {
        if (windowNanos <= 0) throw new IllegalArgumentException("window must be positive");
        this.ctx = ctx;
        this.windowNanos = windowNanos;
        this.outputEventType = outputEventType;
    }

    @Override
    public void handle(Input event) {
        long now = ctx.monotonicNanos();
        Tap prev = last.get(event.producerId());

        if (prev != null && now - prev.atNanos() <= windowNanos) {
            last.remove(event.producerId());
            ctx.emit(outputEventType,
                    Map.of("events", List.of(Payloads.describe(prev.event()), Payloads.describe(event))),
                    event.producerId());
            return;
        }
        last.put(event.producerId(), new Tap(now, event));
    }

    @Override
    public void shutdown() {
        last.clear();
    }
}
