package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.Input;

import java.util.Set;

/**
 * Re-emits mirrored event types under another producer id while the gate is open. Gate events
 * open or close it through the predicate.
 */
final class GatedMirrorPeripheral implements VirtualPeripheral {

    private static final Logger log = LogManager.getLogger(GatedMirrorPeripheral.class);

    private final VirtualPeripheralContext ctx;
    private final Set<String> gateEventTypes;
    private final Set<String> mirrorEventTypes;
    private final int outputProducerId;
    private final GatePredicate predicate;
    private boolean enabled;

    GatedMirrorPeripheral(VirtualPeripheralContext ctx,
                          Set<String> gateEventTypes,
                          Set<String> mirrorEventTypes,
                          int outputProducerId,
                          GatePredicate predicate,
                          boolean initialState) {
        if (gateEventTypes.isEmpty()) throw new IllegalArgumentException("gateEventTypes must not be empty");
        if (mirrorEventTypes.isEmpty()) throw new IllegalArgumentException("mirrorEventTypes must not be empty");
        this.ctx = ctx;
        this.gateEventTypes = Set.copyOf(gateEventTypes);
        this.mirrorEventTypes = Set.copyOf(mirrorEventTypes);
        this.outputProducerId = outputProducerId;
        this.predicate = predicate;
        this.enabled = initialState;
    }

    @Override
    public void handle(Input event) {
        if (gateEventTypes.contains(event.eventType())) {
            try {
                enabled = predicate.test(ctx, event);
            } catch (RuntimeException e) {
                log.error("Virtual peripheral {} failed to evaluate gate event", ctx.definition().name(), e);
            }
            return;
        }

        // skip our own output when it loops back on the same type
        if (event.producerId() == outputProducerId) return;

        if (enabled && mirrorEventTypes.contains(event.eventType())) {
            ctx.emit(event.eventType(), event.data(), outputProducerId);
        }
    }

    boolean enabled() {
        return enabled;
    }
}
