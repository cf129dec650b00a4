package org.foxesworld.glowframe.engine.peripheral.virtual;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of a derived peripheral.
 *
 * @param eventTypes source event types routed to the instance
 * @param priority   bus priority of the routing subscriptions
 * @param metadata   copied into the {@code virtual_peripheral} descriptor of derived events; may be null
 */
public record VirtualPeripheralDefinition(
        String name,
        List<String> eventTypes,
        VirtualPeripheralFactory factory,
        int priority,
        Map<String, Object> metadata
) {

    public VirtualPeripheralDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("VirtualPeripheralDefinition '" + name + "' requires event types");
        }
        eventTypes = List.copyOf(new LinkedHashSet<>(eventTypes));
        metadata = (metadata == null) ? null : Map.copyOf(metadata);
    }

    public VirtualPeripheralDefinition(String name, List<String> eventTypes, VirtualPeripheralFactory factory) {
        this(name, eventTypes, factory, 0, null);
    }
}
