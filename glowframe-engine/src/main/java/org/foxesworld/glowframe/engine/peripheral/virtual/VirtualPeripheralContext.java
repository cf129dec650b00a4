package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Payloads;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.bus.StateStore;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylistManager;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a virtual peripheral may use: the bus it re-emits on, the state store, the playlist
 * manager and the bus clock.
 */
public final class VirtualPeripheralContext {

    public static final String DESCRIPTOR_KEY = "virtual_peripheral";

    private final EventBus bus;
    private final EventPlaylistManager playlists;
    private final VirtualPeripheralDefinition definition;
    private final VirtualPeripheralHandle handle;

    VirtualPeripheralContext(EventBus bus,
                             EventPlaylistManager playlists,
                             VirtualPeripheralDefinition definition,
                             VirtualPeripheralHandle handle) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.playlists = playlists;
        this.definition = Objects.requireNonNull(definition, "definition");
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    public VirtualPeripheralDefinition definition() {
        return definition;
    }

    public VirtualPeripheralHandle handle() {
        return handle;
    }

    public StateStore states() {
        return bus.states();
    }

    public EventPlaylistManager playlists() {
        if (playlists == null) throw new IllegalStateException("no playlist manager bound to this registry");
        return playlists;
    }

    public long monotonicNanos() {
        return bus.monotonicNanos();
    }

    /**
     * Emit a derived event. Map payloads are copied, anything else is wrapped as
     * {@code {"value": data}}; the {@code virtual_peripheral} descriptor is added unless present.
     */
    public void emit(String eventType, Object data, int producerId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (data instanceof Map<?, ?> m) {
            m.forEach((k, v) -> payload.put(String.valueOf(k), v));
        } else {
            payload.put("value", data);
        }

        if (!payload.containsKey(DESCRIPTOR_KEY)) {
            Map<String, Object> descriptor = new LinkedHashMap<>();
            descriptor.put("id", handle.id());
            descriptor.put("name", definition.name());
            if (definition.metadata() != null) descriptor.put("metadata", definition.metadata());
            payload.put(DESCRIPTOR_KEY, descriptor);
        }
        bus.emit(eventType, Payloads.freeze(payload), producerId);
    }
}
