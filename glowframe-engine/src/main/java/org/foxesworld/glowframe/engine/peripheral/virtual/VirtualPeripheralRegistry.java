package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.bus.Subscription;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylistManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;

/**
 * Binds virtual peripheral definitions to an event bus.
 *
 * <p>Each registration gets its own instance; the bus routes the definition's source event
 * types to it. Faults inside an instance are logged and dropped.</p>
 */
public final class VirtualPeripheralRegistry implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(VirtualPeripheralRegistry.class);

    private record Binding(VirtualPeripheralDefinition definition, VirtualPeripheral instance, List<Subscription> subscriptions) {}

    private final EventBus bus;
    private final EventPlaylistManager playlists;
    private final Map<String, Binding> bindings = new LinkedHashMap<>(); // guarded by this

    public VirtualPeripheralRegistry(EventBus bus) {
        this(bus, null);
    }

    /**
     * @param playlists playlist manager exposed to instances; may be null when no definition needs it
     */
    public VirtualPeripheralRegistry(EventBus bus, EventPlaylistManager playlists) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.playlists = playlists;
    }

    public VirtualPeripheralHandle register(VirtualPeripheralDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        VirtualPeripheralHandle handle = new VirtualPeripheralHandle(UUID.randomUUID().toString().replace("-", ""));
        bind(handle, definition);
        log.info("Virtual peripheral registered: {} on {}", definition.name(), definition.eventTypes());
        return handle;
    }

    /** Replace the definition behind {@code handle}; the old instance is shut down. */
    public void update(VirtualPeripheralHandle handle, VirtualPeripheralDefinition definition) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(definition, "definition");
        synchronized (this) {
            if (!bindings.containsKey(handle.id())) {
                throw new NoSuchElementException("Unknown virtual peripheral id: " + handle.id());
            }
        }
        unbind(handle);
        bind(handle, definition);
    }

    public void remove(VirtualPeripheralHandle handle) {
        if (handle != null) unbind(handle);
    }

    /** @return read-only copy of id to definition */
    public synchronized Map<String, VirtualPeripheralDefinition> definitions() {
        Map<String, VirtualPeripheralDefinition> out = new LinkedHashMap<>();
        bindings.forEach((id, b) -> out.put(id, b.definition()));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void close() {
        List<String> ids;
        synchronized (this) {
            ids = new ArrayList<>(bindings.keySet());
        }
        for (String id : ids) unbind(new VirtualPeripheralHandle(id));
    }

    private void bind(VirtualPeripheralHandle handle, VirtualPeripheralDefinition definition) {
        VirtualPeripheralContext ctx = new VirtualPeripheralContext(bus, playlists, definition, handle);
        VirtualPeripheral instance = Objects.requireNonNull(definition.factory().create(ctx),
                "factory of '" + definition.name() + "' returned null");

        List<Subscription> subs = new ArrayList<>(definition.eventTypes().size());
        synchronized (this) {
            bindings.put(handle.id(), new Binding(definition, instance, subs));
        }
        for (String type : definition.eventTypes()) {
            subs.add(bus.subscribe(type, e -> route(handle.id(), e), definition.priority()));
        }
    }

    private void unbind(VirtualPeripheralHandle handle) {
        Binding b;
        synchronized (this) {
            b = bindings.remove(handle.id());
        }
        if (b == null) return;

        for (Subscription s : b.subscriptions()) bus.unsubscribe(s);
        try {
            b.instance().shutdown();
        } catch (RuntimeException e) {
            log.error("Virtual peripheral {} shutdown failed", b.definition().name(), e);
        }
        log.debug("Unregistered virtual peripheral {}", b.definition().name());
    }

    private void route(String id, Input event) {
        Binding b;
        synchronized (this) {
            b = bindings.get(id);
        }
        if (b == null) return;

        try {
            // instances own unsynchronized windowed state
            synchronized (b.instance()) {
                b.instance().handle(event);
            }
        } catch (Throwable e) {
            log.error("Virtual peripheral {} failed for event {}", b.definition().name(), event.eventType(), e);
        }
    }
}
