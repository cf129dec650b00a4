package org.foxesworld.glowframe.engine.peripheral.virtual;

import com.jme3.math.Vector3f;
import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylist;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylistManager;
import org.foxesworld.glowframe.engine.peripheral.playlist.PlaylistStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class VirtualPeripheralRegistryTest {

    private final EventBus bus = new EventBus();
    private final EventPlaylistManager playlists = new EventPlaylistManager(bus);
    private final VirtualPeripheralRegistry registry = new VirtualPeripheralRegistry(bus, playlists);

    @AfterEach
    void tearDown() {
        registry.close();
        playlists.close();
    }

    private static VirtualPeripheralDefinition echo(String name, String from, String to) {
        return new VirtualPeripheralDefinition(name, List.of(from),
                ctx -> event -> ctx.emit(to, event.data(), event.producerId()));
    }

    private List<Input> collect(String type) {
        List<Input> out = new CopyOnWriteArrayList<>();
        bus.subscribe(type, out::add);
        return out;
    }

    // ---------------- lifecycle ----------------

    @Test
    void derivedEventsCarryDescriptor() {
        VirtualPeripheralDefinition def = new VirtualPeripheralDefinition("echo", List.of("in"),
                ctx -> event -> ctx.emit("out", event.data(), event.producerId()), 0, Map.of("zone", "lobby"));
        VirtualPeripheralHandle handle = registry.register(def);
        List<Input> out = collect("out");

        bus.emit("in", 5, 3);

        assertEquals(1, out.size());
        Map<String, Object> payload = Payloads.asMap(out.get(0).data());
        assertEquals(5, payload.get("value"));
        Map<String, Object> descriptor = Payloads.asMap(payload.get(VirtualPeripheralContext.DESCRIPTOR_KEY));
        assertEquals(handle.id(), descriptor.get("id"));
        assertEquals("echo", descriptor.get("name"));
        assertEquals(Map.of("zone", "lobby"), descriptor.get("metadata"));
        assertEquals(3, out.get(0).producerId());
    }

    @Test
    void updateReplacesInstanceAndSubscriptions() {
        VirtualPeripheralHandle handle = registry.register(echo("echo", "a", "out"));
        List<Input> out = collect("out");

        registry.update(handle, echo("echo", "b", "out"));
        bus.emit("a", 1);
        bus.emit("b", 2);

        assertEquals(1, out.size());
        assertEquals(2, Payloads.asMap(out.get(0).data()).get("value"));
        assertEquals(0, bus.subscriberCount("a"));
        assertEquals("b", registry.definitions().get(handle.id()).eventTypes().get(0));
    }

    @Test
    void removeStopsRoutingAndShutsDown() {
        List<String> shutdowns = new ArrayList<>();
        VirtualPeripheralHandle handle = registry.register(new VirtualPeripheralDefinition("x", List.of("in"),
                ctx -> new VirtualPeripheral() {
                    @Override
                    public void handle(Input event) {
                        ctx.emit("out", event.data(), 0);
                    }

                    @Override
                    public void shutdown() {
                        shutdowns.add("x");
                    }
                }));
        List<Input> out = collect("out");

        registry.remove(handle);
        bus.emit("in", 1);

        assertTrue(out.isEmpty());
        assertEquals(List.of("x"), shutdowns);
        assertTrue(registry.definitions().isEmpty());
    }

    @Test
    void updateOfUnknownHandleFails() {
        assertThrows(NoSuchElementException.class,
                () -> registry.update(new VirtualPeripheralHandle("missing"), echo("e", "a", "b")));
    }

    @Test
    void faultyInstanceDoesNotAffectOthers() {
        registry.register(new VirtualPeripheralDefinition("broken", List.of("in"),
                ctx -> event -> { throw new IllegalStateException("broken"); }, 10, null));
        registry.register(echo("echo", "in", "out"));
        List<Input> out = collect("out");

        assertTrue(bus.emit("in", 1).ok());
        assertEquals(1, out.size());
    }

    @Test
    void instanceThrowingAnErrorIsIsolated() {
        registry.register(new VirtualPeripheralDefinition("asserting", List.of("in"),
                ctx -> event -> { throw new AssertionError("broken"); }, 10, null));
        registry.register(echo("echo", "in", "out"));
        List<Input> out = collect("out");

        assertTrue(bus.emit("in", 1).ok());
        assertEquals(1, out.size());
    }

    @Test
    void definitionRequiresEventTypes() {
        assertThrows(IllegalArgumentException.class,
                () -> new VirtualPeripheralDefinition("none", List.of(), ctx -> event -> {}));
    }

    // ---------------- calibration ----------------

    @Test
    void calibratedEventsKeepTypeAndProducerByDefault() {
        CalibrationProfile profile = new CalibrationProfile(new Vector3f(0, 0, 1), null, null, 2);
        registry.register(VirtualPeripherals.calibrated("accel.cal", Map.of("accel", profile))
                .passthrough("ts")
                .includeRawPayload(true)
                .build());
        List<Input> accel = collect("accel");

        bus.emit("accel", Map.of("x", 0.5, "y", 0.0, "z", 1.5, "ts", 42), 4);

        // calibrated event is dispatched ahead of its source and not calibrated again
        assertEquals(2, accel.size());
        Input calibrated = accel.get(0);
        Map<String, Object> payload = Payloads.asMap(calibrated.data());
        assertEquals(4, calibrated.producerId());
        assertEquals(0.5, payload.get("z"));
        assertEquals(42, payload.get("ts"));
        assertEquals(1.5, Payloads.asMap(payload.get("raw")).get("z"));
        assertNotNull(payload.get("calibration"));
        assertFalse(payload.containsKey("source_event"));
    }

    @Test
    void calibratedOutputTypeAndProducerOverride() {
        registry.register(VirtualPeripherals.calibrated("cal", Map.of("accel", CalibrationProfile.identity()))
                .outputEventType("accel.calibrated")
                .outputProducerId(100)
                .includeSourceEvent(true)
                .build());
        List<Input> out = collect("accel.calibrated");

        bus.emit("accel", Map.of("x", 1, "y", 2, "z", 3), 4);
        bus.emit("accel", "not a map", 4);
        bus.emit("accel", Map.of("x", 1), 4);

        assertEquals(1, out.size());
        assertEquals(100, out.get(0).producerId());
        assertEquals("accel", Payloads.asMap(Payloads.asMap(out.get(0).data()).get("source_event")).get("event_type"));
    }

    @Test
    void outputMappingMustCoverEveryType() {
        VirtualPeripherals.CalibratedBuilder b = VirtualPeripherals.calibrated("cal",
                Map.of("a", CalibrationProfile.identity(), "b", CalibrationProfile.identity()));

        assertThrows(IllegalArgumentException.class, () -> b.outputEventTypes(Map.of("a", "a.cal")));
    }

    // ---------------- gated playlist ----------------

    @Test
    void gatedPlaylistStartsOnPassingGate() throws Exception {
        EventPlaylist playlist = new EventPlaylist("flash", List.of(PlaylistStep.at(Duration.ZERO, "light", 1)));
        registry.register(VirtualPeripherals.gatedPlaylist(Set.of("button"), playlist));
        List<Input> created = collect(EventPlaylistManager.EVENT_CREATED);

        bus.emit("button", Map.of("pressed", true), 1);

        assertEquals(1, created.size());
        String runId = (String) Payloads.asMap(created.get(0).data()).get("playlist_id");
        assertTrue(playlists.join(runId, Duration.ofSeconds(5)));
    }

    @Test
    void gatedPlaylistPredicateFiltersAndCancelsPreviousRun() throws Exception {
        EventPlaylist playlist = new EventPlaylist("flash", List.of(PlaylistStep.at(Duration.ofSeconds(30), "light", 1)));
        registry.register(VirtualPeripherals.gatedPlaylist(Set.of("button"), playlist, GatePredicate.DEFAULT, true));
        List<Input> created = collect(EventPlaylistManager.EVENT_CREATED);
        List<Input> stopped = collect(EventPlaylistManager.EVENT_STOPPED);

        bus.emit("button", Map.of("pressed", false), 1);
        assertTrue(created.isEmpty());

        bus.emit("button", Map.of("pressed", true), 1);
        String first = (String) Payloads.asMap(created.get(0).data()).get("playlist_id");
        bus.emit("button", Map.of("pressed", true), 1);

        assertEquals(2, created.size());
        assertTrue(playlists.join(first, Duration.ofSeconds(5)));
        Map<String, Object> firstStopped = Payloads.asMap(stopped.get(0).data());
        assertEquals(first, firstStopped.get("playlist_id"));
        assertEquals("cancelled", firstStopped.get("reason"));
    }

    @Test
    void gatedPlaylistRejectsTriggeredPlaylist() {
        EventPlaylist playlist = new EventPlaylist("flash", List.of(PlaylistStep.at(Duration.ZERO, "light", 1)))
                .withTrigger("door");
        assertThrows(IllegalArgumentException.class,
                () -> VirtualPeripherals.gatedPlaylist(Set.of("button"), playlist));
    }

    @Test
    void removingGatedPlaylistDropsDefinition() {
        EventPlaylist playlist = new EventPlaylist("flash", List.of(PlaylistStep.at(Duration.ZERO, "light", 1)));
        VirtualPeripheralHandle handle = registry.register(VirtualPeripherals.gatedPlaylist(Set.of("button"), playlist));
        assertEquals(1, playlists.definitions().size());

        registry.remove(handle);

        assertTrue(playlists.definitions().isEmpty());
    }
}
