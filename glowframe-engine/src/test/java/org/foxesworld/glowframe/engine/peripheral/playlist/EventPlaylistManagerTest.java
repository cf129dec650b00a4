package org.foxesworld.glowframe.engine.peripheral.playlist;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EventPlaylistManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final EventBus bus = new EventBus();
    private final EventPlaylistManager manager = new EventPlaylistManager(bus);
    private final List<Input> seen = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private void record(String... types) {
        for (String t : types) bus.subscribe(t, seen::add);
    }

    private List<Input> ofType(String type) {
        return seen.stream().filter(e -> e.eventType().equals(type)).toList();
    }

    private static Map<String, Object> data(Input e) {
        return Payloads.asMap(e.data());
    }

    @Test
    void runPlaysStepsInOffsetOrderAndCompletes() throws Exception {
        EventPlaylist playlist = new EventPlaylist("intro", List.of(
                PlaylistStep.at(Duration.ofMillis(20), "light", Map.of("n", 2)),
                PlaylistStep.at(Duration.ZERO, "light", Map.of("n", 1)).withProducer(7),
                PlaylistStep.repeated(Duration.ofMillis(30), "beep", null, 2, Duration.ofMillis(10))))
                .withCompletion("intro.done")
                .withMetadata(Map.of("scene", "a"));
        record("light", "beep", "intro.done",
                EventPlaylistManager.EVENT_CREATED, EventPlaylistManager.EVENT_EMITTED, EventPlaylistManager.EVENT_STOPPED);

        PlaylistHandle handle = manager.register(playlist);
        String runId = manager.start(handle);

        assertTrue(manager.join(runId, WAIT));

        List<Input> lights = ofType("light");
        assertEquals(List.of(1, 2), lights.stream().map(e -> data(e).get("n")).toList());
        assertEquals(7, lights.get(0).producerId());
        assertEquals(2, ofType("beep").size());
        assertEquals(4, ofType(EventPlaylistManager.EVENT_EMITTED).size());

        Input created = ofType(EventPlaylistManager.EVENT_CREATED).get(0);
        assertEquals(runId, data(created).get("playlist_id"));
        assertEquals(handle.id(), data(created).get("definition_id"));
        assertEquals(Map.of("scene", "a"), data(created).get("playlist_metadata"));
        assertEquals(3, ((List<?>) data(created).get("steps")).size());

        Input stopped = ofType(EventPlaylistManager.EVENT_STOPPED).get(0);
        assertEquals("completed", data(stopped).get("reason"));
        assertEquals(1, ofType("intro.done").size());
        assertTrue(manager.activeRuns().isEmpty());
    }

    @Test
    void emittedTelemetryDescribesRepeats() throws Exception {
        EventPlaylist playlist = new EventPlaylist("pulse", List.of(
                PlaylistStep.repeated(Duration.ZERO, "beep", 1, 3, Duration.ofMillis(5))));
        record(EventPlaylistManager.EVENT_EMITTED);

        String runId = manager.start(manager.register(playlist));
        assertTrue(manager.join(runId, WAIT));

        List<Input> emitted = ofType(EventPlaylistManager.EVENT_EMITTED);
        assertEquals(List.of(0, 1, 2), emitted.stream().map(e -> data(e).get("repeat_index")).toList());
        assertEquals(0.01, (Double) data(emitted.get(2)).get("offset"), 1e-9);
        assertEquals("beep", data(emitted.get(0)).get("event_type"));
    }

    @Test
    void stopCancelsRunWithoutCompletionEvent() throws Exception {
        EventPlaylist playlist = new EventPlaylist("long", List.of(
                PlaylistStep.at(Duration.ZERO, "light", 1),
                PlaylistStep.at(Duration.ofSeconds(30), "light", 2))).withCompletion("long.done");
        record("light", "long.done", EventPlaylistManager.EVENT_STOPPED);

        String runId = manager.start(manager.register(playlist));
        manager.stop(runId);

        assertTrue(manager.join(runId, WAIT));
        assertEquals("cancelled", data(ofType(EventPlaylistManager.EVENT_STOPPED).get(0)).get("reason"));
        assertTrue(ofType("long.done").isEmpty());
        assertTrue(ofType("light").size() <= 1);
    }

    @Test
    void interruptEventStopsRun() throws Exception {
        EventPlaylist playlist = new EventPlaylist("long", List.of(
                PlaylistStep.at(Duration.ofSeconds(30), "light", 1))).withInterrupts(Set.of("panic"));
        record(EventPlaylistManager.EVENT_STOPPED);

        String runId = manager.start(manager.register(playlist));
        bus.emit("panic", Map.of("source", "button"), 3);

        assertTrue(manager.join(runId, WAIT));
        Map<String, Object> stopped = data(ofType(EventPlaylistManager.EVENT_STOPPED).get(0));
        assertEquals("interrupted", stopped.get("reason"));
        assertEquals("panic", Payloads.asMap(stopped.get("interrupt_event")).get("event_type"));
        assertEquals(0, bus.subscriberCount("panic"));
    }

    @Test
    void triggerTypeStartsRunsAndIsEchoed() throws Exception {
        EventPlaylist playlist = new EventPlaylist("greet", List.of(PlaylistStep.at(Duration.ZERO, "light", 1)))
                .withTrigger("door.open");
        record(EventPlaylistManager.EVENT_CREATED);

        manager.register(playlist);
        bus.emit("door.open", Map.of("door", "front"), 2);

        // created is dispatched on the emitting thread
        Map<String, Object> created = data(ofType(EventPlaylistManager.EVENT_CREATED).get(0));
        Map<String, Object> trigger = Payloads.asMap(created.get("trigger_event"));
        assertEquals("door.open", trigger.get("event_type"));
        assertEquals(2, trigger.get("producer_id"));
        assertTrue(manager.join((String) created.get("playlist_id"), WAIT));
    }

    @Test
    void removedPlaylistNoLongerTriggers() {
        EventPlaylist playlist = new EventPlaylist("greet", List.of(PlaylistStep.at(Duration.ZERO, "light", 1)))
                .withTrigger("door.open");
        PlaylistHandle handle = manager.register(playlist);

        manager.remove(handle);

        assertEquals(0, bus.subscriberCount("door.open"));
        assertThrows(NoSuchElementException.class, () -> manager.start(handle));
        assertThrows(NoSuchElementException.class, () -> manager.update(handle, playlist));
    }

    @Test
    void updateRebindsTrigger() {
        EventPlaylist playlist = new EventPlaylist("greet", List.of(PlaylistStep.at(Duration.ZERO, "light", 1)))
                .withTrigger("door.open");
        PlaylistHandle handle = manager.register(playlist);

        manager.update(handle, playlist.withTrigger("door.close"));

        assertEquals(0, bus.subscriberCount("door.open"));
        assertEquals(1, bus.subscriberCount("door.close"));
        assertEquals("door.close", manager.definitions().get(handle.id()).triggerEventType());
    }

    @Test
    void stepValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> PlaylistStep.at(Duration.ofMillis(-1), "x", null));
        assertThrows(IllegalArgumentException.class,
                () -> PlaylistStep.repeated(Duration.ZERO, "x", null, 0, Duration.ofMillis(1)));
        assertThrows(IllegalArgumentException.class,
                () -> PlaylistStep.repeated(Duration.ZERO, "x", null, 2, null));
        assertThrows(IllegalArgumentException.class, () -> new EventPlaylist("empty", List.of()));
        assertEquals(Duration.ZERO, PlaylistStep.at(null, "x", null).offset());
    }

    @Test
    void unknownRunIsIgnored() throws Exception {
        manager.stop("nope");
        assertTrue(manager.join("nope", Duration.ofMillis(1)));
    }
}
