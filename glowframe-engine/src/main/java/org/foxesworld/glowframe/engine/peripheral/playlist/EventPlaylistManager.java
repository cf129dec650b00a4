package org.foxesworld.glowframe.engine.peripheral.playlist;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.bus.Subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registers playlists and plays them on the bus.
 *
 * <p>Every run plays on its own daemon thread. Steps are ordered by offset, then by declaration
 * order; a repeated step emits at {@code offset + k * interval}. Each emitted step is followed by
 * an {@code event.playlist.emitted} telemetry event. A run ends exactly once, with
 * {@code event.playlist.stopped} carrying the {@link StopReason}; it stays listed in
 * {@link #activeRuns()} until its lifecycle events have been dispatched.</p>
 */
public final class EventPlaylistManager implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(EventPlaylistManager.class);

    public static final String EVENT_CREATED = "event.playlist.created";
    public static final String EVENT_EMITTED = "event.playlist.emitted";
    public static final String EVENT_STOPPED = "event.playlist.stopped";

    /** Trigger and interrupt subscriptions run ahead of ordinary handlers. */
    static final int CONTROL_PRIORITY = 100;

    private final EventBus bus;
    private final Object lock = new Object();

    // guarded by lock
    private final Map<String, EventPlaylist> playlists = new LinkedHashMap<>();
    private final Map<String, Subscription> triggers = new HashMap<>();
    private final Map<String, Subscription> interruptSubscriptions = new HashMap<>();
    private final Map<String, Set<String>> runsByInterrupt = new HashMap<>();
    private final Map<String, PlaylistRun> activeRuns = new LinkedHashMap<>();

    public EventPlaylistManager(EventBus bus) {
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    // ---------------- definitions ----------------

    public PlaylistHandle register(EventPlaylist playlist) {
        Objects.requireNonNull(playlist, "playlist");
        PlaylistHandle handle = new PlaylistHandle(newId());
        synchronized (lock) {
            playlists.put(handle.id(), playlist);
        }
        bindTrigger(handle.id(), playlist);
        log.debug("Playlist registered: {} ({})", playlist.name(), handle.id());
        return handle;
    }

    /** Replace the definition behind {@code handle}. Runs already playing keep the old one. */
    public void update(PlaylistHandle handle, EventPlaylist playlist) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(playlist, "playlist");
        Subscription previous;
        synchronized (lock) {
            if (!playlists.containsKey(handle.id())) {
                throw new NoSuchElementException("Unknown playlist id: " + handle.id());
            }
            playlists.put(handle.id(), playlist);
            previous = triggers.remove(handle.id());
        }
        bus.unsubscribe(previous);
        bindTrigger(handle.id(), playlist);
    }

    public void remove(PlaylistHandle handle) {
        if (handle == null) return;
        Subscription trigger;
        synchronized (lock) {
            playlists.remove(handle.id());
            trigger = triggers.remove(handle.id());
        }
        bus.unsubscribe(trigger);
    }

    /** @return read-only copy of id to definition */
    public Map<String, EventPlaylist> definitions() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(playlists));
        }
    }

    private void bindTrigger(String id, EventPlaylist playlist) {
        if (playlist.triggerEventType() == null) return;
        Subscription s = bus.subscribe(playlist.triggerEventType(), e -> start(id, e), CONTROL_PRIORITY);
        synchronized (lock) {
            if (playlists.containsKey(id)) {
                triggers.put(id, s);
                return;
            }
        }
        // removed concurrently
        bus.unsubscribe(s);
    }

    // ---------------- runs ----------------

    public String start(PlaylistHandle handle) {
        return start(Objects.requireNonNull(handle, "handle").id(), null);
    }

    public String start(PlaylistHandle handle, Input triggerEvent) {
        return start(Objects.requireNonNull(handle, "handle").id(), triggerEvent);
    }

    /**
     * Start a run of a registered playlist.
     *
     * @param triggerEvent event that caused the run, echoed in lifecycle payloads; may be null
     * @return run id
     * @throws NoSuchElementException if the playlist is not registered
     */
    public String start(String playlistId, Input triggerEvent) {
        Objects.requireNonNull(playlistId, "playlistId");
        EventPlaylist playlist;
        synchronized (lock) {
            playlist = playlists.get(playlistId);
        }
        if (playlist == null) throw new NoSuchElementException("Unknown playlist id: " + playlistId);

        PlaylistRun run = new PlaylistRun(playlistId, playlist, triggerEvent);
        synchronized (lock) {
            activeRuns.put(run.runId, run);
            for (String type : playlist.interruptEvents()) {
                runsByInterrupt.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(run.runId);
                if (!interruptSubscriptions.containsKey(type)) {
                    interruptSubscriptions.put(type, bus.subscribe(type, e -> interrupt(type, e), CONTROL_PRIORITY));
                }
            }
        }

        bus.emit(EVENT_CREATED, createdPayload(run), 0);
        run.thread.start();
        log.debug("Playlist {} started run {}", playlist.name(), run.runId);
        return run.runId;
    }

    /** Cancel a run. Unknown or finished runs are ignored. */
    public void stop(String runId) {
        PlaylistRun run = activeRun(runId);
        if (run != null) run.requestStop(StopReason.CANCELLED, null);
    }

    /**
     * Wait for a run to finish.
     *
     * @return true if the run is finished (or unknown)
     */
    public boolean join(String runId, Duration timeout) throws InterruptedException {
        PlaylistRun run = activeRun(runId);
        if (run == null) return true;
        return run.finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public Set<String> activeRuns() {
        synchronized (lock) {
            return Set.copyOf(activeRuns.keySet());
        }
    }

    /** Cancel every run and drop every definition. */
    @Override
    public void close() {
        List<PlaylistRun> runs;
        List<Subscription> subs;
        synchronized (lock) {
            runs = new ArrayList<>(activeRuns.values());
            subs = new ArrayList<>(triggers.values());
            triggers.clear();
            playlists.clear();
        }
        for (Subscription s : subs) bus.unsubscribe(s);
        for (PlaylistRun r : runs) r.requestStop(StopReason.CANCELLED, null);
    }

    private PlaylistRun activeRun(String runId) {
        if (runId == null) return null;
        synchronized (lock) {
            return activeRuns.get(runId);
        }
    }

    private void interrupt(String eventType, Input event) {
        List<PlaylistRun> runs = new ArrayList<>();
        synchronized (lock) {
            for (String id : runsByInterrupt.getOrDefault(eventType, Set.of())) {
                PlaylistRun r = activeRuns.get(id);
                if (r != null) runs.add(r);
            }
        }
        for (PlaylistRun r : runs) r.requestStop(StopReason.INTERRUPTED, event);
    }

    // ---------------- callbacks from run threads ----------------

    private void dispatchStep(PlaylistRun run, PlaylistStep step, int stepIndex, int repeatIndex, long offsetNanos) {
        bus.emit(new Input(step.eventType(), step.data(), step.producerId(), null));

        Map<String, Object> payload = basePayload(run);
        payload.put("step_index", stepIndex);
        payload.put("repeat_index", repeatIndex);
        payload.put("event_type", step.eventType());
        payload.put("producer_id", step.producerId());
        payload.put("offset", offsetNanos / 1_000_000_000.0);
        payload.put("data", step.data());
        addTrigger(payload, run.triggerEvent);
        bus.emit(EVENT_EMITTED, payload, 0);
    }

    private void finish(PlaylistRun run, StopReason reason, Input interruptEvent) {
        List<Subscription> released = new ArrayList<>();
        synchronized (lock) {
            for (String type : run.playlist.interruptEvents()) {
                Set<String> ids = runsByInterrupt.get(type);
                if (ids == null) continue;
                ids.remove(run.runId);
                if (ids.isEmpty()) {
                    runsByInterrupt.remove(type);
                    Subscription s = interruptSubscriptions.remove(type);
                    if (s != null) released.add(s);
                }
            }
        }
        for (Subscription s : released) bus.unsubscribe(s);

        Map<String, Object> stopped = basePayload(run);
        stopped.put("reason", reason.wireName());
        if (interruptEvent != null) stopped.put("interrupt_event", brief(interruptEvent));
        bus.emit(EVENT_STOPPED, stopped, 0);

        if (reason == StopReason.COMPLETED && run.playlist.completionEventType() != null) {
            Map<String, Object> done = basePayload(run);
            addTrigger(done, run.triggerEvent);
            bus.emit(run.playlist.completionEventType(), done, 0);
        }
        log.debug("Playlist {} run {} stopped: {}", run.playlist.name(), run.runId, reason.wireName());
    }

    private void retire(PlaylistRun run) {
        synchronized (lock) {
            activeRuns.remove(run.runId);
        }
    }

    // ---------------- payloads ----------------

    private Map<String, Object> createdPayload(PlaylistRun run) {
        Map<String, Object> payload = basePayload(run);
        List<Object> steps = new ArrayList<>(run.playlist.steps().size());
        for (PlaylistStep step : run.playlist.steps()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("event_type", step.eventType());
            s.put("offset", seconds(step.offset()));
            s.put("repeat", step.repeat());
            s.put("interval", step.interval() == null ? null : seconds(step.interval()));
            s.put("producer_id", step.producerId());
            s.put("data", step.data());
            steps.add(s);
        }
        payload.put("steps", steps);
        addTrigger(payload, run.triggerEvent);
        return payload;
    }

    private static Map<String, Object> basePayload(PlaylistRun run) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playlist_id", run.runId);
        payload.put("definition_id", run.definitionId);
        payload.put("playlist_name", run.playlist.name());
        if (run.playlist.metadata() != null) payload.put("playlist_metadata", run.playlist.metadata());
        return payload;
    }

    private static void addTrigger(Map<String, Object> payload, Input trigger) {
        if (trigger != null) payload.put("trigger_event", brief(trigger));
    }

    private static Map<String, Object> brief(Input event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("event_type", event.eventType());
        out.put("producer_id", event.producerId());
        out.put("data", event.data());
        return out;
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * One playback of a playlist on a dedicated daemon thread.
     */
    private final class PlaylistRun {

        private record Ordered(int index, PlaylistStep step) {}

        final String runId = newId();
        final String definitionId;
        final EventPlaylist playlist;
        final Input triggerEvent;
        final Thread thread;

        final CountDownLatch stopSignal = new CountDownLatch(1);
        final CountDownLatch finished = new CountDownLatch(1);
        final AtomicReference<StopReason> stopReason = new AtomicReference<>();
        volatile Input interruptEvent;

        PlaylistRun(String definitionId, EventPlaylist playlist, Input triggerEvent) {
            this.definitionId = definitionId;
            this.playlist = playlist;
            this.triggerEvent = triggerEvent;
            this.thread = new Thread(this::play, "glowframe-playlist-" + playlist.name() + "-" + runId.substring(0, 8));
            this.thread.setDaemon(true);
        }

        void requestStop(StopReason reason, Input interrupt) {
            if (finished.getCount() == 0) return;
            if (stopReason.compareAndSet(null, reason)) {
                interruptEvent = interrupt;
                stopSignal.countDown();
            }
        }

        private boolean stopped() {
            return stopSignal.getCount() == 0;
        }

        /** @return false when a stop was requested before the deadline */
        private boolean waitUntil(long deadlineNanos) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) return !stopped();
            try {
                return !stopSignal.await(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopReason.compareAndSet(null, StopReason.CANCELLED);
                return false;
            }
        }

        private void play() {
            List<Ordered> ordered = new ArrayList<>(playlist.steps().size());
            for (int i = 0; i < playlist.steps().size(); i++) ordered.add(new Ordered(i, playlist.steps().get(i)));
            ordered.sort(Comparator.comparing((Ordered o) -> o.step().offset()).thenComparingInt(Ordered::index));

            long start = System.nanoTime();
            try {
                outer:
                for (Ordered o : ordered) {
                    PlaylistStep step = o.step();
                    long scheduled = start + step.offset().toNanos();
                    if (!waitUntil(scheduled)) break;

                    for (int k = 0; k < step.repeat(); k++) {
                        if (k > 0) {
                            scheduled += step.interval().toNanos();
                            if (!waitUntil(scheduled)) break outer;
                        }
                        if (stopped()) break outer;
                        dispatchStep(this, step, o.index(), k, Math.max(0L, scheduled - start));
                    }
                }
            } catch (RuntimeException e) {
                log.error("Playlist {} run {} failed", playlist.name(), runId, e);
                stopReason.compareAndSet(null, StopReason.CANCELLED);
            } finally {
                StopReason reason = stopReason.get();
                try {
                    finish(this, reason != null ? reason : StopReason.COMPLETED, interruptEvent);
                } finally {
                    finished.countDown();
                    retire(this);
                }
            }
        }
    }
}
