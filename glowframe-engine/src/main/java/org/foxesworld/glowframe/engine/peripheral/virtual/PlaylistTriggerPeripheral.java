package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylist;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylistManager;
import org.foxesworld.glowframe.engine.peripheral.playlist.PlaylistHandle;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Starts a playlist whenever a gate event passes the predicate. Tracks its own runs through
 * {@code event.playlist.stopped} so it can cancel them on the next trigger or on shutdown.
 */
final class PlaylistTriggerPeripheral implements VirtualPeripheral {

    private static final Logger log = LogManager.getLogger(PlaylistTriggerPeripheral.class);

    private final VirtualPeripheralContext ctx;
    private final Set<String> gateEventTypes;
    private final GatePredicate predicate;
    private final boolean cancelActiveRuns;
    private final PlaylistHandle playlist;
    private final Set<String> activeRuns = new LinkedHashSet<>();

    /**
     * @param predicate may be null to start on every gate event
     */
    PlaylistTriggerPeripheral(VirtualPeripheralContext ctx,
                              Set<String> gateEventTypes,
                              EventPlaylist playlist,
                              GatePredicate predicate,
                              boolean cancelActiveRuns) {
        if (gateEventTypes.isEmpty()) throw new IllegalArgumentException("gateEventTypes must not be empty");
        if (playlist.triggerEventType() != null) {
            throw new IllegalArgumentException("playlist trigger event type must be null for gated playlists");
        }
        this.ctx = ctx;
        this.gateEventTypes = Set.copyOf(gateEventTypes);
        this.predicate = predicate;
        this.cancelActiveRuns = cancelActiveRuns;
        this.playlist = ctx.playlists().register(playlist);
    }

    @Override
    public void handle(Input event) {
        if (EventPlaylistManager.EVENT_STOPPED.equals(event.eventType())) {
            Map<String, Object> data = Payloads.asMap(event.data());
            if (playlist.id().equals(data.get("definition_id"))) {
                activeRuns.remove(String.valueOf(data.get("playlist_id")));
            }
            return;
        }
        if (!gateEventTypes.contains(event.eventType())) return;

        if (predicate != null) {
            try {
                if (!predicate.test(ctx, event)) return;
            } catch (RuntimeException e) {
                log.error("Virtual peripheral {} failed to evaluate gate predicate", ctx.definition().name(), e);
                return;
            }
        }

        if (cancelActiveRuns) {
            for (String runId : Set.copyOf(activeRuns)) ctx.playlists().stop(runId);
        }
        activeRuns.add(ctx.playlists().start(playlist, event));
    }

    @Override
    public void shutdown() {
        for (String runId : Set.copyOf(activeRuns)) ctx.playlists().stop(runId);
        activeRuns.clear();
        ctx.playlists().remove(playlist);
    }

    PlaylistHandle playlist() {
        return playlist;
    }
}
