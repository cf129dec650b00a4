package org.foxesworld.glowframe.engine.peripheral.playlist;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, named list of timed steps.
 *
 * @param triggerEventType    starts a run whenever this type is emitted; may be null
 * @param interruptEvents     any of these types stops a running instance
 * @param completionEventType emitted after a run completes normally; may be null
 * @param metadata            copied into lifecycle payloads; may be null
 */
public record EventPlaylist(
        String name,
        List<PlaylistStep> steps,
        String triggerEventType,
        Set<String> interruptEvents,
        String completionEventType,
        Map<String, Object> metadata
) {

    public EventPlaylist {
        Objects.requireNonNull(name, "name");
        if (steps == null || steps.isEmpty()) throw new IllegalArgumentException("EventPlaylist requires at least one step");
        steps = List.copyOf(steps);
        interruptEvents = (interruptEvents == null) ? Set.of() : Set.copyOf(new LinkedHashSet<>(interruptEvents));
        metadata = (metadata == null) ? null : Map.copyOf(metadata);
    }

    public EventPlaylist(String name, List<PlaylistStep> steps) {
        this(name, steps, null, Set.of(), null, null);
    }

    public EventPlaylist withTrigger(String triggerEventType) {
        return new EventPlaylist(name, steps, triggerEventType, interruptEvents, completionEventType, metadata);
    }

    public EventPlaylist withInterrupts(Set<String> interruptEvents) {
        return new EventPlaylist(name, steps, triggerEventType, interruptEvents, completionEventType, metadata);
    }

    public EventPlaylist withCompletion(String completionEventType) {
        return new EventPlaylist(name, steps, triggerEventType, interruptEvents, completionEventType, metadata);
    }

    public EventPlaylist withMetadata(Map<String, Object> metadata) {
        return new EventPlaylist(name, steps, triggerEventType, interruptEvents, completionEventType, metadata);
    }
}
