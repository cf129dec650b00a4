package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylist;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylistManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ready-made virtual peripheral definitions.
 */
public final class VirtualPeripherals {

    public static final Duration DEFAULT_DOUBLE_TAP_WINDOW = Duration.ofMillis(300);
    public static final Duration DEFAULT_SIMULTANEOUS_WINDOW = Duration.ofMillis(10);
    public static final Duration DEFAULT_SEQUENCE_TIMEOUT = Duration.ofSeconds(1);
    public static final int DEFAULT_PRIORITY = 50;

    private VirtualPeripherals() {}

    // ---------------- double tap ----------------

    public static VirtualPeripheralDefinition doubleTap(String sourceEventType, String outputEventType) {
        return doubleTap(sourceEventType, outputEventType, DEFAULT_DOUBLE_TAP_WINDOW);
    }

    /** Named {@code <source>.double_tap}. */
    public static VirtualPeripheralDefinition doubleTap(String sourceEventType, String outputEventType, Duration window) {
        Objects.requireNonNull(sourceEventType, "sourceEventType");
        Objects.requireNonNull(outputEventType, "outputEventType");
        long windowNanos = window.toNanos();
        return new VirtualPeripheralDefinition(
                sourceEventType + ".double_tap",
                List.of(sourceEventType),
                ctx -> new DoubleTapPeripheral(ctx, windowNanos, outputEventType),
                DEFAULT_PRIORITY,
                null);
    }

    // ---------------- simultaneous ----------------

    public static VirtualPeripheralDefinition simultaneous(String eventType, String outputEventType) {
        return simultaneous(eventType, outputEventType, DEFAULT_SIMULTANEOUS_WINDOW, 2);
    }

    /** Named {@code <type>.simultaneous}. Derived events use producer 0. */
    public static VirtualPeripheralDefinition simultaneous(String eventType, String outputEventType,
                                                           Duration window, int requiredSources) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(outputEventType, "outputEventType");
        if (requiredSources < 2) throw new IllegalArgumentException("requiredSources must be at least 2");
        long windowNanos = window.toNanos();
        return new VirtualPeripheralDefinition(
                eventType + ".simultaneous",
                List.of(eventType),
                ctx -> new SimultaneousPeripheral(ctx, windowNanos, requiredSources, outputEventType),
                DEFAULT_PRIORITY,
                null);
    }

    // ---------------- sequence ----------------

    public static VirtualPeripheralDefinition sequence(String name, List<SequenceMatcher> matchers, String outputEventType) {
        return sequence(name, matchers, outputEventType, DEFAULT_SEQUENCE_TIMEOUT);
    }

    /**
     * @param timeout max gap between steps of one producer; null for no timeout
     */
    public static VirtualPeripheralDefinition sequence(String name, List<SequenceMatcher> matchers,
                                                       String outputEventType, Duration timeout) {
        Objects.requireNonNull(outputEventType, "outputEventType");
        if (matchers == null || matchers.isEmpty()) throw new IllegalArgumentException("matchers must not be empty");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive when provided");
        }
        List<SequenceMatcher> steps = List.copyOf(matchers);
        List<String> types = new ArrayList<>();
        for (SequenceMatcher m : steps) types.add(m.eventType());
        long timeoutNanos = (timeout == null) ? 0L : timeout.toNanos();
        return new VirtualPeripheralDefinition(
                name,
                types,
                ctx -> new SequencePeripheral(ctx, steps, timeoutNanos, outputEventType),
                DEFAULT_PRIORITY,
                null);
    }

    // ---------------- gates ----------------

    public static VirtualPeripheralDefinition gatedMirror(String name, Set<String> gateEventTypes,
                                                          Set<String> mirrorEventTypes, int outputProducerId) {
        return gatedMirror(name, gateEventTypes, mirrorEventTypes, outputProducerId, GatePredicate.DEFAULT, false);
    }

    /**
     * @param predicate decides from each gate event whether mirroring is on; null uses {@link GatePredicate#DEFAULT}
     */
    public static VirtualPeripheralDefinition gatedMirror(String name, Set<String> gateEventTypes,
                                                          Set<String> mirrorEventTypes, int outputProducerId,
                                                          GatePredicate predicate, boolean initialState) {
        Set<String> gates = requireTypes(gateEventTypes, "gateEventTypes");
        Set<String> mirrored = requireTypes(mirrorEventTypes, "mirrorEventTypes");
        GatePredicate p = (predicate != null) ? predicate : GatePredicate.DEFAULT;

        Set<String> all = new LinkedHashSet<>(gates);
        all.addAll(mirrored);
        return new VirtualPeripheralDefinition(
                name,
                new ArrayList<>(all),
                ctx -> new GatedMirrorPeripheral(ctx, gates, mirrored, outputProducerId, p, initialState),
                0,
                null);
    }

    public static VirtualPeripheralDefinition gatedPlaylist(Set<String> gateEventTypes, EventPlaylist playlist) {
        return gatedPlaylist(gateEventTypes, playlist, null, false);
    }

    /**
     * Named {@code <playlist>.gated}. Requires a registry bound to an {@link EventPlaylistManager};
     * the playlist itself must have no trigger type.
     *
     * @param predicate null starts on every gate event
     */
    public static VirtualPeripheralDefinition gatedPlaylist(Set<String> gateEventTypes, EventPlaylist playlist,
                                                            GatePredicate predicate, boolean cancelActiveRuns) {
        Set<String> gates = requireTypes(gateEventTypes, "gateEventTypes");
        Objects.requireNonNull(playlist, "playlist");
        if (playlist.triggerEventType() != null) {
            throw new IllegalArgumentException("playlist trigger event type must be null for gated playlists");
        }
        Set<String> all = new LinkedHashSet<>(gates);
        all.add(EventPlaylistManager.EVENT_STOPPED);
        return new VirtualPeripheralDefinition(
                playlist.name() + ".gated",
                new ArrayList<>(all),
                ctx -> new PlaylistTriggerPeripheral(ctx, gates, playlist, predicate, cancelActiveRuns),
                DEFAULT_PRIORITY,
                null);
    }

    // ---------------- calibration ----------------

    public static CalibratedBuilder calibrated(String name, Map<String, CalibrationProfile> calibrations) {
        return new CalibratedBuilder(name, calibrations);
    }

    /**
     * Options of a calibration peripheral. By default calibrated events keep the source type and
     * producer.
     */
    public static final class CalibratedBuilder {
        private final String name;
        private final Map<String, CalibrationProfile> calibrations;
        private final Map<String, String> outputEventTypes = new LinkedHashMap<>();
        private final Map<String, List<String>> passthrough = new LinkedHashMap<>();
        private Integer outputProducerId;
        private boolean includeSourceEvent;
        private boolean includeRawPayload;
        private int priority;
        private Map<String, Object> metadata;

        private CalibratedBuilder(String name, Map<String, CalibrationProfile> calibrations) {
            this.name = Objects.requireNonNull(name, "name");
            if (calibrations == null || calibrations.isEmpty()) {
                throw new IllegalArgumentException("calibrations must not be empty");
            }
            this.calibrations = new LinkedHashMap<>(calibrations);
        }

        /** Same output type for every source type. */
        public CalibratedBuilder outputEventType(String type) {
            for (String source : calibrations.keySet()) outputEventTypes.put(source, type);
            return this;
        }

        /** @throws IllegalArgumentException unless every calibrated type is mapped */
        public CalibratedBuilder outputEventTypes(Map<String, String> bySource) {
            Set<String> missing = new LinkedHashSet<>(calibrations.keySet());
            missing.removeAll(bySource.keySet());
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("Missing output event type mapping for: " + missing);
            }
            outputEventTypes.putAll(bySource);
            return this;
        }

        public CalibratedBuilder outputProducerId(int producerId) {
            this.outputProducerId = producerId;
            return this;
        }

        /** Fields copied unchanged from every source payload. */
        public CalibratedBuilder passthrough(String... fields) {
            for (String source : calibrations.keySet()) passthrough.put(source, List.of(fields));
            return this;
        }

        public CalibratedBuilder passthrough(String sourceEventType, List<String> fields) {
            passthrough.put(sourceEventType, List.copyOf(fields));
            return this;
        }

        public CalibratedBuilder includeSourceEvent(boolean include) {
            this.includeSourceEvent = include;
            return this;
        }

        public CalibratedBuilder includeRawPayload(boolean include) {
            this.includeRawPayload = include;
            return this;
        }

        public CalibratedBuilder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public CalibratedBuilder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public VirtualPeripheralDefinition build() {
            Map<String, CalibrationProfile> profiles = Map.copyOf(calibrations);
            Map<String, String> outputs = new LinkedHashMap<>();
            for (String source : calibrations.keySet()) outputs.put(source, outputEventTypes.getOrDefault(source, source));
            Map<String, List<String>> fields = Map.copyOf(passthrough);
            Integer producer = outputProducerId;
            boolean source = includeSourceEvent;
            boolean raw = includeRawPayload;

            return new VirtualPeripheralDefinition(
                    name,
                    new ArrayList<>(calibrations.keySet()),
                    ctx -> new CalibratedPeripheral(ctx, profiles, outputs, producer, fields, source, raw),
                    priority,
                    metadata);
        }
    }

    private static Set<String> requireTypes(Set<String> types, String what) {
        if (types == null || types.isEmpty()) throw new IllegalArgumentException(what + " must not be empty");
        return Set.copyOf(types);
    }
}
