package org.foxesworld.glowframe.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.core.GlowframePlatform;
import org.foxesworld.glowframe.core.GlowframeVersion;
import org.foxesworld.glowframe.core.SettingsReader;
import org.foxesworld.glowframe.engine.loop.FrameSink;
import org.foxesworld.glowframe.engine.loop.PacingSettings;
import org.foxesworld.glowframe.engine.loop.RenderLoop;
import org.foxesworld.glowframe.engine.peripheral.PeripheralManager;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.bus.StateStore;
import org.foxesworld.glowframe.engine.peripheral.playlist.EventPlaylistManager;
import org.foxesworld.glowframe.engine.peripheral.virtual.VirtualPeripheralRegistry;
import org.foxesworld.glowframe.engine.perf.FrameProfiler;
import org.foxesworld.glowframe.engine.render.Orientation;
import org.foxesworld.glowframe.engine.render.RenderContext;
import org.foxesworld.glowframe.engine.render.RenderSettings;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.pipeline.RenderPipeline;
import org.foxesworld.glowframe.engine.render.surface.SurfaceSize;
import org.foxesworld.glowframe.engine.render.timing.RendererTimingTracker;
import org.foxesworld.glowframe.engine.render.timing.TimingSettings;
import org.foxesworld.glowframe.engine.stream.StreamShareSettings;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the bus, peripherals, render pipeline and loop from one set of settings.
 *
 * <p>Physical peripherals post into the bus queue from their own threads; the loop drains the
 * queue at the start of every frame, so handlers and renderers see events on the loop thread.</p>
 */
public final class GlowframeRuntime implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(GlowframeRuntime.class);

    private final StreamShareSettings streamSettings;
    private final EventBus bus;
    private final EventPlaylistManager playlists;
    private final VirtualPeripheralRegistry virtualPeripherals;
    private final PeripheralManager peripherals;
    private final RenderPipeline pipeline;
    private final RenderLoop loop;
    private final List<Renderer> renderers = new CopyOnWriteArrayList<>();

    public GlowframeRuntime(SurfaceSize window, Orientation orientation, FrameSink sink) {
        this(SettingsReader.system(), window, orientation, sink);
    }

    public GlowframeRuntime(SettingsReader settings, SurfaceSize window, Orientation orientation, FrameSink sink) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(sink, "sink");

        log.info("{} {}", GlowframeVersion.NAME, GlowframeVersion.VERSION);
        log.info("Java: {}", GlowframePlatform.java());
        log.info("OS: {}", GlowframePlatform.os());

        // fail fast on every setting before anything starts
        RenderSettings renderSettings = RenderSettings.from(settings);
        TimingSettings timingSettings = TimingSettings.from(settings);
        PacingSettings pacing = PacingSettings.from(settings);
        this.streamSettings = StreamShareSettings.from(settings);
        FrameProfiler.Config perf = FrameProfiler.Config.from(settings);

        StateStore states = new StateStore();
        this.bus = new EventBus(states);
        this.playlists = new EventPlaylistManager(bus);
        this.virtualPeripherals = new VirtualPeripheralRegistry(bus, playlists);
        this.peripherals = new PeripheralManager(bus::post);
        PeripheralManager.serviceDetectors().forEach(peripherals::addDetector);

        RenderContext context = new RenderContext(bus, states, orientation, window);
        this.pipeline = new RenderPipeline(renderSettings, new RendererTimingTracker(timingSettings), context);
        this.loop = RenderLoop.builder(pipeline, bus, sink)
                .renderers(() -> renderers)
                .pacing(pacing)
                .peripherals(peripherals)
                .profiler(new FrameProfiler(perf))
                .build();

        log.info("Render settings: variant={} merge={} workers={} window={} layout={}",
                renderSettings.variant(), renderSettings.mergeStrategy(), renderSettings.maxWorkers(),
                window, orientation.layout());
    }

    /** Detect and start physical peripherals. */
    public void startPeripherals() {
        int found = peripherals.detect();
        peripherals.start();
        log.info("Peripherals started: {}", found);
    }

    public void addRenderer(Renderer renderer) {
        renderers.add(Objects.requireNonNull(renderer, "renderer"));
    }

    public boolean removeRenderer(Renderer renderer) {
        boolean removed = renderers.remove(renderer);
        if (removed) pipeline.reset(renderer);
        return removed;
    }

    public List<Renderer> renderers() {
        return List.copyOf(renderers);
    }

    public EventBus bus() {
        return bus;
    }

    public EventPlaylistManager playlists() {
        return playlists;
    }

    public VirtualPeripheralRegistry virtualPeripherals() {
        return virtualPeripherals;
    }

    public PeripheralManager peripherals() {
        return peripherals;
    }

    public RenderPipeline pipeline() {
        return pipeline;
    }

    public RenderLoop loop() {
        return loop;
    }

    public StreamShareSettings streamSettings() {
        return streamSettings;
    }

    /** Blocks on the calling thread until {@link RenderLoop#stop()} or interruption. */
    public void run() {
        loop.run();
    }

    @Override
    public void close() {
        loop.stop();
        virtualPeripherals.close();
        playlists.close();
        loop.close();
        bus.clearAll();
    }
}
