package org.foxesworld.glowframe.engine.loop;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.PeripheralManager;
import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.perf.FrameProfiler;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.pipeline.RenderPipeline;
import org.foxesworld.glowframe.engine.render.pipeline.RenderResult;
import org.foxesworld.glowframe.engine.render.timing.TimingEstimate;
import org.foxesworld.glowframe.engine.stream.EventStreams;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * The driving frame loop.
 *
 * <p>One {@link #tick()}: drain queued bus events, estimate the frame cost, ask the
 * {@link FramePacer}, render and present, publish {@code render.frame.tick}, then pace the
 * iteration. A renderer failure propagates out of {@code tick()}; the caller decides whether to
 * drop the frame or stop.</p>
 */
public final class RenderLoop implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(RenderLoop.class);

    private final RenderPipeline pipeline;
    private final Supplier<? extends List<? extends Renderer>> renderers;
    private final EventBus bus;
    private final FramePacer framePacer;
    private final RenderLoopPacer loopPacer;
    private final FrameSink sink;
    private final PeripheralManager peripherals;
    private final FrameProfiler profiler;
    private final LongSupplier nanoClock;

    private volatile boolean running;
    private volatile boolean closed;
    private long frames;

    private RenderLoop(Builder b) {
        this.pipeline = Objects.requireNonNull(b.pipeline, "pipeline");
        this.renderers = Objects.requireNonNull(b.renderers, "renderers");
        this.bus = Objects.requireNonNull(b.bus, "bus");
        this.framePacer = Objects.requireNonNull(b.framePacer, "framePacer");
        this.loopPacer = Objects.requireNonNull(b.loopPacer, "loopPacer");
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.peripherals = b.peripherals;
        this.profiler = (b.profiler != null) ? b.profiler : FrameProfiler.disabled();
        this.nanoClock = Objects.requireNonNull(b.nanoClock, "nanoClock");
    }

    public static Builder builder(RenderPipeline pipeline, EventBus bus, FrameSink sink) {
        return new Builder(pipeline, bus, sink);
    }

    /**
     * Run one loop iteration.
     *
     * @return true if a frame was presented
     * @throws org.foxesworld.glowframe.engine.render.RenderFrameException when a renderer or merge fails
     */
    public boolean tick() throws InterruptedException {
        if (closed) throw new IllegalStateException("RenderLoop is closed");
        long frameStart = nanoClock.getAsLong();

        long t = profiler.begin("bus.pump");
        bus.pump();
        profiler.end("bus.pump", t);

        List<? extends Renderer> current = renderers.get();
        TimingEstimate estimate = pipeline.timings().estimateTotal(current);
        Double costMs = estimate.hasSamples() ? estimate.totalMs() : null;

        if (!framePacer.shouldRender(costMs)) {
            loopPacer.pace(frameStart, costMs);
            return false;
        }

        t = profiler.begin("render.frame");
        RenderResult result = pipeline.render(current);
        profiler.end("render.frame", t);

        t = profiler.begin("render.present");
        sink.present(result.surface());
        profiler.end("render.present", t);

        framePacer.markRendered();
        frames++;

        double frameMs = (nanoClock.getAsLong() - frameStart) / 1_000_000.0;
        Map<String, Object> tick = new LinkedHashMap<>();
        tick.put("frame", frames);
        tick.put("duration_ms", frameMs);
        tick.put("variant", result.plan().variant().name());
        tick.put("renderer_count", current.size());
        bus.emit(EventStreams.FRAME_TICK, tick, 0);

        profiler.endFrame(frameMs);
        loopPacer.pace(frameStart, costMs);
        return true;
    }

    /**
     * Tick until {@link #stop()} or interruption.
     */
    public void run() {
        running = true;
        log.info("Render loop started");
        try {
            while (running && !closed) {
                tick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Render loop interrupted");
        } finally {
            running = false;
            log.info("Render loop stopped after {} frame(s)", frames);
        }
    }

    public void stop() {
        running = false;
    }

    public long frames() {
        return frames;
    }

    /**
     * Lets in-flight render workers finish, then closes the sink and the peripherals.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        running = false;

        pipeline.shutdown();
        try {
            sink.close();
        } finally {
            if (peripherals != null) peripherals.close();
        }
        log.info("Render loop closed");
    }

    public static final class Builder {
        private final RenderPipeline pipeline;
        private final EventBus bus;
        private final FrameSink sink;
        private Supplier<? extends List<? extends Renderer>> renderers = List::of;
        private FramePacer framePacer;
        private RenderLoopPacer loopPacer;
        private PeripheralManager peripherals;
        private FrameProfiler profiler;
        private LongSupplier nanoClock = System::nanoTime;
        private PacingSettings pacing = PacingSettings.defaults();

        private Builder(RenderPipeline pipeline, EventBus bus, FrameSink sink) {
            this.pipeline = pipeline;
            this.bus = bus;
            this.sink = sink;
        }

        public Builder renderers(List<? extends Renderer> fixed) {
            List<? extends Renderer> copy = List.copyOf(fixed);
            this.renderers = () -> copy;
            return this;
        }

        /** Renderer list read once per frame. */
        public Builder renderers(Supplier<? extends List<? extends Renderer>> source) {
            this.renderers = Objects.requireNonNull(source, "source");
            return this;
        }

        public Builder pacing(PacingSettings pacing) {
            this.pacing = Objects.requireNonNull(pacing, "pacing");
            return this;
        }

        public Builder framePacer(FramePacer framePacer) {
            this.framePacer = framePacer;
            return this;
        }

        public Builder loopPacer(RenderLoopPacer loopPacer) {
            this.loopPacer = loopPacer;
            return this;
        }

        public Builder peripherals(PeripheralManager peripherals) {
            this.peripherals = peripherals;
            return this;
        }

        public Builder profiler(FrameProfiler profiler) {
            this.profiler = profiler;
            return this;
        }

        public Builder nanoClock(LongSupplier nanoClock) {
            this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
            return this;
        }

        public RenderLoop build() {
            if (framePacer == null) framePacer = new FramePacer(pacing, nanoClock);
            if (loopPacer == null) loopPacer = new RenderLoopPacer(pacing, nanoClock, Sleeper.THREAD);
            return new RenderLoop(this);
        }
    }
}
