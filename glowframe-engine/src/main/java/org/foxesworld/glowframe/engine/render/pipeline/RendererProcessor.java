package org.foxesworld.glowframe.engine.render.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.render.RenderContext;
import org.foxesworld.glowframe.engine.render.RenderFrameException;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.surface.Surface;
import org.foxesworld.glowframe.engine.render.timing.RendererTimingTracker;

import java.util.Objects;

/**
 * Runs one renderer for one frame: prepare a surface, initialize on first use, draw, tile,
 * record the duration.
 */
public final class RendererProcessor {

    private static final Logger log = LogManager.getLogger(RendererProcessor.class);

    private final RendererSurfaceProvider surfaces;
    private final RendererTimingTracker timings;
    private final RenderContext context;

    private volatile int queueDepth;

    public RendererProcessor(RendererSurfaceProvider surfaces, RendererTimingTracker timings, RenderContext context) {
        this.surfaces = Objects.requireNonNull(surfaces, "surfaces");
        this.timings = Objects.requireNonNull(timings, "timings");
        this.context = Objects.requireNonNull(context, "context");
    }

    public void setQueueDepth(int depth) {
        this.queueDepth = depth;
    }

    /**
     * @throws RenderFrameException when the renderer fails; the frame is lost
     */
    public Surface process(Renderer renderer) {
        long t0 = System.nanoTime();
        Surface out;
        try {
            Surface screen = surfaces.prepare(renderer);
            if (!renderer.isInitialized()) {
                renderer.initialize(context);
            }
            renderer.render(screen, context.orientation());
            out = surfaces.postprocess(renderer, screen);
        } catch (RenderFrameException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RenderFrameException(renderer.name(), e);
        }

        double durationMs = (System.nanoTime() - t0) / 1_000_000.0;
        timings.record(renderer.name(), durationMs);

        if (log.isDebugEnabled()) {
            log.debug("render.loop renderer={} duration_ms={} queue_depth={} display_mode={} initialized={}",
                    renderer.name(), String.format("%.2f", durationMs), queueDepth,
                    renderer.displayMode(), renderer.isInitialized());
        }
        return out;
    }
}
