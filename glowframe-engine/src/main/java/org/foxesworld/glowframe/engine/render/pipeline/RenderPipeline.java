package org.foxesworld.glowframe.engine.render.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.render.RenderContext;
import org.foxesworld.glowframe.engine.render.RenderSettings;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.compose.MergeFunction;
import org.foxesworld.glowframe.engine.render.compose.SurfaceCollector;
import org.foxesworld.glowframe.engine.render.compose.SurfaceComposer;
import org.foxesworld.glowframe.engine.render.compose.SurfaceMerger;
import org.foxesworld.glowframe.engine.render.plan.RenderPlan;
import org.foxesworld.glowframe.engine.render.plan.RenderPlanCache;
import org.foxesworld.glowframe.engine.render.plan.RenderPlanner;
import org.foxesworld.glowframe.engine.render.plan.RendererVariant;
import org.foxesworld.glowframe.engine.render.surface.Surface;
import org.foxesworld.glowframe.engine.render.surface.SurfaceCaches;
import org.foxesworld.glowframe.engine.render.timing.RendererTimingTracker;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders one frame from a renderer list: plan, collect, compose.
 *
 * <p>The worker pool is created on first parallel use. {@link #shutdown()} lets in-flight
 * tasks finish before returning.</p>
 */
public final class RenderPipeline {

    private static final Logger log = LogManager.getLogger(RenderPipeline.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final RenderSettings settings;
    private final RendererTimingTracker timings;
    private final RendererSurfaceProvider surfaces;
    private final RendererProcessor processor;
    private final RenderPlanCache planCache;
    private final SurfaceCollector collector;
    private final SurfaceMerger merger;

    private final Object executorLock = new Object();
    private ExecutorService executor;
    private volatile boolean shutdown;

    public RenderPipeline(RenderSettings settings, RendererTimingTracker timings, RenderContext context) {
        this(settings, timings, context, MergeFunction.IN_PLACE);
    }

    public RenderPipeline(RenderSettings settings,
                          RendererTimingTracker timings,
                          RenderContext context,
                          MergeFunction mergeFunction) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.timings = Objects.requireNonNull(timings, "timings");
        Objects.requireNonNull(context, "context");

        SurfaceCaches caches = (settings.surfaceCache() || settings.screenCache()) ? SurfaceCaches.defaults() : null;
        this.surfaces = new RendererSurfaceProvider(context.window(), context.orientation(), caches,
                settings.surfaceCache(), settings.tileStrategy());
        this.processor = new RendererProcessor(surfaces, timings, context);
        this.planCache = new RenderPlanCache(new RenderPlanner(timings, settings), settings);
        this.collector = new SurfaceCollector(processor::process);
        this.merger = new SurfaceMerger(mergeFunction, new SurfaceComposer(caches, settings.screenCache()));
    }

    public RenderResult render(List<? extends Renderer> renderers) {
        return render(renderers, null);
    }

    /**
     * @param override variant for this frame, or null to use the configured default
     * @throws org.foxesworld.glowframe.engine.render.RenderFrameException when a renderer or merge fails
     */
    public RenderResult render(List<? extends Renderer> renderers, RendererVariant override) {
        Objects.requireNonNull(renderers, "renderers");
        if (shutdown) throw new IllegalStateException("RenderPipeline is shut down");

        RenderPlan plan = planCache.getPlan(renderers, settings.variant(), override);
        processor.setQueueDepth(renderers.size());

        Surface surface;
        if (plan.parallel()) {
            ExecutorService pool = executor();
            List<Surface> collected = collector.collectParallel(renderers, pool);
            surface = merger.mergeParallel(collected, plan.mergeStrategy(), pool);
        } else {
            List<Surface> collected = collector.collectSerial(renderers);
            surface = merger.mergeSerial(collected, plan.mergeStrategy());
        }
        return new RenderResult(surface, plan);
    }

    /** Reset a renderer and drop its cached surfaces. */
    public void reset(Renderer renderer) {
        renderer.reset();
        surfaces.invalidate(renderer);
    }

    public RendererTimingTracker timings() {
        return timings;
    }

    public RenderPlanCache planCache() {
        return planCache;
    }

    public RenderSettings settings() {
        return settings;
    }

    public void shutdown() {
        shutdown = true;
        ExecutorService pool;
        synchronized (executorLock) {
            pool = executor;
            executor = null;
        }
        if (pool == null) return;

        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Render workers did not finish within {} ms, forcing shutdown", SHUTDOWN_TIMEOUT_MS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private ExecutorService executor() {
        synchronized (executorLock) {
            if (executor == null) {
                AtomicInteger n = new AtomicInteger(1);
                executor = Executors.newFixedThreadPool(settings.maxWorkers(), r -> {
                    Thread t = new Thread(r, "glowframe-render-" + n.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                });
                log.debug("Render worker pool started: {} workers", settings.maxWorkers());
            }
            return executor;
        }
    }
}
