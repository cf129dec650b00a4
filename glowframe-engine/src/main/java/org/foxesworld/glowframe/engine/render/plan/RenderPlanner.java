package org.foxesworld.glowframe.engine.render.plan;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.render.RenderSettings;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.timing.RendererTimingTracker;
import org.foxesworld.glowframe.engine.render.timing.TimingEstimate;
import org.foxesworld.glowframe.engine.render.timing.TimingReport;

import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Chooses the collection variant and merge strategy for a renderer set from the measured cost.
 */
public final class RenderPlanner implements Planner {

    private static final Logger log = LogManager.getLogger(RenderPlanner.class);

    private final RendererTimingTracker timings;
    private final RenderSettings settings;
    private final LongSupplier nanoClock;

    public RenderPlanner(RendererTimingTracker timings, RenderSettings settings) {
        this(timings, settings, System::nanoTime);
    }

    public RenderPlanner(RendererTimingTracker timings, RenderSettings settings, LongSupplier nanoClock) {
        this.timings = Objects.requireNonNull(timings, "timings");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    @Override
    public RenderPlan plan(List<? extends Renderer> renderers, RendererVariant defaultVariant, RendererVariant override) {
        Objects.requireNonNull(renderers, "renderers");
        Objects.requireNonNull(defaultVariant, "defaultVariant");

        TimingEstimate estimate = timings.estimateTotal(renderers);
        TimingReport report = timings.snapshot(renderers);

        RendererVariant requested = (override != null) ? override : defaultVariant;
        RendererVariant variant = (requested == RendererVariant.AUTO)
                ? resolveAuto(renderers.size(), estimate)
                : requested;
        MergeStrategy merge = resolveMerge(renderers.size(), estimate);

        RenderPlan plan = new RenderPlan(
                variant,
                merge,
                estimate.totalMs(),
                estimate.hasSamples(),
                report.snapshots(),
                report.missing(),
                RenderPlanSignature.of(renderers, settings.signatureStrategy()),
                nanoClock.getAsLong()
        );

        if (log.isDebugEnabled()) {
            log.debug("render.plan variant={} merge_strategy={} renderer_count={} estimated_cost_ms={} has_samples={} missing={}",
                    variant, merge, renderers.size(), String.format("%.2f", estimate.totalMs()),
                    estimate.hasSamples(), report.missing());
        }
        return plan;
    }

    @Override
    public long timingVersion() {
        return timings.version();
    }

    public RenderSettings settings() {
        return settings;
    }

    RendererVariant resolveAuto(int rendererCount, TimingEstimate estimate) {
        if (rendererCount < settings.parallelThreshold()) return RendererVariant.ITERATIVE;
        int threshold = settings.parallelCostThresholdMs();
        if (threshold == 0) return RendererVariant.BINARY;
        if (estimate.hasSamples() && estimate.totalMs() >= threshold) return RendererVariant.BINARY;
        return RendererVariant.ITERATIVE;
    }

    MergeStrategy resolveMerge(int surfaceCount, TimingEstimate estimate) {
        MergeStrategy configured = settings.mergeStrategy();
        if (configured != MergeStrategy.ADAPTIVE) return configured;

        if (surfaceCount < settings.mergeSurfaceThreshold()) return MergeStrategy.IN_PLACE;
        int threshold = settings.mergeCostThresholdMs();
        if (threshold == 0) return MergeStrategy.BATCHED;
        if (estimate.hasSamples() && estimate.totalMs() >= threshold) return MergeStrategy.BATCHED;
        return MergeStrategy.IN_PLACE;
    }
}
