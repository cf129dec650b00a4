package org.foxesworld.glowframe.engine.render;

import org.foxesworld.glowframe.core.GlowframePlatform;
import org.foxesworld.glowframe.core.SettingsReader;
import org.foxesworld.glowframe.engine.render.plan.MergeStrategy;
import org.foxesworld.glowframe.engine.render.plan.PlanRefreshStrategy;
import org.foxesworld.glowframe.engine.render.plan.RendererVariant;
import org.foxesworld.glowframe.engine.render.plan.SignatureStrategy;
import org.foxesworld.glowframe.engine.render.surface.TileStrategy;

import java.util.Objects;

/**
 * Render pipeline settings, resolved once at startup.
 *
 * <p>Thresholds:
 * <ul>
 *   <li>{@code parallelThreshold}: AUTO stays serial below this many renderers.</li>
 *   <li>{@code parallelCostThresholdMs}: AUTO goes parallel at or above this measured cost; 0 means always.</li>
 *   <li>{@code mergeSurfaceThreshold}: ADAPTIVE merges in place below this many surfaces.</li>
 *   <li>{@code mergeCostThresholdMs}: ADAPTIVE batches at or above this measured cost; 0 means always.</li>
 * </ul>
 */
public record RenderSettings(
        RendererVariant variant,
        MergeStrategy mergeStrategy,
        int mergeSurfaceThreshold,
        int mergeCostThresholdMs,
        int parallelThreshold,
        int parallelCostThresholdMs,
        int maxWorkers,
        int planRefreshMs,
        PlanRefreshStrategy planRefreshStrategy,
        SignatureStrategy signatureStrategy,
        TileStrategy tileStrategy,
        boolean surfaceCache,
        boolean screenCache
) {

    public static final int DEFAULT_MERGE_SURFACE_THRESHOLD = 3;
    public static final int DEFAULT_MERGE_COST_THRESHOLD_MS = 6;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 4;
    public static final int DEFAULT_PARALLEL_COST_THRESHOLD_MS = 12;
    public static final int DEFAULT_PLAN_REFRESH_MS = 100;

    public RenderSettings {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(mergeStrategy, "mergeStrategy");
        Objects.requireNonNull(planRefreshStrategy, "planRefreshStrategy");
        Objects.requireNonNull(signatureStrategy, "signatureStrategy");
        Objects.requireNonNull(tileStrategy, "tileStrategy");
        requireAtLeast("mergeSurfaceThreshold", mergeSurfaceThreshold, 1);
        requireAtLeast("mergeCostThresholdMs", mergeCostThresholdMs, 0);
        requireAtLeast("parallelThreshold", parallelThreshold, 1);
        requireAtLeast("parallelCostThresholdMs", parallelCostThresholdMs, 0);
        requireAtLeast("maxWorkers", maxWorkers, 1);
        requireAtLeast("planRefreshMs", planRefreshMs, 0);
    }

    public static RenderSettings defaults() {
        return new RenderSettings(
                RendererVariant.ITERATIVE,
                MergeStrategy.ADAPTIVE,
                DEFAULT_MERGE_SURFACE_THRESHOLD,
                DEFAULT_MERGE_COST_THRESHOLD_MS,
                DEFAULT_PARALLEL_THRESHOLD,
                DEFAULT_PARALLEL_COST_THRESHOLD_MS,
                GlowframePlatform.processors(),
                DEFAULT_PLAN_REFRESH_MS,
                PlanRefreshStrategy.TIME_BOXED,
                SignatureStrategy.IDENTITY,
                TileStrategy.BLITS,
                false,
                false
        );
    }

    public static RenderSettings from(SettingsReader r) {
        return new RenderSettings(
                r.enumValue("render.variant", RendererVariant.class, RendererVariant.ITERATIVE),
                r.enumValue("render.merge.strategy", MergeStrategy.class, MergeStrategy.ADAPTIVE),
                r.i32("render.merge.surface.threshold", DEFAULT_MERGE_SURFACE_THRESHOLD, 1),
                r.i32("render.merge.cost.threshold.ms", DEFAULT_MERGE_COST_THRESHOLD_MS, 0),
                r.i32("render.parallel.threshold", DEFAULT_PARALLEL_THRESHOLD, 1),
                r.i32("render.parallel.cost.threshold.ms", DEFAULT_PARALLEL_COST_THRESHOLD_MS, 0),
                r.i32("render.max.workers", GlowframePlatform.processors(), 1),
                r.i32("render.plan.refresh.ms", DEFAULT_PLAN_REFRESH_MS, 0),
                r.enumValue("render.plan.refresh.strategy", PlanRefreshStrategy.class, PlanRefreshStrategy.TIME_BOXED),
                r.enumValue("render.plan.signature.strategy", SignatureStrategy.class, SignatureStrategy.IDENTITY),
                r.enumValue("render.tile.strategy", TileStrategy.class, TileStrategy.BLITS),
                r.bool("render.surface.cache", false),
                r.bool("render.screen.cache", false)
        );
    }

    public RenderSettings withVariant(RendererVariant v) {
        return new RenderSettings(v, mergeStrategy, mergeSurfaceThreshold, mergeCostThresholdMs,
                parallelThreshold, parallelCostThresholdMs, maxWorkers, planRefreshMs, planRefreshStrategy,
                signatureStrategy, tileStrategy, surfaceCache, screenCache);
    }

    public RenderSettings withMergeStrategy(MergeStrategy m) {
        return new RenderSettings(variant, m, mergeSurfaceThreshold, mergeCostThresholdMs,
                parallelThreshold, parallelCostThresholdMs, maxWorkers, planRefreshMs, planRefreshStrategy,
                signatureStrategy, tileStrategy, surfaceCache, screenCache);
    }

    public RenderSettings withCaches(boolean surface, boolean screen) {
        return new RenderSettings(variant, mergeStrategy, mergeSurfaceThreshold, mergeCostThresholdMs,
                parallelThreshold, parallelCostThresholdMs, maxWorkers, planRefreshMs, planRefreshStrategy,
                signatureStrategy, tileStrategy, surface, screen);
    }

    public RenderSettings withTileStrategy(TileStrategy t) {
        return new RenderSettings(variant, mergeStrategy, mergeSurfaceThreshold, mergeCostThresholdMs,
                parallelThreshold, parallelCostThresholdMs, maxWorkers, planRefreshMs, planRefreshStrategy,
                signatureStrategy, t, surfaceCache, screenCache);
    }

    public RenderSettings withMaxWorkers(int workers) {
        return new RenderSettings(variant, mergeStrategy, mergeSurfaceThreshold, mergeCostThresholdMs,
                parallelThreshold, parallelCostThresholdMs, workers, planRefreshMs, planRefreshStrategy,
                signatureStrategy, tileStrategy, surfaceCache, screenCache);
    }

    private static void requireAtLeast(String name, int value, int min) {
        if (value < min) throw new IllegalArgumentException(name + " must be >= " + min + ": " + value);
    }
}
