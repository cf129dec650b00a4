package org.foxesworld.glowframe.engine.render.plan;

import org.foxesworld.glowframe.engine.render.timing.RendererTimingSnapshot;

import java.util.List;
import java.util.Objects;

/**
 * Immutable collection and composition choice for one frame.
 *
 * <p>A plan always carries resolved strategies: {@link RendererVariant#AUTO} and
 * {@link MergeStrategy#ADAPTIVE} are rejected.</p>
 */
public record RenderPlan(
        RendererVariant variant,
        MergeStrategy mergeStrategy,
        double estimatedCostMs,
        boolean hasSamples,
        List<RendererTimingSnapshot> timings,
        List<String> missingTimings,
        RenderPlanSignature signature,
        long generatedAtNanos
) {

    public RenderPlan {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(mergeStrategy, "mergeStrategy");
        Objects.requireNonNull(signature, "signature");
        if (variant == RendererVariant.AUTO) {
            throw new IllegalStateException("RenderPlan requires a resolved variant, got AUTO");
        }
        if (mergeStrategy == MergeStrategy.ADAPTIVE) {
            throw new IllegalStateException("RenderPlan requires a resolved merge strategy, got ADAPTIVE");
        }
        timings = List.copyOf(timings);
        missingTimings = List.copyOf(missingTimings);
    }

    public boolean parallel() {
        return variant == RendererVariant.BINARY;
    }
}
