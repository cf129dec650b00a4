package org.foxesworld.glowframe.engine.render.plan;

import org.foxesworld.glowframe.engine.render.Renderer;

import java.util.List;

/**
 * Produces render plans. {@link RenderPlanCache} wraps one of these.
 */
public interface Planner {

    /**
     * @param defaultVariant variant used when no override is given; may be AUTO
     * @param override       explicit variant for this call, or null
     */
    RenderPlan plan(List<? extends Renderer> renderers, RendererVariant defaultVariant, RendererVariant override);

    /** Version of the cost model the plans depend on. */
    long timingVersion();
}
