package org.foxesworld.glowframe.engine.render.pipeline;

import org.foxesworld.glowframe.engine.render.plan.RenderPlan;
import org.foxesworld.glowframe.engine.render.surface.Surface;

/**
 * @param surface composed frame, or null when no renderer produced output
 * @param plan    plan the frame was rendered with
 */
public record RenderResult(Surface surface, RenderPlan plan) {
}
