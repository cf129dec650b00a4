package org.foxesworld.glowframe.engine.render.plan;

public enum RendererVariant {
    /** Resolved per plan from the renderer count and measured cost. */
    AUTO,
    /** Parallel collection and pairwise reduction on the worker pool. */
    BINARY,
    /** Serial collection and composition on the calling thread. */
    ITERATIVE
}
