package org.foxesworld.glowframe.engine.render.plan;

public enum MergeStrategy {
    /** Blit every surface onto the first one in order. */
    IN_PLACE,
    /** Queue every blit against one cleared destination and flush once. */
    BATCHED,
    /** Pick {@link #IN_PLACE} or {@link #BATCHED} per plan. */
    ADAPTIVE
}
