package org.foxesworld.glowframe.engine.render.compose;

import org.foxesworld.glowframe.engine.render.surface.Surface;

/**
 * Combines {@code top} onto {@code base}. Used by the pairwise reduction, so implementations
 * must be associative and must only write to {@code base}.
 */
@FunctionalInterface
public interface MergeFunction {

    Surface merge(Surface base, Surface top);

    /** Blits {@code top} onto {@code base} and returns {@code base}. Both must be the same size. */
    MergeFunction IN_PLACE = (base, top) -> {
        if (!base.size().equals(top.size())) {
            throw new IllegalArgumentException("Surfaces must be the same size to merge: "
                    + base.size() + " vs " + top.size());
        }
        base.blit(top);
        return base;
    };
}
