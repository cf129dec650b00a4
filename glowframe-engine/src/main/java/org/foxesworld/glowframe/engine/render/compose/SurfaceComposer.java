package org.foxesworld.glowframe.engine.render.compose;

import org.foxesworld.glowframe.engine.render.surface.FrameAccumulator;
import org.foxesworld.glowframe.engine.render.surface.Surface;
import org.foxesworld.glowframe.engine.render.surface.SurfaceCaches;
import org.foxesworld.glowframe.engine.render.surface.SurfaceSize;

import java.util.List;

/**
 * Batched composition: every surface is queued against one cleared destination and flushed once.
 *
 * <p>With the screen cache enabled the destination is reused across frames (cleared, not
 * reallocated), so the returned surface is only valid until the next call.</p>
 */
public final class SurfaceComposer {

    private final SurfaceCaches caches;
    private final boolean screenCache;

    private FrameAccumulator accumulator;

    public SurfaceComposer() {
        this(null, false);
    }

    /**
     * @param caches      surface caches; may be null when {@code screenCache} is false
     * @param screenCache reuse composite destinations by size
     */
    public SurfaceComposer(SurfaceCaches caches, boolean screenCache) {
        if (screenCache && caches == null) {
            throw new IllegalArgumentException("screenCache requires SurfaceCaches");
        }
        this.caches = caches;
        this.screenCache = screenCache;
    }

    public synchronized Surface composeBatched(List<Surface> surfaces) {
        if (surfaces == null || surfaces.isEmpty()) return null;

        SurfaceSize size = surfaces.get(0).size();
        Surface composite = compositeSurface(size);
        FrameAccumulator acc = accumulatorFor(composite);
        for (Surface s : surfaces) {
            acc.queueBlit(s);
        }
        return acc.flush(false);
    }

    private Surface compositeSurface(SurfaceSize size) {
        if (!screenCache) return new Surface(size);
        return caches.compositeSurface(size);
    }

    private FrameAccumulator accumulatorFor(Surface composite) {
        if (accumulator == null || accumulator.surface() != composite) {
            accumulator = new FrameAccumulator(composite);
        } else {
            accumulator.reset();
        }
        return accumulator;
    }
}
