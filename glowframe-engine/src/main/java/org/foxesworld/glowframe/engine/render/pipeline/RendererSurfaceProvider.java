package org.foxesworld.glowframe.engine.render.pipeline;

import org.foxesworld.glowframe.engine.render.DisplayMode;
import org.foxesworld.glowframe.engine.render.Layout;
import org.foxesworld.glowframe.engine.render.Orientation;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.surface.FrameAccumulator;
import org.foxesworld.glowframe.engine.render.surface.Surface;
import org.foxesworld.glowframe.engine.render.surface.SurfaceCaches;
import org.foxesworld.glowframe.engine.render.surface.SurfaceSize;
import org.foxesworld.glowframe.engine.render.surface.TileStrategy;

import java.util.Objects;

/**
 * Hands out input surfaces sized for a renderer's display mode and tiles mirrored output.
 *
 * <p>FULL and OPENGL renderers draw on a window-sized surface. MIRRORED renderers draw one
 * panel ({@code window / layout}) which is then repeated across every panel.</p>
 */
public final class RendererSurfaceProvider {

    private final SurfaceSize window;
    private final Orientation orientation;
    private final SurfaceCaches caches;
    private final boolean surfaceCache;
    private final TileStrategy tileStrategy;

    /**
     * @param caches       surface caches; may be null when {@code surfaceCache} is false
     * @param surfaceCache reuse per-renderer input and tiled surfaces
     */
    public RendererSurfaceProvider(SurfaceSize window,
                                   Orientation orientation,
                                   SurfaceCaches caches,
                                   boolean surfaceCache,
                                   TileStrategy tileStrategy) {
        this.window = Objects.requireNonNull(window, "window");
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.tileStrategy = Objects.requireNonNull(tileStrategy, "tileStrategy");
        if (surfaceCache && caches == null) {
            throw new IllegalArgumentException("surfaceCache requires SurfaceCaches");
        }
        this.caches = caches;
        this.surfaceCache = surfaceCache;
    }

    public SurfaceSize inputSize(Renderer renderer) {
        if (renderer.displayMode() != DisplayMode.MIRRORED) return window;
        Layout layout = orientation.layout();
        return new SurfaceSize(
                Math.max(1, window.width() / layout.columns()),
                Math.max(1, window.height() / layout.rows()));
    }

    public Surface prepare(Renderer renderer) {
        SurfaceSize size = inputSize(renderer);
        if (surfaceCache) return caches.inputSurface(renderer, size);
        return new Surface(size);
    }

    /** Turns a rendered input surface into a window-layout output. */
    public Surface postprocess(Renderer renderer, Surface screen) {
        if (renderer.displayMode() != DisplayMode.MIRRORED) return screen;
        Layout layout = orientation.layout();
        if (layout.panels() == 1) return screen;
        return tile(renderer, screen, layout.rows(), layout.columns());
    }

    public Surface tile(Object owner, Surface tile, int rows, int cols) {
        int tw = tile.width(), th = tile.height();
        SurfaceSize target = new SurfaceSize(tw * cols, th * rows);
        Surface out = surfaceCache ? caches.tiledSurface(owner, target) : new Surface(target);

        if (tileStrategy == TileStrategy.BLITS) {
            FrameAccumulator acc = new FrameAccumulator(out);
            for (int row = 0; row < rows; row++) {
                for (int col = 0; col < cols; col++) {
                    acc.queueBlit(tile, col * tw, row * th);
                }
            }
            return acc.flush(false);
        }

        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                out.blit(tile, col * tw, row * th);
            }
        }
        return out;
    }

    public void invalidate(Renderer renderer) {
        if (caches != null) caches.invalidateOwner(renderer);
    }

    public SurfaceSize window() {
        return window;
    }
}
