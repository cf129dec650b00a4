package org.foxesworld.glowframe.engine.render;

import org.foxesworld.glowframe.engine.render.surface.Surface;

/**
 * Unit that draws one surface per frame.
 *
 * <p>{@link #render} must only read state that was published before the call. Calling it
 * before {@link #initialize} is a programming error and throws {@link IllegalStateException}.
 * {@link #reset} returns the renderer to the uninitialized state and releases any upstream
 * subscription it holds.</p>
 */
public interface Renderer {

    /** Stable name used for timing, logging and plan signatures. */
    String name();

    default DisplayMode displayMode() {
        return DisplayMode.FULL;
    }

    boolean isInitialized();

    void initialize(RenderContext context);

    void render(Surface surface, Orientation orientation);

    void reset();
}
