package org.foxesworld.glowframe.engine.loop;

import org.foxesworld.glowframe.engine.render.surface.Surface;

/**
 * Where finished frames go: a display, a window, a test recorder.
 */
public interface FrameSink extends AutoCloseable {

    /** The surface may be reused by the next frame; copy it to keep it. */
    void present(Surface frame);

    @Override
    default void close() {}
}
