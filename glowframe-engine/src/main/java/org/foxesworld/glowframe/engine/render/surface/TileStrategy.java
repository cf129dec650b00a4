package org.foxesworld.glowframe.engine.render.surface;

/** How a mirrored renderer's tile is replicated across the display layout. */
public enum TileStrategy {
    /** Queue every tile into one {@link FrameAccumulator} and flush once. */
    BLITS,
    /** Blit tile by tile. */
    LOOP
}
