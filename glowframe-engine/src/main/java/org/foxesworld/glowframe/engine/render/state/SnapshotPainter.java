package org.foxesworld.glowframe.engine.render.state;

import org.foxesworld.glowframe.engine.render.Orientation;
import org.foxesworld.glowframe.engine.render.surface.Surface;

/**
 * Draws a frame from a state snapshot. Must not read anything else that can change.
 */
@FunctionalInterface
public interface SnapshotPainter<S> {

    void paint(Surface surface, Orientation orientation, S state);
}
