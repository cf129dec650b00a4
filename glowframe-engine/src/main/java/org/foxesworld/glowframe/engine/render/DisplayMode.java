package org.foxesworld.glowframe.engine.render;

/**
 * How a renderer's output maps onto the physical display.
 */
public enum DisplayMode {
    /** Draws across the whole window. */
    FULL,
    /** Draws one panel; the output is repeated across every panel of the layout. */
    MIRRORED,
    /** Full window, drawn through an accelerated path owned by the renderer. */
    OPENGL
}
