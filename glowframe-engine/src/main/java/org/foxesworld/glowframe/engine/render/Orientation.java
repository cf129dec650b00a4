package org.foxesworld.glowframe.engine.render;

import java.util.Objects;

/**
 * Physical arrangement handed to every render call.
 */
public record Orientation(Layout layout) {

    public Orientation {
        Objects.requireNonNull(layout, "layout");
    }

    public static Orientation single() {
        return new Orientation(Layout.single());
    }
}
