package org.foxesworld.glowframe.engine.render;

import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.peripheral.bus.StateStore;
import org.foxesworld.glowframe.engine.render.surface.SurfaceSize;

import java.util.Objects;

/**
 * Collaborators a renderer may use during {@link Renderer#initialize}.
 */
public record RenderContext(EventBus bus, StateStore states, Orientation orientation, SurfaceSize window) {

    public RenderContext {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(window, "window");
    }
}
