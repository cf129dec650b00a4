package org.foxesworld.glowframe.engine.render;

import org.foxesworld.glowframe.engine.render.surface.Surface;

import java.util.Objects;

/**
 * Renderer without state: every frame is a function of the orientation alone.
 */
public final class StatelessRenderer implements Renderer {

    @FunctionalInterface
    public interface Painter {
        void paint(Surface surface, Orientation orientation);
    }

    private final String name;
    private final DisplayMode displayMode;
    private final Painter painter;
    private volatile boolean initialized;

    public StatelessRenderer(String name, DisplayMode displayMode, Painter painter) {
        this.name = Objects.requireNonNull(name, "name");
        this.displayMode = Objects.requireNonNull(displayMode, "displayMode");
        this.painter = Objects.requireNonNull(painter, "painter");
    }

    public StatelessRenderer(String name, Painter painter) {
        this(name, DisplayMode.FULL, painter);
    }

    @Override public String name() { return name; }
    @Override public DisplayMode displayMode() { return displayMode; }
    @Override public boolean isInitialized() { return initialized; }

    @Override
    public void initialize(RenderContext context) {
        initialized = true;
    }

    @Override
    public void render(Surface surface, Orientation orientation) {
        if (!initialized) throw new IllegalStateException("Renderer '" + name + "' rendered before initialize");
        painter.paint(surface, orientation);
    }

    @Override
    public void reset() {
        initialized = false;
    }

    @Override
    public String toString() {
        return "StatelessRenderer{" + name + ", " + displayMode + '}';
    }
}
