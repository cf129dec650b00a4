package org.foxesworld.glowframe.engine.render.surface;

import com.jme3.math.ColorRGBA;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects blit and fill commands and applies them onto one destination in a single flush.
 */
public final class FrameAccumulator {

    private interface Command {}

    private record Blit(Surface source, int x, int y) implements Command {}

    private record Fill(ColorRGBA color, int x, int y, int w, int h) implements Command {}

    private final Surface surface;
    private final List<Command> commands = new ArrayList<>();

    public FrameAccumulator(Surface surface) {
        this.surface = Objects.requireNonNull(surface, "surface");
    }

    /** Reuse an existing surface, optionally clearing it first. */
    public static FrameAccumulator fromSurface(Surface surface, boolean clear) {
        if (clear) surface.clear();
        return new FrameAccumulator(surface);
    }

    public Surface surface() {
        return surface;
    }

    public void queueBlit(Surface source) {
        queueBlit(source, 0, 0);
    }

    public void queueBlit(Surface source, int x, int y) {
        commands.add(new Blit(Objects.requireNonNull(source, "source"), x, y));
    }

    public void queueFill(ColorRGBA color) {
        queueFill(color, 0, 0, surface.width(), surface.height());
    }

    public void queueFill(ColorRGBA color, int x, int y, int w, int h) {
        commands.add(new Fill(Objects.requireNonNull(color, "color").clone(), x, y, w, h));
    }

    public int pending() {
        return commands.size();
    }

    /** Drop queued commands without applying them. */
    public void reset() {
        commands.clear();
    }

    public Surface flush(boolean clear) {
        return flush(surface, clear);
    }

    /** Apply queued commands to {@code target} and clear the queue. */
    public Surface flush(Surface target, boolean clear) {
        Surface destination = (target != null) ? target : surface;
        if (clear) destination.clear();

        for (Command c : commands) {
            if (c instanceof Blit b) {
                destination.blit(b.source(), b.x(), b.y());
            } else if (c instanceof Fill f) {
                destination.fill(f.color(), f.x(), f.y(), f.w(), f.h());
            }
        }
        commands.clear();
        return destination;
    }
}
