package org.foxesworld.glowframe.engine.render.surface;

public record SurfaceSize(int width, int height) {

    public SurfaceSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("surface size must be positive: " + width + "x" + height);
        }
    }

    public int area() {
        return width * height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
