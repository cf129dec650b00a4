package org.foxesworld.glowframe.engine.render;

/**
 * Grid of identical panels making up the display.
 */
public record Layout(int columns, int rows) {

    public Layout {
        if (columns < 1 || rows < 1) {
            throw new IllegalArgumentException("layout must have at least one column and row: " + columns + "x" + rows);
        }
    }

    public static Layout single() {
        return new Layout(1, 1);
    }

    public int panels() {
        return columns * rows;
    }
}
