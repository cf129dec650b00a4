package org.foxesworld.glowframe.engine.render.surface;

import com.jme3.math.ColorRGBA;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurfaceTest {

    private static final int RED = 0xFFFF0000;
    private static final int BLUE = 0xFF0000FF;

    @Test
    void newSurfaceIsTransparent() {
        Surface s = new Surface(3, 2);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) assertEquals(Surface.TRANSPARENT, s.pixel(x, y));
        }
    }

    @Test
    void fillRectIsClipped() {
        Surface s = new Surface(4, 4);
        s.fill(ColorRGBA.Red, 2, 2, 10, 10);

        assertEquals(RED, s.pixel(3, 3));
        assertEquals(RED, s.pixel(2, 2));
        assertEquals(Surface.TRANSPARENT, s.pixel(1, 1));
        assertEquals(Surface.TRANSPARENT, s.pixel(3, 1));
    }

    @Test
    void blitSkipsTransparentAndOverwritesOpaque() {
        Surface dst = new Surface(4, 4);
        dst.fill(ColorRGBA.Blue);
        Surface src = new Surface(2, 2);
        src.setPixel(0, 0, RED);

        dst.blit(src, 1, 1);

        assertEquals(RED, dst.pixel(1, 1));
        assertEquals(BLUE, dst.pixel(2, 2));
        assertEquals(BLUE, dst.pixel(0, 0));
    }

    @Test
    void blitIsClippedAtNegativeOffsets() {
        Surface dst = new Surface(2, 2);
        Surface src = new Surface(2, 2);
        src.setPixel(1, 1, RED);

        dst.blit(src, -1, -1);

        assertEquals(RED, dst.pixel(0, 0));
        assertEquals(Surface.TRANSPARENT, dst.pixel(1, 1));
    }

    @Test
    void halfTransparentBlitBlendsOverOpaque() {
        Surface dst = new Surface(1, 1);
        dst.setPixel(0, 0, 0xFF000000);
        Surface src = new Surface(1, 1);
        src.setPixel(0, 0, 0x80FFFFFF);

        dst.blit(src);

        int p = dst.pixel(0, 0);
        assertEquals(0xFF, p >>> 24);
        int r = (p >>> 16) & 0xFF;
        assertTrue(r >= 127 && r <= 129, "blended red " + r);
    }

    @Test
    void blitOntoItselfIsRejected() {
        Surface s = new Surface(1, 1);
        assertThrows(IllegalArgumentException.class, () -> s.blit(s));
    }

    @Test
    void outOfBoundsPixelIsRejected() {
        Surface s = new Surface(2, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> s.pixel(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> s.setPixel(0, -1, RED));
    }

    @Test
    void copyIsIndependent() {
        Surface s = new Surface(2, 2);
        s.setPixel(0, 0, RED);
        Surface c = s.copy();
        s.clear();

        assertEquals(RED, c.pixel(0, 0));
        assertFalse(c.contentEquals(s));
    }

    @Test
    void sizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SurfaceSize(0, 5));
    }
}
