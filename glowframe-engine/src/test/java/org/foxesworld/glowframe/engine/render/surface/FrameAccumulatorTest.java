package org.foxesworld.glowframe.engine.render.surface;

import com.jme3.math.ColorRGBA;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameAccumulatorTest {

    @Test
    void commandsApplyInQueueOrderOnFlush() {
        Surface target = new Surface(2, 1);
        FrameAccumulator acc = new FrameAccumulator(target);
        Surface dot = new Surface(1, 1);
        dot.setPixel(0, 0, 0xFF00FF00);

        acc.queueFill(ColorRGBA.Red);
        acc.queueBlit(dot, 1, 0);

        assertEquals(2, acc.pending());
        assertEquals(Surface.TRANSPARENT, target.pixel(0, 0));

        Surface out = acc.flush(false);

        assertSame(target, out);
        assertEquals(0xFFFF0000, out.pixel(0, 0));
        assertEquals(0xFF00FF00, out.pixel(1, 0));
        assertEquals(0, acc.pending());
    }

    @Test
    void flushWithClearStartsFromTransparent() {
        Surface target = new Surface(2, 1);
        target.setPixel(0, 0, 0xFFFFFFFF);
        FrameAccumulator acc = new FrameAccumulator(target);

        acc.flush(true);

        assertEquals(Surface.TRANSPARENT, target.pixel(0, 0));
    }

    @Test
    void flushIntoAnotherTarget() {
        Surface own = new Surface(1, 1);
        Surface other = new Surface(1, 1);
        FrameAccumulator acc = new FrameAccumulator(own);
        acc.queueFill(ColorRGBA.Blue);

        acc.flush(other, false);

        assertEquals(0xFF0000FF, other.pixel(0, 0));
        assertEquals(Surface.TRANSPARENT, own.pixel(0, 0));
    }

    @Test
    void queuedFillIgnoresLaterColorChanges() {
        Surface target = new Surface(1, 1);
        FrameAccumulator acc = new FrameAccumulator(target);
        ColorRGBA color = new ColorRGBA(1f, 0f, 0f, 1f);

        acc.queueFill(color);
        color.set(0f, 0f, 1f, 1f);
        acc.flush(false);

        assertEquals(0xFFFF0000, target.pixel(0, 0));
    }

    @Test
    void resetDropsCommands() {
        Surface target = new Surface(1, 1);
        FrameAccumulator acc = FrameAccumulator.fromSurface(target, true);
        acc.queueFill(ColorRGBA.Red);

        acc.reset();
        acc.flush(false);

        assertEquals(Surface.TRANSPARENT, target.pixel(0, 0));
    }
}
