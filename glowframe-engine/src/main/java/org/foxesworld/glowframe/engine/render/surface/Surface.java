package org.foxesworld.glowframe.engine.render.surface;

import com.jme3.math.ColorRGBA;

import java.util.Arrays;
import java.util.Objects;

/**
 * In-memory ARGB pixel buffer produced by a renderer and consumed by composition.
 *
 * <p>Not thread-safe: a surface is written by at most one task at a time. Blits use
 * source-over blending with straight alpha; fully transparent source pixels are skipped and
 * fully opaque ones overwrite.</p>
 */
public final class Surface {

    public static final int TRANSPARENT = 0x00000000;

    private final SurfaceSize size;
    private final int[] argb;

    public Surface(SurfaceSize size) {
        this.size = Objects.requireNonNull(size, "size");
        this.argb = new int[size.area()];
    }

    public Surface(int width, int height) {
        this(new SurfaceSize(width, height));
    }

    public SurfaceSize size() { return size; }
    public int width() { return size.width(); }
    public int height() { return size.height(); }

    public int pixel(int x, int y) {
        checkBounds(x, y);
        return argb[y * size.width() + x];
    }

    public void setPixel(int x, int y, int color) {
        checkBounds(x, y);
        argb[y * size.width() + x] = color;
    }

    public void setPixel(int x, int y, ColorRGBA color) {
        setPixel(x, y, Objects.requireNonNull(color, "color").asIntARGB());
    }

    public void clear() {
        Arrays.fill(argb, TRANSPARENT);
    }

    public void fill(ColorRGBA color) {
        Arrays.fill(argb, Objects.requireNonNull(color, "color").asIntARGB());
    }

    /** Fill a rectangle, clipped to the surface. */
    public void fill(ColorRGBA color, int x, int y, int w, int h) {
        int c = Objects.requireNonNull(color, "color").asIntARGB();
        int x0 = Math.max(0, x), y0 = Math.max(0, y);
        int x1 = Math.min(size.width(), x + w), y1 = Math.min(size.height(), y + h);
        if (x0 >= x1) return;
        for (int row = y0; row < y1; row++) {
            int base = row * size.width();
            Arrays.fill(argb, base + x0, base + x1, c);
        }
    }

    /** Draw {@code src} with its top-left corner at (dx, dy), clipped to this surface. */
    public void blit(Surface src, int dx, int dy) {
        Objects.requireNonNull(src, "src");
        if (src == this) throw new IllegalArgumentException("cannot blit a surface onto itself");

        int sx0 = Math.max(0, -dx), sy0 = Math.max(0, -dy);
        int sx1 = Math.min(src.width(), size.width() - dx);
        int sy1 = Math.min(src.height(), size.height() - dy);

        for (int sy = sy0; sy < sy1; sy++) {
            int srcRow = sy * src.width();
            int dstRow = (sy + dy) * size.width() + dx;
            for (int sx = sx0; sx < sx1; sx++) {
                int s = src.argb[srcRow + sx];
                int sa = s >>> 24;
                if (sa == 0) continue;
                int di = dstRow + sx;
                argb[di] = (sa == 0xFF) ? s : over(s, argb[di]);
            }
        }
    }

    public void blit(Surface src) {
        blit(src, 0, 0);
    }

    public Surface copy() {
        Surface out = new Surface(size);
        System.arraycopy(argb, 0, out.argb, 0, argb.length);
        return out;
    }

    public boolean contentEquals(Surface other) {
        if (other == this) return true;
        if (other == null || !size.equals(other.size)) return false;
        return Arrays.equals(argb, other.argb);
    }

    private static int over(int s, int d) {
        int sa = s >>> 24;
        int da = d >>> 24;
        int inv = 255 - sa;
        int outA = sa + (da * inv + 127) / 255;
        if (outA == 0) return TRANSPARENT;

        int r = blendChannel((s >>> 16) & 0xFF, sa, (d >>> 16) & 0xFF, da, inv, outA);
        int g = blendChannel((s >>> 8) & 0xFF, sa, (d >>> 8) & 0xFF, da, inv, outA);
        int b = blendChannel(s & 0xFF, sa, d & 0xFF, da, inv, outA);
        return (outA << 24) | (r << 16) | (g << 8) | b;
    }

    private static int blendChannel(int sc, int sa, int dc, int da, int inv, int outA) {
        int num = sc * sa * 255 + dc * da * inv;
        return Math.min(255, (num / 255 + outA / 2) / outA);
    }

    private void checkBounds(int x, int y) {
        if (x < 0 || y < 0 || x >= size.width() || y >= size.height()) {
            throw new IndexOutOfBoundsException("pixel (" + x + "," + y + ") outside " + size);
        }
    }

    @Override
    public String toString() {
        return "Surface{" + size + '}';
    }
}
