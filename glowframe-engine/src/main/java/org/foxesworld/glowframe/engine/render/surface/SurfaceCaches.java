package org.foxesworld.glowframe.engine.render.surface;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded caches of reusable surfaces.
 *
 * <p>Every lookup hands back a surface that has been cleared to transparent, never a fresh
 * allocation when one of the right size is already cached. A cached surface is owned by its
 * key: input surfaces are keyed by renderer so two renderers never share a buffer.</p>
 */
public final class SurfaceCaches {

    /** Per-renderer input surfaces. */
    private final Cache<OwnerKey, Surface> inputSurfaces;

    /** Per-renderer tiled outputs for mirrored display mode. */
    private final Cache<OwnerKey, Surface> tiledSurfaces;

    /** Composite destinations by size. Small: one or two display sizes in practice. */
    private final Cache<SurfaceSize, Surface> compositeSurfaces;

    private SurfaceCaches(Cache<OwnerKey, Surface> inputSurfaces,
                          Cache<OwnerKey, Surface> tiledSurfaces,
                          Cache<SurfaceSize, Surface> compositeSurfaces) {
        this.inputSurfaces = Objects.requireNonNull(inputSurfaces, "inputSurfaces");
        this.tiledSurfaces = Objects.requireNonNull(tiledSurfaces, "tiledSurfaces");
        this.compositeSurfaces = Objects.requireNonNull(compositeSurfaces, "compositeSurfaces");
    }

    public Surface inputSurface(Object owner, SurfaceSize size) {
        return cleared(inputSurfaces.get(new OwnerKey(owner, size), k -> new Surface(k.size())));
    }

    public Surface tiledSurface(Object owner, SurfaceSize size) {
        return cleared(tiledSurfaces.get(new OwnerKey(owner, size), k -> new Surface(k.size())));
    }

    public Surface compositeSurface(SurfaceSize size) {
        return cleared(compositeSurfaces.get(size, Surface::new));
    }

    /** Drop every surface owned by {@code owner}, e.g. when a renderer resets. */
    public void invalidateOwner(Object owner) {
        if (owner == null) return;
        invalidateByOwner(inputSurfaces.asMap(), owner);
        invalidateByOwner(tiledSurfaces.asMap(), owner);
    }

    public void invalidateAll() {
        inputSurfaces.invalidateAll();
        tiledSurfaces.invalidateAll();
        compositeSurfaces.invalidateAll();
    }

    public long estimatedSize() {
        return inputSurfaces.estimatedSize() + tiledSurfaces.estimatedSize() + compositeSurfaces.estimatedSize();
    }

    private static void invalidateByOwner(ConcurrentMap<OwnerKey, Surface> map, Object owner) {
        map.keySet().removeIf(k -> k.owner() == owner);
    }

    private static Surface cleared(Surface s) {
        s.clear();
        return s;
    }

    public static SurfaceCaches defaults() {
        Cache<OwnerKey, Surface> input = Caffeine.newBuilder()
                .maximumSize(256)
                .expireAfterAccess(Duration.ofSeconds(30))
                .build();

        Cache<OwnerKey, Surface> tiled = Caffeine.newBuilder()
                .maximumSize(128)
                .expireAfterAccess(Duration.ofSeconds(30))
                .build();

        Cache<SurfaceSize, Surface> composite = Caffeine.newBuilder()
                .maximumSize(8)
                .build();

        return new SurfaceCaches(input, tiled, composite);
    }

    /**
     * Key that compares the owner by identity so equal-looking renderers keep separate buffers.
     */
    private static final class OwnerKey {
        private final Object owner;
        private final SurfaceSize size;

        OwnerKey(Object owner, SurfaceSize size) {
            this.owner = Objects.requireNonNull(owner, "owner");
            this.size = Objects.requireNonNull(size, "size");
        }

        Object owner() { return owner; }
        SurfaceSize size() { return size; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OwnerKey)) return false;
            OwnerKey that = (OwnerKey) o;
            return owner == that.owner && size.equals(that.size);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(owner) + size.hashCode();
        }

        @Override
        public String toString() {
            return "OwnerKey{" + owner + ", " + size + '}';
        }
    }
}
