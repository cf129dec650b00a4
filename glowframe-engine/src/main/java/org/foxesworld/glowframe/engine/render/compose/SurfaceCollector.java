package org.foxesworld.glowframe.engine.render.compose;

import org.foxesworld.glowframe.engine.render.RenderFrameException;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.surface.Surface;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Gathers one surface per renderer, in renderer order. Null surfaces are skipped.
 */
public final class SurfaceCollector {

    private final Function<Renderer, Surface> processor;

    public SurfaceCollector(Function<Renderer, Surface> processor) {
        this.processor = Objects.requireNonNull(processor, "processor");
    }

    public List<Surface> collectSerial(List<? extends Renderer> renderers) {
        if (renderers == null || renderers.isEmpty()) return List.of();
        List<Surface> out = new ArrayList<>(renderers.size());
        for (Renderer r : renderers) {
            Surface s = processor.apply(r);
            if (s != null) out.add(s);
        }
        return out;
    }

    /**
     * Runs every renderer on {@code executor} and waits for all of them, even after a failure,
     * so no task is still drawing when the frame is abandoned. The first failure is rethrown.
     */
    public List<Surface> collectParallel(List<? extends Renderer> renderers, ExecutorService executor) {
        if (renderers == null || renderers.isEmpty()) return List.of();
        Objects.requireNonNull(executor, "executor");

        List<Future<Surface>> futures = new ArrayList<>(renderers.size());
        for (Renderer r : renderers) {
            futures.add(executor.submit(() -> processor.apply(r)));
        }

        List<Surface> out = new ArrayList<>(renderers.size());
        RuntimeException failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                Surface s = futures.get(i).get();
                if (s != null) out.add(s);
            } catch (ExecutionException e) {
                if (failure == null) failure = renderFailure(renderers.get(i), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (failure == null) failure = new RenderFrameException(renderers.get(i).name(), "Collection interrupted", e);
            }
        }
        if (failure != null) throw failure;
        return out;
    }

    private static RuntimeException renderFailure(Renderer renderer, Throwable cause) {
        if (cause instanceof RenderFrameException rfe) return rfe;
        return new RenderFrameException(renderer.name(), cause);
    }
}
