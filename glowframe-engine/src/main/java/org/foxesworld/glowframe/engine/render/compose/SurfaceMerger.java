package org.foxesworld.glowframe.engine.render.compose;

import org.foxesworld.glowframe.engine.render.RenderFrameException;
import org.foxesworld.glowframe.engine.render.plan.MergeStrategy;
import org.foxesworld.glowframe.engine.render.surface.Surface;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Reduces a list of surfaces to one.
 *
 * <p>Serial: {@link MergeStrategy#IN_PLACE} merges left to right onto the first surface,
 * {@link MergeStrategy#BATCHED} goes through the {@link SurfaceComposer}.
 * Parallel: {@link MergeStrategy#BATCHED} is still a single batched flush; otherwise adjacent
 * pairs are merged on the worker pool round by round, carrying an odd tail into the next
 * round. A failed merge task fails the whole composition. Every merge failure, serial or
 * parallel, surfaces as a {@link RenderFrameException}.</p>
 */
public final class SurfaceMerger {

    private final MergeFunction mergePair;
    private final SurfaceComposer composer;

    public SurfaceMerger(SurfaceComposer composer) {
        this(MergeFunction.IN_PLACE, composer);
    }

    public SurfaceMerger(MergeFunction mergePair, SurfaceComposer composer) {
        this.mergePair = Objects.requireNonNull(mergePair, "mergePair");
        this.composer = Objects.requireNonNull(composer, "composer");
    }

    public Surface mergeSerial(List<Surface> surfaces, MergeStrategy strategy) {
        if (surfaces == null || surfaces.isEmpty()) return null;
        MergeStrategy resolved = requireResolved(strategy);
        try {
            if (resolved == MergeStrategy.IN_PLACE) {
                Surface base = surfaces.get(0);
                for (int i = 1; i < surfaces.size(); i++) {
                    base = mergePair.merge(base, surfaces.get(i));
                }
                return base;
            }
            return composer.composeBatched(surfaces);
        } catch (RuntimeException e) {
            throw mergeFailure(e);
        }
    }

    public Surface mergeParallel(List<Surface> surfaces, MergeStrategy strategy, ExecutorService executor) {
        if (surfaces == null || surfaces.isEmpty()) return null;
        Objects.requireNonNull(executor, "executor");
        if (requireResolved(strategy) == MergeStrategy.BATCHED) {
            try {
                return composer.composeBatched(surfaces);
            } catch (RuntimeException e) {
                throw mergeFailure(e);
            }
        }
        return mergePairwise(surfaces, executor);
    }

    private Surface mergePairwise(List<Surface> surfaces, ExecutorService executor) {
        List<Surface> round = new ArrayList<>(surfaces);
        while (round.size() > 1) {
            int pairs = round.size() / 2;
            List<Future<Surface>> futures = new ArrayList<>(pairs);
            for (int i = 0; i < pairs; i++) {
                Surface left = round.get(2 * i);
                Surface right = round.get(2 * i + 1);
                futures.add(executor.submit(() -> mergePair.merge(left, right)));
            }

            List<Surface> next = new ArrayList<>(pairs + 1);
            RuntimeException failure = null;
            for (Future<Surface> f : futures) {
                try {
                    next.add(f.get());
                } catch (ExecutionException e) {
                    if (failure == null) failure = mergeFailure(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    if (failure == null) failure = new RenderFrameException(null, "Surface merge interrupted", e);
                }
            }
            if (failure != null) throw failure;

            if (round.size() % 2 == 1) next.add(round.get(round.size() - 1));
            round = next;
        }
        return round.get(0);
    }

    private static RuntimeException mergeFailure(Throwable cause) {
        if (cause instanceof RenderFrameException rfe) return rfe;
        return new RenderFrameException(null, "Surface merge failed: " + cause, cause);
    }

    private static MergeStrategy requireResolved(MergeStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        if (strategy == MergeStrategy.ADAPTIVE) {
            throw new IllegalStateException("merge strategy must be resolved by the planner, got ADAPTIVE");
        }
        return strategy;
    }
}
