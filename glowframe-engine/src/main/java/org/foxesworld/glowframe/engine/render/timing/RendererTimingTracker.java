package org.foxesworld.glowframe.engine.render.timing;

import org.foxesworld.glowframe.engine.render.Renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records render durations per renderer name and estimates the cost of renderer sets.
 *
 * <p>Each name maps to an immutable {@link RendererTimingSnapshot} that is swapped atomically,
 * so readers always see a whole sample. The {@link #version()} counter lets plan caches detect
 * a changed cost model without comparing averages.</p>
 */
public final class RendererTimingTracker {

    private final TimingSettings settings;
    private final Map<String, RendererTimingSnapshot> stats = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public RendererTimingTracker() {
        this(TimingSettings.defaults());
    }

    public RendererTimingTracker(TimingSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public TimingSettings settings() {
        return settings;
    }

    public void record(String rendererName, double durationMs) {
        Objects.requireNonNull(rendererName, "rendererName");
        if (!Double.isFinite(durationMs) || durationMs < 0.0) {
            throw new IllegalArgumentException("duration must be finite and >= 0: " + durationMs);
        }

        boolean[] material = new boolean[1];
        stats.compute(rendererName, (name, prev) -> {
            RendererTimingSnapshot base = (prev != null) ? prev : new RendererTimingSnapshot(name, 0.0, 0.0, 0);
            RendererTimingSnapshot next = base.next(durationMs, settings);
            material[0] = prev == null
                    || Math.abs(next.averageMs() - prev.averageMs()) >= settings.materialChangeMs();
            return next;
        });
        if (material[0]) version.incrementAndGet();
    }

    public RendererTimingSnapshot get(String rendererName) {
        return stats.get(rendererName);
    }

    /** Current cost-model version. Changes whenever a tracked average moved materially. */
    public long version() {
        return version.get();
    }

    public TimingEstimate estimateTotal(Iterable<? extends Renderer> renderers) {
        double total = 0.0;
        boolean hasSamples = false;
        for (Renderer r : renderers) {
            RendererTimingSnapshot s = stats.get(r.name());
            if (s == null) continue;
            total += s.averageMs();
            hasSamples = true;
        }
        return new TimingEstimate(total, hasSamples);
    }

    public TimingReport snapshot(Iterable<? extends Renderer> renderers) {
        List<RendererTimingSnapshot> out = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (Renderer r : renderers) {
            RendererTimingSnapshot s = stats.get(r.name());
            if (s == null) missing.add(r.name());
            else out.add(s);
        }
        return new TimingReport(out, missing);
    }

    public void clear() {
        stats.clear();
        version.incrementAndGet();
    }
}
