package org.foxesworld.glowframe.engine.render.plan;

import org.foxesworld.glowframe.engine.render.RenderSettings;
import org.foxesworld.glowframe.engine.render.Renderer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Memoizes the last plan.
 *
 * <p>A cached plan is returned only while the renderer-set signature, the override, the default
 * variant and the planner's timing version are all unchanged, and the refresh policy accepts
 * its age. The cached entry is an immutable record published through a volatile field, so hits
 * never take the lock; only replanning is serialized. A hit returns the very same
 * {@link RenderPlan} instance.</p>
 */
public final class RenderPlanCache {

    private record Entry(RenderPlan plan,
                         RenderPlanSignature signature,
                         RendererVariant override,
                         RendererVariant defaultVariant,
                         long timingVersion,
                         long planTimeNanos) {}

    private final Planner planner;
    private final int refreshMs;
    private final PlanRefreshStrategy refreshStrategy;
    private final SignatureStrategy signatureStrategy;
    private final LongSupplier nanoClock;

    private final Object replanLock = new Object();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private volatile Entry entry;

    public RenderPlanCache(Planner planner, RenderSettings settings) {
        this(planner, settings.planRefreshMs(), settings.planRefreshStrategy(), settings.signatureStrategy(), System::nanoTime);
    }

    public RenderPlanCache(Planner planner,
                           int refreshMs,
                           PlanRefreshStrategy refreshStrategy,
                           SignatureStrategy signatureStrategy,
                           LongSupplier nanoClock) {
        if (refreshMs < 0) throw new IllegalArgumentException("refreshMs must be >= 0: " + refreshMs);
        this.planner = Objects.requireNonNull(planner, "planner");
        this.refreshMs = refreshMs;
        this.refreshStrategy = Objects.requireNonNull(refreshStrategy, "refreshStrategy");
        this.signatureStrategy = Objects.requireNonNull(signatureStrategy, "signatureStrategy");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public RenderPlan getPlan(List<? extends Renderer> renderers,
                              RendererVariant defaultVariant,
                              RendererVariant override) {
        Objects.requireNonNull(defaultVariant, "defaultVariant");
        RenderPlanSignature sig = RenderPlanSignature.of(renderers, signatureStrategy);
        long version = planner.timingVersion();
        long now = nanoClock.getAsLong();

        Entry cached = entry;
        if (isValid(cached, sig, override, defaultVariant, version, now)) {
            hits.incrementAndGet();
            return cached.plan();
        }

        synchronized (replanLock) {
            // another writer may have replanned for the same inputs meanwhile
            cached = entry;
            if (isValid(cached, sig, override, defaultVariant, version, now)) {
                hits.incrementAndGet();
                return cached.plan();
            }

            RenderPlan fresh = planner.plan(renderers, defaultVariant, override);
            if (fresh == null) throw new IllegalStateException("planner returned no plan");
            if (fresh.signature().strategy() != signatureStrategy) {
                throw new IllegalStateException("plan signature strategy " + fresh.signature().strategy()
                        + " does not match cache strategy " + signatureStrategy);
            }

            misses.incrementAndGet();
            entry = new Entry(fresh, sig, override, defaultVariant, version, now);
            return fresh;
        }
    }

    public void invalidate() {
        synchronized (replanLock) {
            entry = null;
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private boolean isValid(Entry e, RenderPlanSignature sig, RendererVariant override, RendererVariant defaultVariant,
                            long version, long now) {
        if (e == null) return false;
        if (!sig.equals(e.signature()) || override != e.override()) return false;
        if (defaultVariant != e.defaultVariant()) return false;
        if (version != e.timingVersion()) return false;

        if (refreshStrategy == PlanRefreshStrategy.ON_CHANGE) return true;

        if (refreshMs <= 0) return false;
        double ageMs = (now - e.planTimeNanos()) / 1_000_000.0;
        return ageMs < refreshMs;
    }
}
