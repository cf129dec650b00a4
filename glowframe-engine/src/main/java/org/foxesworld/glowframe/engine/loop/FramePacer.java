package org.foxesworld.glowframe.engine.loop;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Decides whether enough time has passed since the last presented frame.
 *
 * <p>Target interval is the largest of the FPS interval, the configured minimum and, under
 * {@link PacingStrategy#ADAPTIVE}, {@code estimatedCostMs / utilizationTarget}.</p>
 */
public final class FramePacer {

    private final int maxFps;
    private final double minIntervalMs;
    private final PacingStrategy strategy;
    private final double utilizationTarget;
    private final LongSupplier nanoClock;

    private long lastRenderNanos;
    private boolean rendered;

    public FramePacer(PacingSettings settings) {
        this(settings, System::nanoTime);
    }

    public FramePacer(PacingSettings settings, LongSupplier nanoClock) {
        Objects.requireNonNull(settings, "settings");
        this.maxFps = settings.maxFps();
        this.minIntervalMs = settings.frameMinIntervalMs();
        this.strategy = settings.framePacingStrategy();
        this.utilizationTarget = settings.frameUtilizationTarget();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * @param estimatedCostMs measured frame cost, or null when nothing has been measured yet
     */
    public boolean shouldRender(Double estimatedCostMs) {
        if (!rendered) return true;
        double intervalMs = targetIntervalMs(estimatedCostMs);
        if (intervalMs <= 0.0) return true;
        double elapsedMs = (nanoClock.getAsLong() - lastRenderNanos) / 1_000_000.0;
        return elapsedMs >= intervalMs;
    }

    public void markRendered() {
        lastRenderNanos = nanoClock.getAsLong();
        rendered = true;
    }

    public double targetIntervalMs(Double estimatedCostMs) {
        double interval = (maxFps > 0) ? 1000.0 / maxFps : 0.0;
        interval = Math.max(interval, minIntervalMs);
        if (strategy == PacingStrategy.ADAPTIVE && estimatedCostMs != null) {
            interval = Math.max(interval, estimatedCostMs / utilizationTarget);
        }
        return interval;
    }
}
