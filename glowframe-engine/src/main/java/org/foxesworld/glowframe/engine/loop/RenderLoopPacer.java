package org.foxesworld.glowframe.engine.loop;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Sleeps out the rest of a loop iteration. Late iterations are not made up for: the sleep is
 * clamped at zero.
 */
public final class RenderLoopPacer {

    private final PacingStrategy strategy;
    private final double minIntervalMs;
    private final double utilizationTarget;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    public RenderLoopPacer(PacingSettings settings) {
        this(settings, System::nanoTime, Sleeper.THREAD);
    }

    public RenderLoopPacer(PacingSettings settings, LongSupplier nanoClock, Sleeper sleeper) {
        Objects.requireNonNull(settings, "settings");
        this.strategy = settings.loopPacingStrategy();
        this.minIntervalMs = settings.loopMinIntervalMs();
        this.utilizationTarget = settings.loopUtilizationTarget();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @param frameStartNanos clock reading taken at the start of the iteration
     * @param estimatedCostMs measured cost, or null; only used by {@link PacingStrategy#ADAPTIVE}
     * @return nanoseconds slept
     */
    public long pace(long frameStartNanos, Double estimatedCostMs) throws InterruptedException {
        double targetMs = minIntervalMs;
        if (strategy == PacingStrategy.ADAPTIVE && estimatedCostMs != null) {
            targetMs = Math.max(targetMs, estimatedCostMs / utilizationTarget);
        }
        if (targetMs <= 0.0) return 0L;

        long remaining = (long) (targetMs * 1_000_000.0) - (nanoClock.getAsLong() - frameStartNanos);
        if (remaining <= 0L) return 0L;
        sleeper.sleep(remaining);
        return remaining;
    }
}
