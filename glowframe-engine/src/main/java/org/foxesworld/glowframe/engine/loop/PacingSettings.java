package org.foxesworld.glowframe.engine.loop;

import org.foxesworld.glowframe.core.SettingsReader;

import java.util.Objects;

/**
 * Frame and loop pacing settings.
 *
 * @param maxFps                 frame cap; 0 means uncapped
 * @param frameMinIntervalMs     lower bound of the frame interval
 * @param frameUtilizationTarget share of the frame interval the measured cost may use, in (0, 1]
 * @param loopMinIntervalMs      lower bound of one loop iteration
 * @param loopUtilizationTarget  same as {@code frameUtilizationTarget}, for the loop pacer
 */
public record PacingSettings(
        int maxFps,
        double frameMinIntervalMs,
        PacingStrategy framePacingStrategy,
        double frameUtilizationTarget,
        PacingStrategy loopPacingStrategy,
        double loopMinIntervalMs,
        double loopUtilizationTarget
) {

    public static final int DEFAULT_MAX_FPS = 500;
    public static final double DEFAULT_UTILIZATION_TARGET = 0.9;

    public PacingSettings {
        if (maxFps < 0) throw new IllegalArgumentException("maxFps must be >= 0: " + maxFps);
        Objects.requireNonNull(framePacingStrategy, "framePacingStrategy");
        Objects.requireNonNull(loopPacingStrategy, "loopPacingStrategy");
        requireInterval("frameMinIntervalMs", frameMinIntervalMs);
        requireInterval("loopMinIntervalMs", loopMinIntervalMs);
        requireUtilization("frameUtilizationTarget", frameUtilizationTarget);
        requireUtilization("loopUtilizationTarget", loopUtilizationTarget);
    }

    public static PacingSettings defaults() {
        return new PacingSettings(DEFAULT_MAX_FPS, 0.0, PacingStrategy.OFF, DEFAULT_UTILIZATION_TARGET,
                PacingStrategy.OFF, 0.0, DEFAULT_UTILIZATION_TARGET);
    }

    public static PacingSettings from(SettingsReader r) {
        return new PacingSettings(
                r.i32("render.max.fps", DEFAULT_MAX_FPS, 0),
                r.f64("render.frame.min.interval.ms", 0.0, 0.0, Double.MAX_VALUE),
                r.enumValue("render.frame.pacing.strategy", PacingStrategy.class, PacingStrategy.OFF),
                r.f64("render.frame.utilization.target", DEFAULT_UTILIZATION_TARGET, Double.MIN_VALUE, 1.0),
                r.enumValue("render.loop.pacing.strategy", PacingStrategy.class, PacingStrategy.OFF),
                r.f64("render.loop.pacing.min.interval.ms", 0.0, 0.0, Double.MAX_VALUE),
                r.f64("render.loop.pacing.utilization", DEFAULT_UTILIZATION_TARGET, Double.MIN_VALUE, 1.0));
    }

    public PacingSettings withFramePacing(PacingStrategy strategy, double utilizationTarget) {
        return new PacingSettings(maxFps, frameMinIntervalMs, strategy, utilizationTarget,
                loopPacingStrategy, loopMinIntervalMs, loopUtilizationTarget);
    }

    public PacingSettings withLoopPacing(PacingStrategy strategy, double minIntervalMs, double utilizationTarget) {
        return new PacingSettings(maxFps, frameMinIntervalMs, framePacingStrategy, frameUtilizationTarget,
                strategy, minIntervalMs, utilizationTarget);
    }

    public PacingSettings withMaxFps(int maxFps) {
        return new PacingSettings(maxFps, frameMinIntervalMs, framePacingStrategy, frameUtilizationTarget,
                loopPacingStrategy, loopMinIntervalMs, loopUtilizationTarget);
    }

    private static void requireInterval(String name, double v) {
        if (!Double.isFinite(v) || v < 0.0) throw new IllegalArgumentException(name + " must be a finite value >= 0: " + v);
    }

    private static void requireUtilization(String name, double v) {
        if (!Double.isFinite(v) || v <= 0.0 || v > 1.0) {
            throw new IllegalArgumentException(name + " must be greater than 0 and at most 1: " + v);
        }
    }
}
