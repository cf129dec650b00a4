package org.foxesworld.glowframe.engine.render.timing;

import org.foxesworld.glowframe.core.SettingsReader;

import java.util.Objects;

/**
 * Renderer cost tracking settings.
 *
 * @param strategy         averaging strategy
 * @param emaAlpha         smoothing factor in (0, 1]; ignored for {@link TimingStrategy#CUMULATIVE}
 * @param materialChangeMs minimum move of a renderer's average that bumps the timing version;
 *                         0 bumps on every sample
 */
public record TimingSettings(TimingStrategy strategy, double emaAlpha, double materialChangeMs) {

    public static final double DEFAULT_EMA_ALPHA = 0.2;

    public TimingSettings {
        Objects.requireNonNull(strategy, "strategy");
        if (!Double.isFinite(emaAlpha) || emaAlpha <= 0.0 || emaAlpha > 1.0) {
            throw new IllegalArgumentException("emaAlpha must be in (0, 1]: " + emaAlpha);
        }
        if (!Double.isFinite(materialChangeMs) || materialChangeMs < 0.0) {
            throw new IllegalArgumentException("materialChangeMs must be >= 0: " + materialChangeMs);
        }
    }

    public static TimingSettings defaults() {
        return new TimingSettings(TimingStrategy.EMA, DEFAULT_EMA_ALPHA, 0.0);
    }

    public static TimingSettings ema(double alpha) {
        return new TimingSettings(TimingStrategy.EMA, alpha, 0.0);
    }

    public static TimingSettings cumulative() {
        return new TimingSettings(TimingStrategy.CUMULATIVE, DEFAULT_EMA_ALPHA, 0.0);
    }

    public static TimingSettings from(SettingsReader r) {
        TimingStrategy strategy = r.enumValue("render.timing.strategy", TimingStrategy.class, TimingStrategy.EMA);
        double alpha = r.f64("render.timing.ema.alpha", DEFAULT_EMA_ALPHA, Double.MIN_VALUE, 1.0);
        double material = r.f64("render.timing.material.change.ms", 0.0, 0.0, Double.MAX_VALUE);
        return new TimingSettings(strategy, alpha, material);
    }
}
