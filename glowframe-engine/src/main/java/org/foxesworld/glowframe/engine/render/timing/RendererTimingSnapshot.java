package org.foxesworld.glowframe.engine.render.timing;

/**
 * Published cost figures for one renderer name.
 */
public record RendererTimingSnapshot(String name, double averageMs, double lastMs, long sampleCount) {

    RendererTimingSnapshot next(double durationMs, TimingSettings settings) {
        long count = sampleCount + 1;
        double avg;
        if (count == 1) {
            avg = durationMs;
        } else if (settings.strategy() == TimingStrategy.EMA) {
            double a = settings.emaAlpha();
            avg = a * durationMs + (1.0 - a) * averageMs;
        } else {
            avg = averageMs + (durationMs - averageMs) / count;
        }
        return new RendererTimingSnapshot(name, avg, durationMs, count);
    }
}
