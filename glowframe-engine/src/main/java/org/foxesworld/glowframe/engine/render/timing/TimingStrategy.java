package org.foxesworld.glowframe.engine.render.timing;

public enum TimingStrategy {
    /** Exponential moving average; the first sample seeds the average. */
    EMA,
    /** Plain running mean over every sample. */
    CUMULATIVE
}
