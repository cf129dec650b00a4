package org.foxesworld.glowframe.engine.render.timing;

/**
 * Summed average cost of a renderer set.
 *
 * @param totalMs    sum of known averages; renderers without samples contribute zero
 * @param hasSamples true when at least one renderer in the set has been measured
 */
public record TimingEstimate(double totalMs, boolean hasSamples) {

    public static final TimingEstimate COLD = new TimingEstimate(0.0, false);
}
