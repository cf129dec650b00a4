package org.foxesworld.glowframe.engine.loop;

public enum PacingStrategy {
    /** Fixed interval only; measured cost is ignored. */
    OFF,
    /** Interval stretches to {@code estimated cost / utilization target}. */
    ADAPTIVE
}
