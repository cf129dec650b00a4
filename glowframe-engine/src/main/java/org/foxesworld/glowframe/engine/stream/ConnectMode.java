package org.foxesworld.glowframe.engine.stream;

/**
 * When a ref-counted stream connects relative to attaching the subscriber that reaches the
 * threshold.
 */
public enum ConnectMode {
    /** Attach the subscriber, then connect; it sees the first upstream values live. */
    LAZY,
    /** Connect, then attach; values emitted while connecting reach it only through replay. */
    EAGER
}
