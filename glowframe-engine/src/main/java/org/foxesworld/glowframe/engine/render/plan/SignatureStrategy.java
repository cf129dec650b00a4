package org.foxesworld.glowframe.engine.render.plan;

/**
 * How a renderer set is reduced to a plan cache key.
 */
public enum SignatureStrategy {
    /** One key element per renderer instance. */
    IDENTITY,
    /**
     * One key element per renderer class. Same-typed renderers are treated as interchangeable,
     * so two differently configured instances of one class share a cached plan.
     */
    TYPE
}
