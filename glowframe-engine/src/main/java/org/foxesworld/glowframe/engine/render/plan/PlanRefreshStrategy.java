package org.foxesworld.glowframe.engine.render.plan;

public enum PlanRefreshStrategy {
    /** Reuse a plan until an input changes, regardless of age. */
    ON_CHANGE,
    /** Also replan once the cached plan is older than the refresh interval. */
    TIME_BOXED
}
