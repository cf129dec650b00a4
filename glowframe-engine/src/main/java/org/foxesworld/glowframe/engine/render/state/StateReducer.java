package org.foxesworld.glowframe.engine.render.state;

import org.foxesworld.glowframe.engine.peripheral.Input;

/**
 * Produces the next snapshot from the current one and an event. Returns a new value.
 */
@FunctionalInterface
public interface StateReducer<S> {

    S reduce(S state, Input event);
}
