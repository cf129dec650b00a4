package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Input;

/**
 * Runtime instance of a {@link VirtualPeripheralDefinition}. Owns its windowed state; receives
 * matching source events on the emitting thread.
 */
public interface VirtualPeripheral {

    void handle(Input event);

    /** Called when the definition is removed or replaced. */
    default void shutdown() {}
}
