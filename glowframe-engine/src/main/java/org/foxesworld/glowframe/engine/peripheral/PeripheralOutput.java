package org.foxesworld.glowframe.engine.peripheral;

/**
 * Outbound side of a peripheral.
 */
@FunctionalInterface
public interface PeripheralOutput {

    void emit(Input input);
}
