package org.foxesworld.glowframe.engine.peripheral.virtual;

@FunctionalInterface
public interface VirtualPeripheralFactory {

    VirtualPeripheral create(VirtualPeripheralContext context);
}
