package org.foxesworld.glowframe.engine.peripheral;

/**
 * Discovers peripherals. Implementations may be registered through
 * {@code META-INF/services/org.foxesworld.glowframe.engine.peripheral.PeripheralDetector}.
 */
@FunctionalInterface
public interface PeripheralDetector {

    Iterable<? extends Peripheral> detect();
}
