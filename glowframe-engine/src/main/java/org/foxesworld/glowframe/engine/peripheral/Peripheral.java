package org.foxesworld.glowframe.engine.peripheral;

/**
 * Device that feeds events into the bus.
 *
 * <p>{@link #run} executes on a dedicated worker thread owned by {@link PeripheralManager}
 * and should return promptly once the thread is interrupted.</p>
 */
public interface Peripheral {

    String name();

    /** Poll the device and emit events until interrupted. */
    void run(PeripheralOutput output) throws InterruptedException;

    /** Release device resources. Called after the worker has stopped. */
    default void close() {}
}
