package org.foxesworld.glowframe.engine.peripheral.bus;

import org.foxesworld.glowframe.engine.peripheral.Input;

@FunctionalInterface
public interface EventHandler {

    void handle(Input event);
}
