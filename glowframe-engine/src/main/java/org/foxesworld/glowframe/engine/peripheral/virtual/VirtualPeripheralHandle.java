package org.foxesworld.glowframe.engine.peripheral.virtual;

import java.util.Objects;

public record VirtualPeripheralHandle(String id) {

    public VirtualPeripheralHandle {
        Objects.requireNonNull(id, "id");
    }
}
